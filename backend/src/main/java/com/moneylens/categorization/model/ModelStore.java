package com.moneylens.categorization.model;

import java.util.Optional;

/**
 * Durable slot for the serialized model. One opaque blob in, the same blob out after restart.
 */
public interface ModelStore {

    Optional<String> load();

    void save(String blob);
}
