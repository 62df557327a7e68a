package com.moneylens.categorization.model;

import java.util.Optional;

/**
 * Test double standing in for classifier_models across simulated restarts.
 */
class InMemoryModelStore implements ModelStore {

    private String blob;
    private int saves;

    InMemoryModelStore() {
    }

    InMemoryModelStore(String blob) {
        this.blob = blob;
    }

    @Override
    public Optional<String> load() {
        return Optional.ofNullable(blob);
    }

    @Override
    public void save(String blob) {
        this.blob = blob;
        saves++;
    }

    int saves() {
        return saves;
    }
}
