package com.moneylens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Serialized statistical model. One document per model slot; the blob format belongs to the classifier.
 */
@Document(collection = "classifier_models")
@NoArgsConstructor
@Getter
@Setter
public class ClassifierModelDocument {

    public static final String CURRENT = "current";

    @Id
    private String id;
    private String format;
    private String blob;
    private Instant savedAt;
}
