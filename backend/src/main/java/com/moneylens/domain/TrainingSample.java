package com.moneylens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Labeled description for the statistical classifier. Append-only: samples are never updated.
 */
@Document(collection = "training_samples")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TrainingSample {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String description;
    private String category;
    private String subcategory;
    @Field("isManual")
    private boolean manual;
    private Instant timestamp;

    public static TrainingSample of(String description, String category, String subcategory, boolean manual, Instant timestamp) {
        TrainingSample s = new TrainingSample();
        s.setDescription(description);
        s.setCategory(category);
        s.setSubcategory(subcategory);
        s.setManual(manual);
        s.setTimestamp(timestamp);
        return s;
    }
}
