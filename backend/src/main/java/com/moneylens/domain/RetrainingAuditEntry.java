package com.moneylens.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One retraining attempt. Append-only audit trail.
 */
@Document(collection = "retraining_audit")
@NoArgsConstructor
@Getter
@Setter
public class RetrainingAuditEntry {

    @Id
    private String id;
    private Instant timestamp;
    private String modelType;
    private int samplesUsed;
    private double accuracy;
    private boolean success;
    private String message;
}
