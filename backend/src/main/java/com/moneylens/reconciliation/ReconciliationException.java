package com.moneylens.reconciliation;

import lombok.Getter;

/**
 * Manual reconciliation request that cannot be applied. API layer maps NOT_FOUND to 404, ALREADY_MATCHED to 409.
 */
@Getter
public class ReconciliationException extends RuntimeException {

    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String ALREADY_MATCHED = "ALREADY_MATCHED";

    private final String errorCode;

    public ReconciliationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
