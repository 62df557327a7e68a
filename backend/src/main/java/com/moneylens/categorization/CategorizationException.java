package com.moneylens.categorization;

import lombok.Getter;

/**
 * Thrown by categorization services when a request refers to missing data or is malformed.
 * API layer maps TRANSACTION_NOT_FOUND to 404 and INVALID_SAMPLE to 400.
 */
@Getter
public class CategorizationException extends RuntimeException {

    public static final String TRANSACTION_NOT_FOUND = "TRANSACTION_NOT_FOUND";
    public static final String INVALID_SAMPLE = "INVALID_SAMPLE";

    private final String errorCode;

    public CategorizationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
