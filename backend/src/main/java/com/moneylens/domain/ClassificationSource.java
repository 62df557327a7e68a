package com.moneylens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which strategy produced a transaction's category.
 */
public enum ClassificationSource {
    AI("ai"),
    SEMANTIC("semantic"),
    RULE("rule"),
    DEFAULT("default"),
    MANUAL("manual");

    private final String code;

    ClassificationSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
