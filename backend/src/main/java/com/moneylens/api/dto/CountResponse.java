package com.moneylens.api.dto;

/**
 * Number of items affected by a bulk operation.
 */
public record CountResponse(long count) {
}
