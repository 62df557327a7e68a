package com.moneylens.categorization.semantic;

/**
 * Closest reference phrase for a text.
 */
public record SemanticMatch(String category, String subcategory, double similarityScore, String bestExample) {
}
