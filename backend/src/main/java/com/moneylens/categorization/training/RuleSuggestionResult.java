package com.moneylens.categorization.training;

import java.util.List;

public record RuleSuggestionResult(int rulesCreated, List<String> categories, String message) {
}
