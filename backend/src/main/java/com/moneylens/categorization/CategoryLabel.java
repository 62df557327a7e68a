package com.moneylens.categorization;

/**
 * Category/subcategory pair produced by a classification strategy.
 */
public record CategoryLabel(String category, String subcategory) {

    private static final String SEPARATOR = "/";

    /**
     * Composite label used as the statistical classifier's class name, e.g. "Utilities/Electricity".
     */
    public String toTrainingLabel() {
        if (subcategory == null || subcategory.isBlank()) {
            return category;
        }
        return category + SEPARATOR + subcategory;
    }

    /**
     * Split a composite label on the first separator. A label without subcategory gets {@code fallbackSubcategory}.
     */
    public static CategoryLabel fromTrainingLabel(String label, String fallbackSubcategory) {
        int i = label.indexOf(SEPARATOR);
        if (i < 0) {
            return new CategoryLabel(label, fallbackSubcategory);
        }
        String sub = label.substring(i + 1);
        return new CategoryLabel(label.substring(0, i), sub.isBlank() ? fallbackSubcategory : sub);
    }
}
