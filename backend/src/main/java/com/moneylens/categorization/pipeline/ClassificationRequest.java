package com.moneylens.categorization.pipeline;

/**
 * Input to {@link ClassificationPipeline#classify}. Null strategy switches fall back to configuration.
 */
public record ClassificationRequest(String description, String merchant, Boolean useAi, Boolean useSemantic) {

    public static ClassificationRequest of(String description) {
        return new ClassificationRequest(description, null, null, null);
    }

    public static ClassificationRequest of(String description, String merchant) {
        return new ClassificationRequest(description, merchant, null, null);
    }

    /** Description followed by merchant, as the strategies see it. */
    public String text() {
        String d = description == null ? "" : description;
        if (merchant == null || merchant.isBlank()) {
            return d.strip();
        }
        return (d + " " + merchant).strip();
    }
}
