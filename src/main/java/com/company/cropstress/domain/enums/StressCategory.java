package com.company.cropstress.domain.enums;

/**
 * Absolute band of a stress score, independent of how the field's groups rank.
 */
public enum StressCategory {
    LOW(0.25),
    MODERATE(0.50),
    HIGH(0.75),
    SEVERE(Double.POSITIVE_INFINITY);

    private final double upperBound;

    StressCategory(double upperBound) {
        this.upperBound = upperBound;
    }

    /**
     * @return the first category whose exclusive upper bound exceeds the score, or null for NaN
     */
    public static StressCategory forScore(double score) {
        if (Double.isNaN(score)) {
            return null;
        }
        for (StressCategory category : values()) {
            if (score < category.upperBound) {
                return category;
            }
        }
        return SEVERE;
    }
}
