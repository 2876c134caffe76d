package com.company.cropstress.domain.enums;

public enum StressLevel {
    LOW("Lowest mean stress score of the field"),
    MODERATE("Intermediate mean stress score"),
    HIGH("Highest mean stress score of the field");

    private final String description;

    StressLevel(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Level for the n-th group once groups are sorted by ascending stress score.
     */
    public static StressLevel forRank(int zeroBasedRank) {
        StressLevel[] levels = values();
        if (zeroBasedRank < 0 || zeroBasedRank >= levels.length) {
            throw new IllegalArgumentException("No stress level for rank " + zeroBasedRank);
        }
        return levels[zeroBasedRank];
    }
}
