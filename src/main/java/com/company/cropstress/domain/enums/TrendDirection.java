package com.company.cropstress.domain.enums;

public enum TrendDirection {
    INCREASING("Index rising faster than the stability threshold"),
    DECREASING("Index falling faster than the stability threshold"),
    STABLE("Slope magnitude below the stability threshold"),
    UNDETERMINED("Fewer than two valid observations");

    private final String description;

    TrendDirection(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static TrendDirection fromSlope(double slopePerDay, double stableThreshold) {
        if (Double.isNaN(slopePerDay)) {
            return UNDETERMINED;
        }
        if (Math.abs(slopePerDay) < stableThreshold) {
            return STABLE;
        }
        return slopePerDay > 0 ? INCREASING : DECREASING;
    }
}
