package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * NaN-aware summary of a set of values. All fields are NaN when no finite value exists.
 */
@Value
@Builder
@JsonPropertyOrder({"mean", "std", "min", "max", "median", "validCount"})
public class ValueStatistics {
    double mean;
    double std;
    double min;
    double max;
    double median;
    long validCount;

    public static ValueStatistics empty() {
        return ValueStatistics.builder()
                .mean(Double.NaN)
                .std(Double.NaN)
                .min(Double.NaN)
                .max(Double.NaN)
                .median(Double.NaN)
                .validCount(0)
                .build();
    }
}
