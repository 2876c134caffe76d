package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Streaming summary of finite values. Mean, std, min and max are NaN when the count is zero.
 */
@Value
@JsonPropertyOrder({"mean", "std", "min", "max", "count"})
public class RangeStatistics {
    double mean;
    double std;
    double min;
    double max;
    long count;
}
