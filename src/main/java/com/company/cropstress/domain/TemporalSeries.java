package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.TrendDirection;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ordered observations of one index (one pixel, or one aggregated series) and their trend summary.
 */
@Value
@Builder
@JsonPropertyOrder({"elapsedDays", "values", "rollingMean", "latest", "change", "slopePerDay", "direction", "validPoints"})
public class TemporalSeries {
    List<Double> elapsedDays;
    List<Double> values;
    List<Double> rollingMean;
    double latest;
    double change;
    double slopePerDay;
    TrendDirection direction;
    int validPoints;
}
