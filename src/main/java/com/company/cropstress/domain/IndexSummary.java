package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.TrendDirection;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Field-level summary of one index over the analysis window.
 */
@Value
@Builder
@JsonPropertyOrder({"index", "latest", "earliest", "meanValuesOverTime", "change",
        "maxInField", "minInField", "fieldTrend", "pixelTrends"})
public class IndexSummary {
    VegetationIndex index;
    ValueStatistics latest;
    ValueStatistics earliest;
    List<Double> meanValuesOverTime;
    double change;
    double maxInField;
    double minInField;
    TemporalSeries fieldTrend;
    Map<TrendDirection, Long> pixelTrends;
}
