package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.StressCategory;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Field-wide distribution of per-patch stress scores. Patches without a finite score are
 * counted as unscored and left out of both the statistics and the category counts.
 */
@Value
@Builder
@JsonPropertyOrder({"overallStress", "distribution", "unscoredPatches"})
public class StressSummary {
    RangeStatistics overallStress;
    Map<StressCategory, Integer> distribution;
    int unscoredPatches;
}
