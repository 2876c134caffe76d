package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.Band;
import com.company.cropstress.domain.enums.StressLevel;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"level", "stressScore", "stressScoreSpread", "patchCount", "areaPercentage", "anomalousPatchCount",
        "indexStatistics", "bandStatistics", "temporalTrends", "anchors"})
public class StressCluster {
    StressLevel level;
    double stressScore;
    /** Spread of the member patches' own stress scores. */
    RangeStatistics stressScoreSpread;
    int patchCount;
    double areaPercentage;
    int anomalousPatchCount;
    Map<VegetationIndex, RangeStatistics> indexStatistics;
    Map<Band, RangeStatistics> bandStatistics;
    Map<VegetationIndex, TemporalSeries> temporalTrends;
    List<PatchAnchor> anchors;

    public StressCluster withAnomalousPatchCount(int count) {
        return toBuilder().anomalousPatchCount(count).build();
    }
}
