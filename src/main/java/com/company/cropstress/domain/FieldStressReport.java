package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.VegetationIndex;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Terminal artifact of one analysis: the only object handed to narrative, visualization
 * and persistence collaborators.
 */
@Value
@Builder
@JsonPropertyOrder({"field", "window", "indexSummaries", "stressSummary", "clusters", "anomalySummary",
        "anomalies", "patches", "encoderFingerprint", "clusteringSeed", "generatedAt"})
public class FieldStressReport {
    FieldMetadata field;
    AnalysisWindow window;
    Map<VegetationIndex, IndexSummary> indexSummaries;
    StressSummary stressSummary;
    List<StressCluster> clusters;
    AnomalySummary anomalySummary;
    List<AnomalyRecord> anomalies;
    PatchAccounting patches;
    String encoderFingerprint;
    long clusteringSeed;
    Instant generatedAt;

    public long anomalousCount() {
        return anomalies.stream().filter(AnomalyRecord::isAnomalous).count();
    }
}
