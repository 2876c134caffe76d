package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonPropertyOrder({"totalAnomalies", "anomalyPercentage"})
public class AnomalySummary {
    int totalAnomalies;
    /** Flagged patches as a percentage of the scored ones; 0 when nothing was scored. */
    double anomalyPercentage;
}
