package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.StressCategory;
import com.company.cropstress.domain.enums.StressLevel;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"patchOrdinal", "anchor", "score", "anomalous", "stressLevel", "stressScore", "stressCategory"})
public class AnomalyRecord {
    int patchOrdinal;
    PatchAnchor anchor;
    double score;
    boolean anomalous;
    StressLevel stressLevel;
    double stressScore;
    StressCategory stressCategory;
}
