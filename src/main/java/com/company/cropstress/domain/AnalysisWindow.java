package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonPropertyOrder({"firstAcquisition", "lastAcquisition", "sceneCount", "acquisitionTimes"})
public class AnalysisWindow {
    Instant firstAcquisition;
    Instant lastAcquisition;
    int sceneCount;
    List<Instant> acquisitionTimes;
}
