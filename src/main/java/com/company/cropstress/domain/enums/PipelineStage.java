package com.company.cropstress.domain.enums;

public enum PipelineStage {
    VALIDATION,
    INDICES,
    TEMPORAL_STATISTICS,
    PATCHES,
    ENCODING,
    CLUSTERING,
    ANOMALIES,
    REPORT;

    public String metricTag() {
        return name().toLowerCase();
    }
}
