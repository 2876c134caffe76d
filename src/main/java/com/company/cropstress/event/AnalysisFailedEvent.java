package com.company.cropstress.event;

import com.company.cropstress.domain.enums.PipelineStage;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnalysisFailedEvent {
    private final String fieldId;
    private final PipelineStage stage;
    private final Throwable cause;
}
