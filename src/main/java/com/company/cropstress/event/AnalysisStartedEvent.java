package com.company.cropstress.event;

import com.company.cropstress.domain.FieldMetadata;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnalysisStartedEvent {
    private final FieldMetadata field;
    private final int sceneCount;
}
