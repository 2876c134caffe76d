package com.company.cropstress.event;

import com.company.cropstress.domain.FieldStressReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnalysisCompletedEvent {
    private final FieldStressReport report;
    private final long durationMs;
}
