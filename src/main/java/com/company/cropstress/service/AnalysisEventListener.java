package com.company.cropstress.service;

import com.company.cropstress.domain.FieldStressReport;
import com.company.cropstress.event.AnalysisCompletedEvent;
import com.company.cropstress.event.AnalysisFailedEvent;
import com.company.cropstress.event.AnalysisStartedEvent;
import com.company.cropstress.event.PipelineStageCompletedEvent;
import com.company.cropstress.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Logs analysis progress and records the pipeline metrics.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisEventListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    public void onAnalysisStarted(AnalysisStartedEvent event) {
        meterRegistry.counter("cropstress.analyses.started").increment();
    }

    @EventListener
    public void onStageCompleted(PipelineStageCompletedEvent event) {
        meterRegistry.timer("cropstress.pipeline.stage", "stage", event.getStage().metricTag())
                .record(event.getElapsedMs(), TimeUnit.MILLISECONDS);

        log.info("Field {} stage {} done in {} ({} items)", event.getFieldId(), event.getStage(),
                TimeUtils.formatDuration(event.getElapsedMs()), event.getItemCount());
    }

    @EventListener
    public void onAnalysisCompleted(AnalysisCompletedEvent event) {
        FieldStressReport report = event.getReport();
        meterRegistry.counter("cropstress.analyses.completed").increment();

        log.info("Field {} ({}) analysed in {}: clusters {}, {} anomalous patches, {}",
                report.getField().getFieldId(),
                report.getField().getCropType(),
                TimeUtils.formatDuration(event.getDurationMs()),
                report.getClusters().stream().map(c -> c.getLevel() + "=" + c.getPatchCount()).toList(),
                report.anomalousCount(),
                report.getPatches().getNote());
    }

    @EventListener
    public void onAnalysisFailed(AnalysisFailedEvent event) {
        meterRegistry.counter("cropstress.analyses.failed",
                "stage", event.getStage().metricTag(),
                "exception", event.getCause().getClass().getSimpleName()
        ).increment();

        log.warn("Field {} analysis failed at {}: {}", event.getFieldId(), event.getStage(),
                event.getCause().getMessage());
    }
}
