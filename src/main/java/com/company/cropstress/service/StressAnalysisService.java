package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.AnalysisKey;
import com.company.cropstress.domain.AnalysisWindow;
import com.company.cropstress.domain.AnomalyRecord;
import com.company.cropstress.domain.AnomalySummary;
import com.company.cropstress.domain.ClusteringResult;
import com.company.cropstress.domain.EncodingResult;
import com.company.cropstress.domain.FieldMetadata;
import com.company.cropstress.domain.FieldStressReport;
import com.company.cropstress.domain.IndexStack;
import com.company.cropstress.domain.IndexSummary;
import com.company.cropstress.domain.Patch;
import com.company.cropstress.domain.PatchAccounting;
import com.company.cropstress.domain.PatchSet;
import com.company.cropstress.domain.PixelTrendStatistics;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.StressCluster;
import com.company.cropstress.domain.StressSummary;
import com.company.cropstress.domain.enums.PipelineStage;
import com.company.cropstress.domain.enums.StressCategory;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.encoder.SpatioTemporalEncoder;
import com.company.cropstress.event.AnalysisCompletedEvent;
import com.company.cropstress.event.AnalysisFailedEvent;
import com.company.cropstress.event.AnalysisStartedEvent;
import com.company.cropstress.event.PipelineStageCompletedEvent;
import com.company.cropstress.exception.NoValidPatchesException;
import com.company.cropstress.util.RasterMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Runs the full field analysis: indices, temporal statistics, patches, encoding, clustering and
 * anomaly scoring. Any failing stage aborts the call; no partial report is produced.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StressAnalysisService {

    private static final String MDC_FIELD_ID_KEY = "fieldId";

    private final IndexCalculator indexCalculator;
    private final TemporalStatisticsAggregator temporalAggregator;
    private final PatchPreprocessor patchPreprocessor;
    private final SpatioTemporalEncoder encoder;
    private final StressClusteringService clusteringService;
    private final AnomalyDetector anomalyDetector;
    private final AnalysisDeduplicator deduplicator;
    private final ApplicationEventPublisher eventPublisher;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Same as {@link #analyze} but concurrent requests for the same field, date and index set
     * share one computation.
     */
    public FieldStressReport analyzeOnce(RasterStack stack, FieldMetadata field) {
        return deduplicator.execute(AnalysisKey.of(field), () -> analyze(stack, field));
    }

    public FieldStressReport analyze(RasterStack stack, FieldMetadata field) {
        Objects.requireNonNull(stack, "stack");
        Objects.requireNonNull(field, "field");

        String fieldId = field.getFieldId();
        MDC.put(MDC_FIELD_ID_KEY, fieldId);
        long started = System.nanoTime();
        StageRunner stages = new StageRunner(fieldId);

        log.info("Starting stress analysis for field {} ({} scenes, {}x{})",
                fieldId, stack.sceneCount(), stack.getHeight(), stack.getWidth());
        eventPublisher.publishEvent(new AnalysisStartedEvent(field, stack.sceneCount()));

        try {
            stages.run(PipelineStage.VALIDATION, () -> {
                indexCalculator.validateBands(stack);
                return stack;
            }, RasterStack::sceneCount);

            IndexStack indexStack = stages.run(PipelineStage.INDICES,
                    () -> indexCalculator.calculateAll(stack),
                    s -> s.sceneCount() * VegetationIndex.values().length);

            Map<VegetationIndex, IndexSummary> summaries = stages.run(PipelineStage.TEMPORAL_STATISTICS,
                    () -> summarizeIndices(indexStack), Map::size);

            PatchSet patchSet = stages.run(PipelineStage.PATCHES,
                    () -> patchPreprocessor.extract(indexStack), p -> p.getPatches().size());
            List<Patch> candidates = patchSet.valid();
            if (candidates.isEmpty()) {
                throw new NoValidPatchesException(fieldId, patchSet.getPatches().size());
            }

            EncodingResult encoding = stages.run(PipelineStage.ENCODING,
                    () -> encoder.encode(candidates), e -> e.getEmbeddings().size());
            if (encoding.getEmbeddings().isEmpty()) {
                throw new NoValidPatchesException(fieldId, patchSet.getPatches().size());
            }

            ClusteringResult clustering = stages.run(PipelineStage.CLUSTERING,
                    () -> clusteringService.cluster(encoding.getEmbeddings(), stack),
                    c -> c.getClusters().size());

            List<AnomalyRecord> anomalies = stages.run(PipelineStage.ANOMALIES,
                    () -> anomalyDetector.detect(encoding.getEmbeddings(),
                            clustering.getLevelByPatch(), clustering.getScoreByPatch()),
                    records -> (int) records.stream().filter(AnomalyRecord::isAnomalous).count());

            FieldStressReport report = stages.run(PipelineStage.REPORT,
                    () -> buildReport(field, stack, summaries, patchSet, encoding, clustering, anomalies),
                    r -> 1);

            long durationMs = (System.nanoTime() - started) / 1_000_000;
            log.info("Stress analysis for field {} completed in {}ms: {} valid patches, {} anomalous",
                    fieldId, durationMs, report.getPatches().getValidPatches(), report.anomalousCount());
            eventPublisher.publishEvent(new AnalysisCompletedEvent(report, durationMs));
            return report;

        } catch (RuntimeException e) {
            log.warn("Stress analysis for field {} failed at stage {}: {}",
                    fieldId, stages.current, e.getMessage());
            eventPublisher.publishEvent(new AnalysisFailedEvent(fieldId, stages.current, e));
            throw e;
        } finally {
            MDC.remove(MDC_FIELD_ID_KEY);
        }
    }

    private Map<VegetationIndex, IndexSummary> summarizeIndices(IndexStack indexStack) {
        Map<VegetationIndex, PixelTrendStatistics> pixelTrends = temporalAggregator.aggregateAll(indexStack);
        Map<VegetationIndex, IndexSummary> summaries = new EnumMap<>(VegetationIndex.class);
        for (VegetationIndex index : VegetationIndex.values()) {
            summaries.put(index, temporalAggregator.summarizeIndex(
                    index, indexStack.series(index), pixelTrends.get(index)));
        }
        return summaries;
    }

    private FieldStressReport buildReport(FieldMetadata field, RasterStack stack,
                                          Map<VegetationIndex, IndexSummary> summaries,
                                          PatchSet patchSet, EncodingResult encoding,
                                          ClusteringResult clustering, List<AnomalyRecord> anomalies) {
        List<Patch> excluded = new ArrayList<>(patchSet.excluded());
        excluded.addAll(encoding.getExcluded());
        excluded.sort(Comparator.comparingInt(Patch::getOrdinal));

        int total = patchSet.getPatches().size();
        PatchAccounting accounting = PatchAccounting.builder()
                .patchSize(patchSet.getPatchSize())
                .stride(patchSet.getStride())
                .totalPatches(total)
                .validPatches(encoding.getEmbeddings().size())
                .excludedPatches(excluded.size())
                .note(PatchAccounting.exclusionNote(excluded.size(), total))
                .excludedAnchors(excluded.stream().map(Patch::getAnchor).toList())
                .build();

        List<StressCluster> clusters = clustering.getClusters().stream()
                .map(cluster -> cluster.withAnomalousPatchCount((int) anomalies.stream()
                        .filter(a -> a.isAnomalous() && a.getStressLevel() == cluster.getLevel())
                        .count()))
                .toList();

        int flagged = (int) anomalies.stream().filter(AnomalyRecord::isAnomalous).count();
        AnomalySummary anomalySummary = new AnomalySummary(flagged,
                anomalies.isEmpty() ? 0.0 : 100.0 * flagged / anomalies.size());

        AnalysisWindow window = AnalysisWindow.builder()
                .firstAcquisition(stack.firstAcquisition())
                .lastAcquisition(stack.lastAcquisition())
                .sceneCount(stack.sceneCount())
                .acquisitionTimes(stack.acquisitionTimes())
                .build();

        return FieldStressReport.builder()
                .field(field)
                .window(window)
                .indexSummaries(summaries)
                .stressSummary(summarizeStress(clustering.getScoreByPatch().values()))
                .clusters(clusters)
                .anomalySummary(anomalySummary)
                .anomalies(List.copyOf(anomalies))
                .patches(accounting)
                .encoderFingerprint(encoder.getModel().getFingerprint())
                .clusteringSeed(properties.getClusteringSeed())
                .generatedAt(clock.instant())
                .build();
    }

    private static StressSummary summarizeStress(Collection<Double> scores) {
        Map<StressCategory, Integer> distribution = new EnumMap<>(StressCategory.class);
        for (StressCategory category : StressCategory.values()) {
            distribution.put(category, 0);
        }
        int unscored = 0;
        for (double score : scores) {
            StressCategory category = StressCategory.forScore(score);
            if (category == null) {
                unscored++;
            } else {
                distribution.merge(category, 1, Integer::sum);
            }
        }
        return StressSummary.builder()
                .overallStress(RasterMath.summarize(scores))
                .distribution(distribution)
                .unscoredPatches(unscored)
                .build();
    }

    private final class StageRunner {
        private final String fieldId;
        private PipelineStage current = PipelineStage.VALIDATION;

        StageRunner(String fieldId) {
            this.fieldId = fieldId;
        }

        <T> T run(PipelineStage stage, Supplier<T> work, ToIntFunction<T> itemCount) {
            current = stage;
            long start = System.nanoTime();
            T result = work.get();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            int items = itemCount.applyAsInt(result);
            log.debug("Stage {} finished in {}ms ({} items)", stage, elapsedMs, items);
            eventPublisher.publishEvent(new PipelineStageCompletedEvent(fieldId, stage, elapsedMs, items));
            return result;
        }
    }
}
