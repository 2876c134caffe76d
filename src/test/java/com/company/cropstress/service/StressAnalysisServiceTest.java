package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.AnomalyRecord;
import com.company.cropstress.domain.FieldStressReport;
import com.company.cropstress.domain.RangeStatistics;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.StressCluster;
import com.company.cropstress.domain.StressSummary;
import com.company.cropstress.domain.enums.Band;
import com.company.cropstress.domain.enums.PipelineStage;
import com.company.cropstress.domain.enums.StressCategory;
import com.company.cropstress.domain.enums.StressLevel;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.encoder.EncoderModel;
import com.company.cropstress.encoder.SpatioTemporalEncoder;
import com.company.cropstress.event.AnalysisCompletedEvent;
import com.company.cropstress.event.AnalysisFailedEvent;
import com.company.cropstress.event.AnalysisStartedEvent;
import com.company.cropstress.event.PipelineStageCompletedEvent;
import com.company.cropstress.exception.InsufficientDataException;
import com.company.cropstress.exception.MissingBandException;
import com.company.cropstress.exception.NoValidPatchesException;
import com.company.cropstress.support.SyntheticFieldFactory;
import com.company.cropstress.support.TestEncoders;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class StressAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private final PipelineProperties properties = new PipelineProperties();
    private final EncoderModel model = TestEncoders.smallModel();
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private ApplicationEventPublisher eventPublisher;
    private StressAnalysisService service;

    @BeforeEach
    void setUp() {
        eventPublisher = mock(ApplicationEventPublisher.class);
        service = newService(eventPublisher);
    }

    private StressAnalysisService newService(ApplicationEventPublisher publisher) {
        TemporalStatisticsAggregator aggregator = new TemporalStatisticsAggregator(properties);
        return new StressAnalysisService(
                new IndexCalculator(properties),
                aggregator,
                new PatchPreprocessor(properties),
                new SpatioTemporalEncoder(model, properties),
                new StressClusteringService(properties, new ClusterProfiler(aggregator)),
                new AnomalyDetector(properties),
                new AnalysisDeduplicator(new SimpleMeterRegistry()),
                publisher,
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void producesCompleteReport() {
        RasterStack stack = SyntheticFieldFactory.field(36, 4, 99L);

        FieldStressReport report = service.analyze(stack, SyntheticFieldFactory.metadata("field-36"));

        assertThat(report.getField().getFieldId()).isEqualTo("field-36");
        assertThat(report.getWindow().getSceneCount()).isEqualTo(4);
        assertThat(report.getWindow().getFirstAcquisition()).isEqualTo(SyntheticFieldFactory.FIRST_ACQUISITION);
        assertThat(report.getIndexSummaries()).hasSize(VegetationIndex.values().length);

        assertThat(report.getPatches().getTotalPatches()).isEqualTo(64);
        assertThat(report.getPatches().getValidPatches()).isEqualTo(64);
        assertThat(report.getPatches().getNote()).isEqualTo("0 of 64 patches excluded for insufficient data");

        assertThat(report.getClusters()).extracting(StressCluster::getLevel)
                .containsExactly(StressLevel.LOW, StressLevel.MODERATE, StressLevel.HIGH);
        assertThat(report.getAnomalies()).hasSize(64);
        assertThat(report.anomalousCount()).isEqualTo(6);
        assertThat(report.getClusters().stream().mapToInt(StressCluster::getAnomalousPatchCount).sum()).isEqualTo(6);
        assertThat(report.getAnomalies()).allMatch(a -> a.getStressLevel() != null);

        assertThat(report.getEncoderFingerprint()).isEqualTo(model.getFingerprint());
        assertThat(report.getClusteringSeed()).isEqualTo(42L);
        assertThat(report.getGeneratedAt()).isEqualTo(NOW);
    }

    @Test
    void identicalInputsGiveByteIdenticalJson() throws Exception {
        RasterStack stack = SyntheticFieldFactory.field(24, 3, 5L);

        String first = objectMapper.writeValueAsString(service.analyze(stack, SyntheticFieldFactory.metadata("f")));
        String second = objectMapper.writeValueAsString(
                newService(mock(ApplicationEventPublisher.class)).analyze(stack, SyntheticFieldFactory.metadata("f")));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void emitsStageEventsInOrder() {
        service.analyze(SyntheticFieldFactory.field(24, 3, 5L), SyntheticFieldFactory.metadata("f"));

        List<Object> events = publishedEvents();
        assertThat(events.get(0)).isInstanceOf(AnalysisStartedEvent.class);
        assertThat(events.get(events.size() - 1)).isInstanceOf(AnalysisCompletedEvent.class);
        assertThat(events.stream()
                .filter(PipelineStageCompletedEvent.class::isInstance)
                .map(e -> ((PipelineStageCompletedEvent) e).getStage())
                .toList())
                .containsExactly(PipelineStage.values());
    }

    @Test
    void missingBandFailsBeforePatchGeneration() {
        RasterStack stack = SyntheticFieldFactory.field(24, 3, 5L, EnumSet.of(Band.B11), Set.of());

        assertThatThrownBy(() -> service.analyze(stack, SyntheticFieldFactory.metadata("f")))
                .isInstanceOf(MissingBandException.class);

        List<Object> events = publishedEvents();
        assertThat(events).noneMatch(PipelineStageCompletedEvent.class::isInstance);
        AnalysisFailedEvent failed = (AnalysisFailedEvent) events.get(events.size() - 1);
        assertThat(failed.getStage()).isEqualTo(PipelineStage.VALIDATION);
    }

    @Test
    void fullyObscuredFieldHasNoValidPatches() {
        RasterStack stack = SyntheticFieldFactory.field(16, 3, 5L, EnumSet.noneOf(Band.class), Set.of(0, 1, 2));

        assertThatThrownBy(() -> service.analyze(stack, SyntheticFieldFactory.metadata("cloudy")))
                .isInstanceOf(NoValidPatchesException.class)
                .hasMessageContaining("cloudy");
    }

    @Test
    void fieldSmallerThanPatchHasNoValidPatches() {
        RasterStack stack = SyntheticFieldFactory.field(6, 2, 5L);

        assertThatThrownBy(() -> service.analyze(stack, SyntheticFieldFactory.metadata("tiny")))
                .isInstanceOf(NoValidPatchesException.class);
    }

    @Test
    void accountsForEveryGeneratedPatch() {
        RasterStack stack = SyntheticFieldFactory.field(24, 3, 5L);

        FieldStressReport report = service.analyzeOnce(stack, SyntheticFieldFactory.metadata("f"));

        assertThat(report.getPatches().getExcludedPatches()).isZero();
        assertThat(report.getPatches().getExcludedAnchors()).isEmpty();
        assertThat(report.getAnomalies()).extracting(AnomalyRecord::getPatchOrdinal)
                .isSorted()
                .hasSize(25);
    }

    @Test
    void reportSummarizesPatchStress() {
        FieldStressReport report = service.analyze(SyntheticFieldFactory.field(36, 4, 99L),
                SyntheticFieldFactory.metadata("field-36"));

        StressSummary summary = report.getStressSummary();
        assertThat(summary.getUnscoredPatches()).isZero();
        assertThat(summary.getDistribution()).containsOnlyKeys(StressCategory.values());
        assertThat(summary.getDistribution().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(64);
        RangeStatistics overall = summary.getOverallStress();
        assertThat(overall.getCount()).isEqualTo(64);
        assertThat(overall.getMin()).isLessThanOrEqualTo(overall.getMean());
        assertThat(overall.getMean()).isLessThanOrEqualTo(overall.getMax());

        for (AnomalyRecord record : report.getAnomalies()) {
            assertThat(record.getStressScore()).isBetween(overall.getMin(), overall.getMax());
            assertThat(record.getStressCategory()).isEqualTo(StressCategory.forScore(record.getStressScore()));
        }
        for (StressCluster cluster : report.getClusters()) {
            assertThat(cluster.getStressScoreSpread().getCount()).isEqualTo(cluster.getPatchCount());
            RangeStatistics red = cluster.getBandStatistics().get(Band.B04);
            assertThat(red.getMin()).isLessThanOrEqualTo(red.getMean());
            assertThat(red.getMax()).isGreaterThanOrEqualTo(red.getMean());
        }
        assertThat(report.getClusters().get(0).getStressScoreSpread().getMean())
                .isLessThan(report.getClusters().get(2).getStressScoreSpread().getMean());

        assertThat(report.getAnomalySummary().getTotalAnomalies()).isEqualTo(6);
        assertThat(report.getAnomalySummary().getAnomalyPercentage()).isCloseTo(9.375, within(1e-12));
    }

    @Test
    void partiallyMaskedColumnsExcludeOnlyMostlyObscuredPatches() {
        RasterStack stack = SyntheticFieldFactory.withMaskedColumns(
                SyntheticFieldFactory.field(40, 3, 17L), 0, 12, Set.of(0, 1));

        FieldStressReport report = service.analyze(stack, SyntheticFieldFactory.metadata("edge-cloud"));

        assertThat(report.getPatches().getTotalPatches()).isEqualTo(81);
        assertThat(report.getPatches().getNote()).isEqualTo("18 of 81 patches excluded for insufficient data");
        assertThat(report.getPatches().getValidPatches()).isEqualTo(63);
        assertThat(report.getPatches().getExcludedAnchors())
                .hasSize(18)
                .allMatch(anchor -> anchor.getCol() < 8);
        assertThat(report.getAnomalies()).hasSize(63);
        assertThat(report.anomalousCount()).isEqualTo(6);
    }

    @Test
    void tooFewValidPatchesFailAtClustering() {
        // the left column of patches is fully masked, leaving two valid patches
        RasterStack stack = SyntheticFieldFactory.withMaskedColumns(
                SyntheticFieldFactory.field(12, 3, 5L), 0, 8, Set.of(0, 1, 2));

        assertThatThrownBy(() -> service.analyze(stack, SyntheticFieldFactory.metadata("strip")))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("at least 3");

        List<Object> events = publishedEvents();
        assertThat(events).noneMatch(AnalysisCompletedEvent.class::isInstance);
        AnalysisFailedEvent failed = (AnalysisFailedEvent) events.get(events.size() - 1);
        assertThat(failed.getStage()).isEqualTo(PipelineStage.CLUSTERING);
        assertThat(failed.getCause()).isInstanceOf(InsufficientDataException.class);
    }

    private List<Object> publishedEvents() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues();
    }
}
