package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.IndexRaster;
import com.company.cropstress.domain.IndexStack;
import com.company.cropstress.domain.IndexSummary;
import com.company.cropstress.domain.PixelTrendStatistics;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.TemporalSeries;
import com.company.cropstress.domain.enums.TrendDirection;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.support.SyntheticFieldFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TemporalStatisticsAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private final TemporalStatisticsAggregator aggregator = new TemporalStatisticsAggregator(new PipelineProperties());

    @Test
    void slopeIsMeasuredPerElapsedDay() {
        // irregular spacing: 0, 10 and 30 days
        List<Instant> times = List.of(T0, T0.plus(Duration.ofDays(10)), T0.plus(Duration.ofDays(30)));
        double[] values = {0.80, 0.70, 0.50};

        TemporalSeries series = aggregator.summarize(times, values);

        assertThat(series.getSlopePerDay()).isCloseTo(-0.01, within(1e-9));
        assertThat(series.getDirection()).isEqualTo(TrendDirection.DECREASING);
        assertThat(series.getLatest()).isEqualTo(0.50);
        assertThat(series.getChange()).isCloseTo(-0.30, within(1e-12));
        assertThat(series.getElapsedDays()).containsExactly(0.0, 10.0, 30.0);
        assertThat(series.getValidPoints()).isEqualTo(3);
    }

    @Test
    void smallSlopeIsStable() {
        List<Instant> times = List.of(T0, T0.plus(Duration.ofDays(100)));

        TemporalSeries series = aggregator.summarize(times, new double[]{0.60, 0.61});

        assertThat(series.getSlopePerDay()).isCloseTo(0.0001, within(1e-12));
        assertThat(series.getDirection()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void missingObservationsAreSkipped() {
        List<Instant> times = List.of(T0, T0.plus(Duration.ofDays(5)), T0.plus(Duration.ofDays(10)),
                T0.plus(Duration.ofDays(15)));

        TemporalSeries series = aggregator.summarize(times, new double[]{Double.NaN, 0.2, 0.4, Double.NaN});

        assertThat(series.getLatest()).isEqualTo(0.4);
        assertThat(series.getChange()).isCloseTo(0.2, within(1e-12));
        assertThat(series.getSlopePerDay()).isCloseTo(0.04, within(1e-12));
        assertThat(series.getDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(series.getValidPoints()).isEqualTo(2);
    }

    @Test
    void fewerThanTwoPointsIsUndetermined() {
        List<Instant> times = List.of(T0, T0.plus(Duration.ofDays(5)));

        TemporalSeries series = aggregator.summarize(times, new double[]{Double.NaN, 0.3});

        assertThat(series.getDirection()).isEqualTo(TrendDirection.UNDETERMINED);
        assertThat(series.getSlopePerDay()).isNaN();
        assertThat(series.getChange()).isNaN();
        assertThat(series.getLatest()).isEqualTo(0.3);
    }

    @Test
    void rollingMeanIgnoresNaN() {
        List<Double> rolling = aggregator.rollingMean(new double[]{1.0, Double.NaN, 3.0, 5.0}, 3);

        assertThat(rolling).containsExactly(1.0, 1.0, 2.0, 4.0);
    }

    @Test
    void pixelGridsAndDirectionCounts() {
        List<IndexRaster> series = List.of(
                raster(T0, new double[]{0.1, 0.5, Double.NaN, 0.3}),
                raster(T0.plus(Duration.ofDays(10)), new double[]{0.3, 0.4, Double.NaN, 0.3}),
                raster(T0.plus(Duration.ofDays(20)), new double[]{0.5, 0.3, 0.2, 0.3}));

        PixelTrendStatistics stats = aggregator.aggregate(VegetationIndex.NDVI, series);

        assertThat(stats.direction(0, 0)).isEqualTo(TrendDirection.INCREASING);
        assertThat(stats.direction(0, 1)).isEqualTo(TrendDirection.DECREASING);
        assertThat(stats.direction(1, 0)).isEqualTo(TrendDirection.UNDETERMINED);
        assertThat(stats.direction(1, 1)).isEqualTo(TrendDirection.STABLE);
        assertThat(stats.getLatest().get(1, 0)).isEqualTo(0.2);
        assertThat(stats.getChange().get(0, 0)).isCloseTo(0.4, within(1e-12));
        assertThat(stats.getDirectionCounts())
                .containsEntry(TrendDirection.INCREASING, 1L)
                .containsEntry(TrendDirection.DECREASING, 1L)
                .containsEntry(TrendDirection.STABLE, 1L)
                .containsEntry(TrendDirection.UNDETERMINED, 1L);
    }

    @Test
    void seriesAtMatchesPixelGrids() {
        IndexStack indexStack = new IndexCalculator(new PipelineProperties())
                .calculateAll(SyntheticFieldFactory.field(9, 4, 3L));
        List<IndexRaster> ndvi = indexStack.series(VegetationIndex.NDVI);

        PixelTrendStatistics grids = aggregator.aggregate(VegetationIndex.NDVI, ndvi);
        TemporalSeries pixel = aggregator.seriesAt(ndvi, 8, 2);

        assertThat(pixel.getSlopePerDay()).isEqualTo(grids.getSlopePerDay().get(8, 2));
        assertThat(pixel.getDirection()).isEqualTo(grids.direction(8, 2));
        // bottom zone declines over time
        assertThat(pixel.getDirection()).isEqualTo(TrendDirection.DECREASING);
    }

    @Test
    void indexSummaryUsesFieldMeans() {
        List<IndexRaster> series = List.of(
                raster(T0, new double[]{0.2, 0.4, 0.6, Double.NaN}),
                raster(T0.plus(Duration.ofDays(10)), new double[]{0.1, 0.2, 0.3, 0.2}));
        PixelTrendStatistics grids = aggregator.aggregate(VegetationIndex.NDVI, series);

        IndexSummary summary = aggregator.summarizeIndex(VegetationIndex.NDVI, series, grids);

        assertThat(summary.getEarliest().getMean()).isCloseTo(0.4, within(1e-12));
        assertThat(summary.getEarliest().getValidCount()).isEqualTo(3);
        assertThat(summary.getLatest().getMean()).isCloseTo(0.2, within(1e-12));
        assertThat(summary.getChange()).isCloseTo(-0.2, within(1e-12));
        assertThat(summary.getMaxInField()).isEqualTo(0.3);
        assertThat(summary.getMinInField()).isEqualTo(0.1);
        assertThat(summary.getMeanValuesOverTime()).hasSize(2);
        assertThat(summary.getFieldTrend().getDirection()).isEqualTo(TrendDirection.DECREASING);
    }

    private static IndexRaster raster(Instant at, double[] values) {
        return new IndexRaster(VegetationIndex.NDVI, at, RasterGrid.ofRowMajor(2, 2, values));
    }
}
