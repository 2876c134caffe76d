package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.IndexRaster;
import com.company.cropstress.domain.IndexStack;
import com.company.cropstress.domain.IndexSummary;
import com.company.cropstress.domain.PixelTrendStatistics;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.TemporalSeries;
import com.company.cropstress.domain.ValueStatistics;
import com.company.cropstress.domain.enums.TrendDirection;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.util.RasterMath;
import com.company.cropstress.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Time-series summaries of index values. Slopes are fitted against elapsed calendar days.
 * The output is informational and never feeds encoding or clustering.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TemporalStatisticsAggregator {

    private final PipelineProperties properties;

    /**
     * Summarizes one ordered series. Non-finite values are ignored; fewer than two valid
     * observations leave slope, change and direction undetermined.
     */
    public TemporalSeries summarize(List<Instant> times, double[] values) {
        if (times.size() != values.length) {
            throw new IllegalArgumentException("Series has " + values.length + " values for "
                    + times.size() + " acquisition times");
        }

        double[] days = TimeUtils.elapsedDays(times);
        SimpleRegression regression = new SimpleRegression();
        Trend trend = fit(days, values, regression);

        List<Double> dayList = new ArrayList<>(days.length);
        List<Double> valueList = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            dayList.add(days[i]);
            valueList.add(values[i]);
        }

        return TemporalSeries.builder()
                .elapsedDays(dayList)
                .values(valueList)
                .rollingMean(rollingMean(values, properties.getRollingWindow()))
                .latest(trend.latest)
                .change(trend.change)
                .slopePerDay(trend.slope)
                .direction(TrendDirection.fromSlope(trend.slope, properties.getStableSlopePerDay()))
                .validPoints(trend.validPoints)
                .build();
    }

    /**
     * Per-pixel latest/change/slope/direction grids for one index.
     */
    public PixelTrendStatistics aggregate(VegetationIndex index, List<IndexRaster> series) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("No rasters for index " + index);
        }

        List<Instant> times = series.stream().map(IndexRaster::getAcquiredAt).toList();
        double[] days = TimeUtils.elapsedDays(times);
        RasterGrid first = series.get(0).getGrid();
        int height = first.getHeight();
        int width = first.getWidth();

        double[] latest = new double[height * width];
        double[] change = new double[height * width];
        double[] slope = new double[height * width];
        TrendDirection[] directions = new TrendDirection[height * width];

        SimpleRegression regression = new SimpleRegression();
        double[] pixelSeries = new double[series.size()];

        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                for (int t = 0; t < series.size(); t++) {
                    pixelSeries[t] = series.get(t).getGrid().get(r, c);
                }
                Trend trend = fit(days, pixelSeries, regression);
                int i = r * width + c;
                latest[i] = trend.latest;
                change[i] = trend.change;
                slope[i] = trend.slope;
                directions[i] = TrendDirection.fromSlope(trend.slope, properties.getStableSlopePerDay());
            }
        }

        return new PixelTrendStatistics(index,
                RasterGrid.ofRowMajor(height, width, latest),
                RasterGrid.ofRowMajor(height, width, change),
                RasterGrid.ofRowMajor(height, width, slope),
                directions);
    }

    public Map<VegetationIndex, PixelTrendStatistics> aggregateAll(IndexStack indexStack) {
        VegetationIndex[] indices = VegetationIndex.values();
        PixelTrendStatistics[] results = new PixelTrendStatistics[indices.length];

        IntStream range = IntStream.range(0, indices.length);
        if (properties.isParallel()) {
            range = range.parallel();
        }
        range.forEach(i -> results[i] = aggregate(indices[i], indexStack.series(indices[i])));

        Map<VegetationIndex, PixelTrendStatistics> byIndex = new EnumMap<>(VegetationIndex.class);
        for (int i = 0; i < indices.length; i++) {
            byIndex.put(indices[i], results[i]);
        }
        return byIndex;
    }

    /**
     * Field-level summary of one index: earliest and latest scene statistics, the series of
     * per-scene field means with its trend, and the pixel trend counts.
     */
    public IndexSummary summarizeIndex(VegetationIndex index, List<IndexRaster> series,
                                       PixelTrendStatistics pixelTrends) {
        List<Instant> times = series.stream().map(IndexRaster::getAcquiredAt).toList();
        List<ValueStatistics> perScene = series.stream()
                .map(raster -> RasterMath.describe(raster.getGrid().toArray()))
                .toList();

        double[] means = perScene.stream().mapToDouble(ValueStatistics::getMean).toArray();
        TemporalSeries fieldTrend = summarize(times, means);
        ValueStatistics latest = perScene.get(perScene.size() - 1);

        return IndexSummary.builder()
                .index(index)
                .latest(latest)
                .earliest(perScene.get(0))
                .meanValuesOverTime(fieldTrend.getValues())
                .change(fieldTrend.getChange())
                .maxInField(latest.getMax())
                .minInField(latest.getMin())
                .fieldTrend(fieldTrend)
                .pixelTrends(pixelTrends.getDirectionCounts())
                .build();
    }

    /**
     * Full series of a single pixel, for callers that need more than the summary grids.
     */
    public TemporalSeries seriesAt(List<IndexRaster> series, int row, int col) {
        List<Instant> times = series.stream().map(IndexRaster::getAcquiredAt).toList();
        double[] values = new double[series.size()];
        for (int t = 0; t < values.length; t++) {
            values[t] = series.get(t).getGrid().get(row, col);
        }
        return summarize(times, values);
    }

    List<Double> rollingMean(double[] values, int window) {
        List<Double> rolling = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double sum = 0.0;
            int count = 0;
            for (int j = Math.max(0, i - window + 1); j <= i; j++) {
                if (Double.isFinite(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            rolling.add(count == 0 ? Double.NaN : sum / count);
        }
        return rolling;
    }

    private Trend fit(double[] days, double[] values, SimpleRegression regression) {
        regression.clear();
        double firstValid = Double.NaN;
        double lastValid = Double.NaN;
        int valid = 0;

        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                if (valid == 0) {
                    firstValid = values[i];
                }
                lastValid = values[i];
                regression.addData(days[i], values[i]);
                valid++;
            }
        }

        if (valid < 2) {
            return new Trend(lastValid, Double.NaN, Double.NaN, valid);
        }
        return new Trend(lastValid, lastValid - firstValid, regression.getSlope(), valid);
    }

    private static final class Trend {
        final double latest;
        final double change;
        final double slope;
        final int validPoints;

        Trend(double latest, double change, double slope, int validPoints) {
            this.latest = latest;
            this.change = change;
            this.slope = slope;
            this.validPoints = validPoints;
        }
    }
}
