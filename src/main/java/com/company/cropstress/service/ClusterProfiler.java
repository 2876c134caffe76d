package com.company.cropstress.service;

import com.company.cropstress.domain.Patch;
import com.company.cropstress.domain.PatchAnchor;
import com.company.cropstress.domain.RangeStatistics;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.Scene;
import com.company.cropstress.domain.TemporalSeries;
import com.company.cropstress.domain.enums.Band;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.util.RasterMath;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a group of patches: index and band statistics over the member footprints, and one
 * temporal series per index built from the group's per-scene mean.
 * Overlapping footprints contribute once per member patch.
 */
@Component
@RequiredArgsConstructor
public class ClusterProfiler {

    private static final VegetationIndex[] CHANNELS = VegetationIndex.values();

    private final TemporalStatisticsAggregator temporalAggregator;

    @Value
    @Builder
    public static class Profile {
        Map<VegetationIndex, RangeStatistics> indexStatistics;
        Map<Band, RangeStatistics> bandStatistics;
        Map<VegetationIndex, TemporalSeries> temporalTrends;

        public double meanOf(VegetationIndex index) {
            RangeStatistics stats = indexStatistics.get(index);
            return stats == null ? Double.NaN : stats.getMean();
        }
    }

    public Profile profile(List<Patch> members, RasterStack rasterStack) {
        int timesteps = rasterStack.sceneCount();
        SummaryStatistics[] overall = new SummaryStatistics[CHANNELS.length];
        SummaryStatistics[][] perScene = new SummaryStatistics[CHANNELS.length][timesteps];
        for (int ch = 0; ch < CHANNELS.length; ch++) {
            overall[ch] = new SummaryStatistics();
            for (int t = 0; t < timesteps; t++) {
                perScene[ch][t] = new SummaryStatistics();
            }
        }

        for (Patch patch : members) {
            for (int t = 0; t < patch.timesteps(); t++) {
                for (int r = 0; r < patch.size(); r++) {
                    for (int c = 0; c < patch.size(); c++) {
                        for (int ch = 0; ch < CHANNELS.length; ch++) {
                            double v = patch.value(t, r, c, ch);
                            RasterMath.addFinite(overall[ch], v);
                            RasterMath.addFinite(perScene[ch][t], v);
                        }
                    }
                }
            }
        }

        Map<VegetationIndex, RangeStatistics> indexStatistics = new EnumMap<>(VegetationIndex.class);
        Map<VegetationIndex, TemporalSeries> trends = new EnumMap<>(VegetationIndex.class);
        for (int ch = 0; ch < CHANNELS.length; ch++) {
            indexStatistics.put(CHANNELS[ch], RasterMath.summarize(overall[ch]));
            double[] series = new double[timesteps];
            for (int t = 0; t < timesteps; t++) {
                series[t] = perScene[ch][t].getN() == 0 ? Double.NaN : perScene[ch][t].getMean();
            }
            trends.put(CHANNELS[ch], temporalAggregator.summarize(rasterStack.acquisitionTimes(), series));
        }

        return Profile.builder()
                .indexStatistics(indexStatistics)
                .bandStatistics(bandStatistics(members, rasterStack))
                .temporalTrends(trends)
                .build();
    }

    private Map<Band, RangeStatistics> bandStatistics(List<Patch> members, RasterStack rasterStack) {
        Map<Band, SummaryStatistics> stats = new EnumMap<>(Band.class);
        for (Scene scene : rasterStack.getScenes()) {
            for (Band band : scene.availableBands()) {
                RasterGrid grid = scene.band(band);
                SummaryStatistics bandStats = stats.computeIfAbsent(band, b -> new SummaryStatistics());
                for (Patch patch : members) {
                    PatchAnchor anchor = patch.getAnchor();
                    for (int r = anchor.getRow(); r < anchor.getRow() + anchor.getSize(); r++) {
                        for (int c = anchor.getCol(); c < anchor.getCol() + anchor.getSize(); c++) {
                            RasterMath.addFinite(bandStats, grid.get(r, c));
                        }
                    }
                }
            }
        }

        Map<Band, RangeStatistics> result = new EnumMap<>(Band.class);
        stats.forEach((band, s) -> result.put(band, RasterMath.summarize(s)));
        return result;
    }
}
