package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.TrendDirection;
import com.company.cropstress.domain.enums.VegetationIndex;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-pixel temporal summary grids of one index.
 */
@Getter
public final class PixelTrendStatistics {

    private final VegetationIndex index;
    private final RasterGrid latest;
    private final RasterGrid change;
    private final RasterGrid slopePerDay;
    private final Map<TrendDirection, Long> directionCounts;
    private final TrendDirection[] directions;

    public PixelTrendStatistics(VegetationIndex index, RasterGrid latest, RasterGrid change,
                                RasterGrid slopePerDay, TrendDirection[] directions) {
        this.index = index;
        this.latest = latest;
        this.change = change;
        this.slopePerDay = slopePerDay;
        this.directions = directions.clone();

        EnumMap<TrendDirection, Long> counts = new EnumMap<>(TrendDirection.class);
        for (TrendDirection direction : TrendDirection.values()) {
            counts.put(direction, 0L);
        }
        for (TrendDirection direction : directions) {
            counts.merge(direction, 1L, Long::sum);
        }
        this.directionCounts = Collections.unmodifiableMap(counts);
    }

    public TrendDirection direction(int row, int col) {
        return directions[row * latest.getWidth() + col];
    }

    public TrendDirection[] getDirections() {
        return directions.clone();
    }
}
