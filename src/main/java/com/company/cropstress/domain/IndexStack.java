package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.VegetationIndex;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Index rasters of every scene, addressed by scene position and index.
 */
public final class IndexStack {

    @Getter
    private final List<Instant> acquisitionTimes;
    @Getter
    private final int height;
    @Getter
    private final int width;
    private final List<Map<VegetationIndex, IndexRaster>> rastersByScene;

    public IndexStack(List<Instant> acquisitionTimes, int height, int width,
                      List<Map<VegetationIndex, IndexRaster>> rastersByScene) {
        if (acquisitionTimes.size() != rastersByScene.size()) {
            throw new IllegalArgumentException("Expected index rasters for " + acquisitionTimes.size()
                    + " scenes, got " + rastersByScene.size());
        }
        this.acquisitionTimes = List.copyOf(acquisitionTimes);
        this.height = height;
        this.width = width;
        List<Map<VegetationIndex, IndexRaster>> copy = new ArrayList<>(rastersByScene.size());
        for (Map<VegetationIndex, IndexRaster> rasters : rastersByScene) {
            copy.add(Collections.unmodifiableMap(new EnumMap<>(rasters)));
        }
        this.rastersByScene = Collections.unmodifiableList(copy);
    }

    public int sceneCount() {
        return acquisitionTimes.size();
    }

    public IndexRaster raster(int sceneIndex, VegetationIndex index) {
        return rastersByScene.get(sceneIndex).get(index);
    }

    public RasterGrid grid(int sceneIndex, VegetationIndex index) {
        return raster(sceneIndex, index).getGrid();
    }

    /**
     * The rasters of one index in acquisition order.
     */
    public List<IndexRaster> series(VegetationIndex index) {
        List<IndexRaster> series = new ArrayList<>(sceneCount());
        for (Map<VegetationIndex, IndexRaster> rasters : rastersByScene) {
            series.add(rasters.get(index));
        }
        return series;
    }
}
