package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.IndexRaster;
import com.company.cropstress.domain.IndexStack;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.Scene;
import com.company.cropstress.domain.enums.Band;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.exception.MissingBandException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Pixel-wise evaluation of the index table. Every (scene, index) pair is independent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexCalculator {

    private static final VegetationIndex[] INDICES = VegetationIndex.values();

    private final PipelineProperties properties;

    /**
     * Fails fast when any scene lacks a band the index table needs.
     */
    public void validateBands(RasterStack stack) {
        Set<Band> required = VegetationIndex.allRequiredBands();
        Map<Instant, Set<Band>> missing = new LinkedHashMap<>();

        for (Scene scene : stack.getScenes()) {
            EnumSet<Band> absent = EnumSet.noneOf(Band.class);
            for (Band band : required) {
                if (!scene.hasBand(band)) {
                    absent.add(band);
                }
            }
            if (!absent.isEmpty()) {
                missing.put(scene.getAcquiredAt(), absent);
            }
        }

        if (!missing.isEmpty()) {
            log.warn("Raster stack rejected, missing bands: {}", missing);
            throw new MissingBandException(missing);
        }
    }

    public IndexStack calculateAll(RasterStack stack) {
        validateBands(stack);

        List<Scene> scenes = stack.getScenes();
        int tasks = scenes.size() * INDICES.length;
        IndexRaster[] results = new IndexRaster[tasks];

        IntStream range = IntStream.range(0, tasks);
        if (properties.isParallel()) {
            range = range.parallel();
        }
        range.forEach(task -> {
            Scene scene = scenes.get(task / INDICES.length);
            VegetationIndex index = INDICES[task % INDICES.length];
            results[task] = calculate(scene, index);
        });

        List<Map<VegetationIndex, IndexRaster>> byScene = new ArrayList<>(scenes.size());
        for (int s = 0; s < scenes.size(); s++) {
            Map<VegetationIndex, IndexRaster> rasters = new EnumMap<>(VegetationIndex.class);
            for (int i = 0; i < INDICES.length; i++) {
                rasters.put(INDICES[i], results[s * INDICES.length + i]);
            }
            byScene.add(rasters);
        }

        log.debug("Calculated {} index rasters over {} scenes ({}x{})",
                tasks, scenes.size(), stack.getHeight(), stack.getWidth());

        return new IndexStack(stack.acquisitionTimes(), stack.getHeight(), stack.getWidth(), byScene);
    }

    public IndexRaster calculate(Scene scene, VegetationIndex index) {
        Set<Band> bands = index.getRequiredBands();
        List<Band> inputs = new ArrayList<>(bands);
        List<RasterGrid> grids = new ArrayList<>(inputs.size());
        for (Band band : inputs) {
            RasterGrid grid = scene.band(band);
            if (grid == null) {
                throw new MissingBandException(Map.of(scene.getAcquiredAt(), EnumSet.of(band)));
            }
            grids.add(grid);
        }

        int height = scene.getHeight();
        int width = scene.getWidth();
        double[] out = new double[height * width];
        double[] px = new double[Band.values().length];

        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                boolean missing = false;
                for (int b = 0; b < inputs.size(); b++) {
                    double v = grids.get(b).get(r, c);
                    if (Double.isNaN(v)) {
                        missing = true;
                        break;
                    }
                    px[inputs.get(b).ordinal()] = v;
                }
                out[r * width + c] = missing ? Double.NaN : index.compute(px);
            }
        }

        return new IndexRaster(index, scene.getAcquiredAt(), RasterGrid.ofRowMajor(height, width, out));
    }
}
