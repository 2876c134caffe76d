package com.company.cropstress.support;

import com.company.cropstress.domain.FieldMetadata;
import com.company.cropstress.domain.GeoExtent;
import com.company.cropstress.domain.RasterGrid;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.Scene;
import com.company.cropstress.domain.enums.Band;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Square test fields split into three horizontal bands: healthy at the top, moderately stressed
 * in the middle, strongly stressed (and declining over time) at the bottom.
 */
public final class SyntheticFieldFactory {

    public static final Instant FIRST_ACQUISITION = Instant.parse("2024-05-01T10:30:00Z");

    private static final Band[] BANDS = {Band.B02, Band.B03, Band.B04, Band.B05, Band.B08, Band.B11, Band.B12};

    private SyntheticFieldFactory() {
    }

    public static RasterStack field(int size, int scenes, long seed) {
        return field(size, scenes, seed, EnumSet.noneOf(Band.class), Set.of());
    }

    public static RasterStack field(int size, int scenes, long seed, Set<Band> omitted, Set<Integer> obscuredScenes) {
        Random random = new Random(seed);
        List<Scene> result = new ArrayList<>(scenes);
        for (int s = 0; s < scenes; s++) {
            Map<Band, RasterGrid> grids = new EnumMap<>(Band.class);
            for (Band band : BANDS) {
                double[][] rows = new double[size][size];
                for (int r = 0; r < size; r++) {
                    for (int c = 0; c < size; c++) {
                        rows[r][c] = reflectance(band, zone(r, size), s) + 0.003 * random.nextGaussian();
                    }
                }
                if (!omitted.contains(band)) {
                    grids.put(band, RasterGrid.of(rows));
                }
            }
            boolean[] mask = null;
            if (obscuredScenes.contains(s)) {
                mask = new boolean[size * size];
            }
            result.add(Scene.of(acquisition(s), grids, mask));
        }
        return RasterStack.of(result);
    }

    /**
     * Copy of the stack with columns {@code [fromCol, toCol)} masked out in the given scenes.
     */
    public static RasterStack withMaskedColumns(RasterStack stack, int fromCol, int toCol, Set<Integer> scenes) {
        List<Scene> result = new ArrayList<>(stack.sceneCount());
        for (int s = 0; s < stack.sceneCount(); s++) {
            Scene scene = stack.getScenes().get(s);
            if (!scenes.contains(s)) {
                result.add(scene);
                continue;
            }
            boolean[] mask = new boolean[scene.getHeight() * scene.getWidth()];
            for (int r = 0; r < scene.getHeight(); r++) {
                for (int c = 0; c < scene.getWidth(); c++) {
                    mask[r * scene.getWidth() + c] = c < fromCol || c >= toCol;
                }
            }
            Map<Band, RasterGrid> grids = new EnumMap<>(Band.class);
            for (Band band : scene.availableBands()) {
                grids.put(band, scene.band(band));
            }
            result.add(Scene.of(scene.getAcquiredAt(), grids, mask));
        }
        return RasterStack.of(result);
    }

    /**
     * Irregularly spaced acquisitions, roughly ten days apart.
     */
    public static Instant acquisition(int scene) {
        return FIRST_ACQUISITION.plus(Duration.ofDays(10L * scene)).plus(Duration.ofHours((long) scene * scene));
    }

    public static FieldMetadata metadata(String fieldId) {
        return FieldMetadata.builder()
                .fieldId(fieldId)
                .cropType("wheat")
                .fieldSizeHectares(12.5)
                .analysisDate(LocalDate.of(2024, 6, 15))
                .extent(GeoExtent.builder().minLon(75.80).minLat(30.90).maxLon(75.81).maxLat(30.91).build())
                .build();
    }

    private static int zone(int row, int size) {
        return Math.min(2, row * 3 / size);
    }

    private static double reflectance(Band band, int zone, int scene) {
        double decline = zone == 2 ? 0.015 * Math.min(scene, 8) : 0.0;
        switch (band) {
            case B02:
                return 0.04;
            case B03:
                return 0.07 + 0.01 * zone;
            case B04:
                return 0.05 + 0.05 * zone;
            case B05:
                return 0.12 + 0.02 * zone;
            case B08:
                return 0.45 - 0.13 * zone - decline;
            case B11:
                return 0.20 + 0.05 * zone;
            case B12:
                return 0.12 + 0.07 * zone;
            default:
                throw new IllegalArgumentException("No synthetic profile for " + band);
        }
    }
}
