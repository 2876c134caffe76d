package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.Band;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One satellite acquisition. Band grids are stored with invalid pixels already set to {@code NaN}.
 */
@Getter
public final class Scene {

    private final Instant acquiredAt;
    private final int height;
    private final int width;
    private final Map<Band, RasterGrid> bands;

    private Scene(Instant acquiredAt, int height, int width, Map<Band, RasterGrid> bands) {
        this.acquiredAt = acquiredAt;
        this.height = height;
        this.width = width;
        this.bands = bands;
    }

    /**
     * @param acquiredAt acquisition instant
     * @param bandGrids  band grids, all of one shape
     * @param validMask  row-major mask ({@code true} = usable), or null when every pixel is usable
     */
    public static Scene of(Instant acquiredAt, Map<Band, RasterGrid> bandGrids, boolean[] validMask) {
        Objects.requireNonNull(acquiredAt, "acquiredAt");
        if (bandGrids == null || bandGrids.isEmpty()) {
            throw new IllegalArgumentException("Scene " + acquiredAt + " has no bands");
        }

        RasterGrid reference = bandGrids.values().iterator().next();
        EnumMap<Band, RasterGrid> masked = new EnumMap<>(Band.class);
        for (Map.Entry<Band, RasterGrid> entry : bandGrids.entrySet()) {
            if (!reference.sameShape(entry.getValue())) {
                throw new IllegalArgumentException(String.format(
                        "Band %s of scene %s is %s, expected %dx%d",
                        entry.getKey(), acquiredAt, entry.getValue(), reference.getHeight(), reference.getWidth()));
            }
            masked.put(entry.getKey(), entry.getValue().masked(validMask));
        }

        return new Scene(acquiredAt, reference.getHeight(), reference.getWidth(),
                Collections.unmodifiableMap(masked));
    }

    public static Scene of(Instant acquiredAt, Map<Band, RasterGrid> bandGrids) {
        return of(acquiredAt, bandGrids, null);
    }

    public RasterGrid band(Band band) {
        return bands.get(band);
    }

    public boolean hasBand(Band band) {
        return bands.containsKey(band);
    }

    public Set<Band> availableBands() {
        return bands.keySet();
    }
}
