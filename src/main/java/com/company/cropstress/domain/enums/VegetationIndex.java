package com.company.cropstress.domain.enums;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.company.cropstress.domain.enums.Band.*;

/**
 * The fixed table of spectral indices computed for every scene.
 * <p>
 * Each formula reads a pixel as a {@code double[]} indexed by {@link Band#ordinal()}.
 * A denominator whose magnitude is below {@link #DENOMINATOR_EPSILON} yields {@code NaN};
 * normalized-difference forms are bounded to [-1, 1] by the formula itself for
 * non-negative reflectance, no clamping is applied.
 */
public enum VegetationIndex {

    NDVI("Normalized Difference Vegetation Index", true, EnumSet.of(B08, B04)) {
        @Override
        public double compute(double[] px) {
            return normalizedDifference(px[B08.ordinal()], px[B04.ordinal()]);
        }
    },
    EVI("Enhanced Vegetation Index", false, EnumSet.of(B08, B04, B02)) {
        @Override
        public double compute(double[] px) {
            double nir = px[B08.ordinal()];
            double red = px[B04.ordinal()];
            double blue = px[B02.ordinal()];
            return 2.5 * ratio(nir - red, nir + 6.0 * red - 7.5 * blue + 1.0);
        }
    },
    NDWI("Normalized Difference Water Index", true, EnumSet.of(B03, B08)) {
        @Override
        public double compute(double[] px) {
            return normalizedDifference(px[B03.ordinal()], px[B08.ordinal()]);
        }
    },
    NDRE("Normalized Difference Red Edge", true, EnumSet.of(B08, B05)) {
        @Override
        public double compute(double[] px) {
            return normalizedDifference(px[B08.ordinal()], px[B05.ordinal()]);
        }
    },
    RECI("Red Edge Chlorophyll Index", false, EnumSet.of(B08, B05)) {
        @Override
        public double compute(double[] px) {
            return ratio(px[B08.ordinal()], px[B05.ordinal()]) - 1.0;
        }
    },
    SMI("Soil Moisture Index", true, EnumSet.of(B11, B12)) {
        @Override
        public double compute(double[] px) {
            return normalizedDifference(px[B11.ordinal()], px[B12.ordinal()]);
        }
    },
    NDSI("Normalized Difference Snow Index", true, EnumSet.of(B03, B11)) {
        @Override
        public double compute(double[] px) {
            return normalizedDifference(px[B03.ordinal()], px[B11.ordinal()]);
        }
    },
    PRI("Photochemical Reflectance Index", true, EnumSet.of(B02, B03)) {
        @Override
        public double compute(double[] px) {
            return normalizedDifference(px[B02.ordinal()], px[B03.ordinal()]);
        }
    },
    PSRI("Plant Senescence Reflectance Index", false, EnumSet.of(B04, B03, B08)) {
        @Override
        public double compute(double[] px) {
            return ratio(px[B04.ordinal()] - px[B03.ordinal()], px[B08.ordinal()]);
        }
    },
    MCARI("Modified Chlorophyll Absorption Ratio Index", false, EnumSet.of(B03, B04, B05)) {
        @Override
        public double compute(double[] px) {
            double green = px[B03.ordinal()];
            double red = px[B04.ordinal()];
            double redEdge = px[B05.ordinal()];
            return ((redEdge - red) - 0.2 * (redEdge - green)) * ratio(redEdge, red);
        }
    },
    SASI("Salinity Index", false, EnumSet.of(B11, B04)) {
        @Override
        public double compute(double[] px) {
            double product = px[B11.ordinal()] * px[B04.ordinal()];
            return product < 0 ? Double.NaN : Math.sqrt(product);
        }
    },
    SOMI("Soil Organic Matter Index", false, EnumSet.of(B08, B04, B11, B12)) {
        @Override
        public double compute(double[] px) {
            return ratio(px[B08.ordinal()] + px[B04.ordinal()], px[B11.ordinal()] + px[B12.ordinal()]);
        }
    },
    SFI("Soil Fertility Index", false, EnumSet.of(B08, B04, B11, B12)) {
        @Override
        public double compute(double[] px) {
            return ratio(NDVI.compute(px) * SOMI.compute(px), SASI.compute(px));
        }
    };

    public static final double DENOMINATOR_EPSILON = 1e-10;

    private final String description;
    private final boolean normalizedDifference;
    private final Set<Band> requiredBands;

    VegetationIndex(String description, boolean normalizedDifference, EnumSet<Band> requiredBands) {
        this.description = description;
        this.normalizedDifference = normalizedDifference;
        this.requiredBands = Collections.unmodifiableSet(requiredBands);
    }

    public abstract double compute(double[] px);

    public String getDescription() {
        return description;
    }

    /**
     * True for (a - b) / (a + b) forms, whose output lies in [-1, 1].
     */
    public boolean isNormalizedDifference() {
        return normalizedDifference;
    }

    public Set<Band> getRequiredBands() {
        return requiredBands;
    }

    /**
     * Union of the bands every index in the table needs.
     */
    public static Set<Band> allRequiredBands() {
        EnumSet<Band> bands = EnumSet.noneOf(Band.class);
        for (VegetationIndex index : values()) {
            bands.addAll(index.requiredBands);
        }
        return Collections.unmodifiableSet(bands);
    }

    static double normalizedDifference(double a, double b) {
        return ratio(a - b, a + b);
    }

    static double ratio(double numerator, double denominator) {
        if (Double.isNaN(numerator) || Double.isNaN(denominator)
                || Math.abs(denominator) < DENOMINATOR_EPSILON) {
            return Double.NaN;
        }
        return numerator / denominator;
    }
}
