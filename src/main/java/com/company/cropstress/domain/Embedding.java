package com.company.cropstress.domain;

import java.util.Arrays;

/**
 * Encoder output for one valid patch.
 */
public final class Embedding {

    private final Patch patch;
    private final double[] vector;

    public Embedding(Patch patch, double[] vector) {
        this.patch = patch;
        this.vector = vector.clone();
    }

    public Patch getPatch() {
        return patch;
    }

    public PatchAnchor getAnchor() {
        return patch.getAnchor();
    }

    public int dimension() {
        return vector.length;
    }

    public double[] toArray() {
        return vector.clone();
    }

    public double norm() {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    @Override
    public String toString() {
        return "Embedding[patch=" + patch.getOrdinal() + ", dim=" + vector.length
                + ", head=" + Arrays.toString(Arrays.copyOf(vector, Math.min(4, vector.length))) + "]";
    }
}
