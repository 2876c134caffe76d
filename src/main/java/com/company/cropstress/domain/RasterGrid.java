package com.company.cropstress.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;

/**
 * Immutable row-major grid of pixel values. {@code NaN} marks a missing value.
 */
public final class RasterGrid {

    private final int height;
    private final int width;
    private final double[] values;

    private RasterGrid(int height, int width, double[] values) {
        this.height = height;
        this.width = width;
        this.values = values;
    }

    public static RasterGrid of(double[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            throw new IllegalArgumentException("Raster grid must have at least one row and one column");
        }
        int height = rows.length;
        int width = rows[0].length;
        double[] values = new double[height * width];
        for (int r = 0; r < height; r++) {
            if (rows[r] == null || rows[r].length != width) {
                throw new IllegalArgumentException("Raster row " + r + " has length "
                        + (rows[r] == null ? 0 : rows[r].length) + ", expected " + width);
            }
            System.arraycopy(rows[r], 0, values, r * width, width);
        }
        return new RasterGrid(height, width, values);
    }

    public static RasterGrid ofRowMajor(int height, int width, double[] values) {
        if (height <= 0 || width <= 0 || values.length != height * width) {
            throw new IllegalArgumentException("Buffer of " + values.length
                    + " values does not match " + height + "x" + width);
        }
        return new RasterGrid(height, width, values.clone());
    }

    public static RasterGrid filled(int height, int width, double value) {
        double[] values = new double[height * width];
        Arrays.fill(values, value);
        return new RasterGrid(height, width, values);
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public double get(int row, int col) {
        return values[row * width + col];
    }

    @JsonIgnore
    public int size() {
        return values.length;
    }

    public boolean sameShape(RasterGrid other) {
        return other != null && other.height == height && other.width == width;
    }

    /**
     * Copy of the values with {@code NaN} written where {@code mask} is false.
     */
    public RasterGrid masked(boolean[] mask) {
        if (mask == null) {
            return this;
        }
        if (mask.length != values.length) {
            throw new IllegalArgumentException("Mask size " + mask.length + " does not match grid size " + values.length);
        }
        double[] copy = values.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!mask[i]) {
                copy[i] = Double.NaN;
            }
        }
        return new RasterGrid(height, width, copy);
    }

    /**
     * Copy of the row-major values.
     */
    public double[] toArray() {
        return values.clone();
    }

    public int countFinite() {
        int count = 0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterGrid)) return false;
        RasterGrid other = (RasterGrid) o;
        return height == other.height && width == other.width && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "RasterGrid[" + height + "x" + width + "]";
    }
}
