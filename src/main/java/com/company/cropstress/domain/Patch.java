package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.PatchStatus;
import lombok.Getter;

/**
 * A square window of the field stacked over time: tensor shape (time, height, width, channels),
 * channels being the index table in declaration order.
 */
public final class Patch {

    @Getter
    private final int ordinal;
    @Getter
    private final PatchAnchor anchor;
    @Getter
    private final PatchStatus status;
    private final double[][][][] tensor;
    private final boolean[] validTimesteps;

    public Patch(int ordinal, PatchAnchor anchor, double[][][][] tensor, boolean[] validTimesteps, PatchStatus status) {
        if (tensor.length != validTimesteps.length) {
            throw new IllegalArgumentException("Tensor has " + tensor.length + " timesteps, validity flags "
                    + validTimesteps.length);
        }
        this.ordinal = ordinal;
        this.anchor = anchor;
        this.tensor = tensor;
        this.validTimesteps = validTimesteps.clone();
        this.status = status;
    }

    public int timesteps() {
        return tensor.length;
    }

    public int size() {
        return anchor.getSize();
    }

    public int channels() {
        return tensor.length == 0 ? 0 : tensor[0][0][0].length;
    }

    public double value(int t, int row, int col, int channel) {
        return tensor[t][row][col][channel];
    }

    public boolean isTimestepValid(int t) {
        return validTimesteps[t];
    }

    public int validTimestepCount() {
        int count = 0;
        for (boolean valid : validTimesteps) {
            if (valid) {
                count++;
            }
        }
        return count;
    }

    public Patch withStatus(PatchStatus newStatus) {
        return new Patch(ordinal, anchor, tensor, validTimesteps, newStatus);
    }
}
