package com.company.cropstress.encoder;

import com.company.cropstress.exception.EncoderWeightsException;

import java.util.Arrays;

/**
 * Per-channel standardization applied before values enter the network.
 */
public final class ChannelNormalization {

    private final double[] mean;
    private final double[] std;

    private ChannelNormalization(double[] mean, double[] std) {
        this.mean = mean;
        this.std = std;
    }

    public static ChannelNormalization identity(int channels) {
        double[] std = new double[channels];
        Arrays.fill(std, 1.0);
        return new ChannelNormalization(new double[channels], std);
    }

    /**
     * @param mean per-channel mean, or null for zero
     * @param std  per-channel standard deviation, or null for one
     */
    public static ChannelNormalization of(double[] mean, double[] std, int channels) {
        ChannelNormalization identity = identity(channels);
        double[] m = mean == null ? identity.mean : mean.clone();
        double[] s = std == null ? identity.std : std.clone();
        if (m.length != channels || s.length != channels) {
            throw new EncoderWeightsException("Channel mean and std must have " + channels + " entries");
        }
        for (double v : s) {
            if (!(v > 0) || !Double.isFinite(v)) {
                throw new EncoderWeightsException("Channel std entries must be positive");
            }
        }
        return new ChannelNormalization(m, s);
    }

    public float standardize(int channel, double value) {
        return (float) ((value - mean[channel]) / std[channel]);
    }

    public double[] getMean() {
        return mean.clone();
    }

    public double[] getStd() {
        return std.clone();
    }

    void digest(Fingerprint fingerprint) {
        fingerprint.update(mean);
        fingerprint.update(std);
    }
}
