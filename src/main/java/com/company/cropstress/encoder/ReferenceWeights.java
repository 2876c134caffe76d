package com.company.cropstress.encoder;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Seeded parameters in TensorFlow layout: conv kernels (height, width, in, out), dense kernels
 * (in, out) and LSTM kernels split per gate in input, forget, cell, output order.
 */
final class ReferenceWeights {

    static final int KERNEL = 3;
    static final int GATES = 4;
    static final int FORGET_GATE = 1;

    final List<Conv> conv;
    final Dense spatialHidden;
    final Dense spatialOutput;
    final Lstm forward;
    final Lstm backward;
    final Dense embeddingOutput;

    private ReferenceWeights(List<Conv> conv, Dense spatialHidden, Dense spatialOutput,
                             Lstm forward, Lstm backward, Dense embeddingOutput) {
        this.conv = List.copyOf(conv);
        this.spatialHidden = spatialHidden;
        this.spatialOutput = spatialOutput;
        this.forward = forward;
        this.backward = backward;
        this.embeddingOutput = embeddingOutput;
    }

    /**
     * He-normal kernels, zero biases, identity batch-norm, LSTM forget-gate bias of one.
     * Identical for identical architecture and seed.
     */
    static ReferenceWeights generate(EncoderArchitecture architecture, long seed) {
        RandomGenerator random = new Well19937c(seed);

        List<Conv> blocks = new ArrayList<>();
        int depth = architecture.getInputChannels();
        for (int filters : architecture.getConvChannels()) {
            float[][][][] kernel = new float[KERNEL][KERNEL][depth][filters];
            double sd = Math.sqrt(2.0 / (depth * KERNEL * KERNEL));
            for (float[][][] row : kernel) {
                for (float[][] tap : row) {
                    for (float[] in : tap) {
                        fillGaussian(in, sd, random);
                    }
                }
            }
            float[] scale = new float[filters];
            Arrays.fill(scale, 1.0f);
            blocks.add(new Conv(kernel, new float[filters], scale, new float[filters]));
            depth = filters;
        }

        Dense hidden = dense(architecture.lastConvChannels(), architecture.getDenseUnits(), random);
        Dense spatial = dense(architecture.getDenseUnits(), architecture.getSpatialDim(), random);
        Lstm forward = lstm(architecture.getSpatialDim(), architecture.getLstmUnits(), random);
        Lstm backward = lstm(architecture.getSpatialDim(), architecture.getLstmUnits(), random);
        Dense output = dense(2 * architecture.getLstmUnits(), architecture.getEmbeddingDim(), random);
        return new ReferenceWeights(blocks, hidden, spatial, forward, backward, output);
    }

    void digest(Fingerprint fingerprint) {
        for (Conv block : conv) {
            for (float[][][] row : block.kernel) {
                for (float[][] tap : row) {
                    for (float[] in : tap) {
                        fingerprint.update(in);
                    }
                }
            }
            fingerprint.update(block.bias);
            fingerprint.update(block.scale);
            fingerprint.update(block.shift);
        }
        spatialHidden.digest(fingerprint);
        spatialOutput.digest(fingerprint);
        forward.digest(fingerprint);
        backward.digest(fingerprint);
        embeddingOutput.digest(fingerprint);
    }

    private static Dense dense(int in, int out, RandomGenerator random) {
        float[][] kernel = new float[in][out];
        double sd = Math.sqrt(2.0 / in);
        for (float[] row : kernel) {
            fillGaussian(row, sd, random);
        }
        return new Dense(kernel, new float[out]);
    }

    private static Lstm lstm(int in, int units, RandomGenerator random) {
        float[][][] kernel = new float[GATES][in][units];
        float[][][] recurrent = new float[GATES][units][units];
        float[][] bias = new float[GATES][units];
        double kernelSd = Math.sqrt(2.0 / in);
        double recurrentSd = Math.sqrt(2.0 / units);
        for (int g = 0; g < GATES; g++) {
            for (float[] row : kernel[g]) {
                fillGaussian(row, kernelSd, random);
            }
            for (float[] row : recurrent[g]) {
                fillGaussian(row, recurrentSd, random);
            }
        }
        Arrays.fill(bias[FORGET_GATE], 1.0f);
        return new Lstm(kernel, recurrent, bias);
    }

    private static void fillGaussian(float[] row, double sd, RandomGenerator random) {
        for (int i = 0; i < row.length; i++) {
            row[i] = (float) (random.nextGaussian() * sd);
        }
    }

    static final class Conv {
        final float[][][][] kernel;
        final float[] bias;
        final float[] scale;
        final float[] shift;

        Conv(float[][][][] kernel, float[] bias, float[] scale, float[] shift) {
            this.kernel = kernel;
            this.bias = bias;
            this.scale = scale;
            this.shift = shift;
        }
    }

    static final class Dense {
        final float[][] kernel;
        final float[] bias;

        Dense(float[][] kernel, float[] bias) {
            this.kernel = kernel;
            this.bias = bias;
        }

        void digest(Fingerprint fingerprint) {
            for (float[] row : kernel) {
                fingerprint.update(row);
            }
            fingerprint.update(bias);
        }
    }

    static final class Lstm {
        final float[][][] kernel;
        final float[][][] recurrent;
        final float[][] bias;

        Lstm(float[][][] kernel, float[][][] recurrent, float[][] bias) {
            this.kernel = kernel;
            this.recurrent = recurrent;
            this.bias = bias;
        }

        void digest(Fingerprint fingerprint) {
            for (int g = 0; g < GATES; g++) {
                for (float[] row : kernel[g]) {
                    fingerprint.update(row);
                }
                for (float[] row : recurrent[g]) {
                    fingerprint.update(row);
                }
                fingerprint.update(bias[g]);
            }
        }
    }
}
