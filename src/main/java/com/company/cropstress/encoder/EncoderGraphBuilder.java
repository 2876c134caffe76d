package com.company.cropstress.encoder;

import org.tensorflow.Operand;
import org.tensorflow.Output;
import org.tensorflow.ndarray.Shape;
import org.tensorflow.op.Ops;
import org.tensorflow.op.core.Placeholder;
import org.tensorflow.types.TFloat32;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Adds the encoder network to a graph for one input shape. The input placeholder takes
 * (1, timesteps, size, size, channels) and the output is a (1, embedding) vector.
 */
final class EncoderGraphBuilder {

    static final String INPUT = "frames";
    static final String OUTPUT = "embedding";

    private static final List<Long> UNIT_STRIDES = List.of(1L, 1L, 1L, 1L);
    private static final int[] POOL_WINDOW = {1, 2, 2, 1};

    private final EncoderArchitecture architecture;
    private final ReferenceWeights weights;

    EncoderGraphBuilder(EncoderArchitecture architecture, ReferenceWeights weights) {
        this.architecture = architecture;
        this.weights = weights;
    }

    EncoderGraph build(Ops tf, int timesteps, int size) {
        int channels = architecture.getInputChannels();
        Placeholder<TFloat32> input = tf.withName(INPUT).placeholder(TFloat32.class,
                Placeholder.shape(Shape.of(1, timesteps, size, size, channels)));

        // timesteps become the batch of the convolutional stage
        Operand<TFloat32> x = tf.reshape(input, tf.constant(new int[]{timesteps, size, size, channels}));
        for (int b = 0; b < weights.conv.size(); b++) {
            x = convBlock(tf, x, weights.conv.get(b));
            if (architecture.poolsAfter(b)) {
                x = tf.nn.maxPool(x, tf.constant(POOL_WINDOW), tf.constant(POOL_WINDOW), "VALID");
            }
        }
        x = tf.math.mean(x, tf.constant(new int[]{1, 2}));
        x = dense(tf, x, weights.spatialHidden);
        x = dense(tf, x, weights.spatialOutput);

        Operand<TFloat32> sequence = tf.reshape(x, tf.constant(new int[]{timesteps, 1, architecture.getSpatialDim()}));
        List<Operand<TFloat32>> steps = new ArrayList<>(timesteps);
        for (Output<TFloat32> step : tf.unstack(sequence, (long) timesteps).output()) {
            steps.add(step);
        }
        Operand<TFloat32> forward = lstm(tf, steps, weights.forward);
        List<Operand<TFloat32>> reversed = new ArrayList<>(steps);
        Collections.reverse(reversed);
        Operand<TFloat32> backward = lstm(tf, reversed, weights.backward);

        Operand<TFloat32> joined = tf.concat(List.of(forward, backward), tf.constant(1));
        Operand<TFloat32> output = tf.withName(OUTPUT).identity(dense(tf, joined, weights.embeddingOutput));
        return new EncoderGraph(input, output);
    }

    private static Operand<TFloat32> convBlock(Ops tf, Operand<TFloat32> x, ReferenceWeights.Conv block) {
        Operand<TFloat32> conv = tf.nn.conv2d(x, tf.constant(block.kernel), UNIT_STRIDES, "SAME");
        Operand<TFloat32> activated = tf.nn.relu(tf.nn.biasAdd(conv, tf.constant(block.bias)));
        return tf.math.add(tf.math.mul(activated, tf.constant(block.scale)), tf.constant(block.shift));
    }

    private static Operand<TFloat32> dense(Ops tf, Operand<TFloat32> x, ReferenceWeights.Dense layer) {
        return tf.nn.relu(tf.nn.biasAdd(tf.linalg.matMul(x, tf.constant(layer.kernel)), tf.constant(layer.bias)));
    }

    private Operand<TFloat32> lstm(Ops tf, List<Operand<TFloat32>> steps, ReferenceWeights.Lstm layer) {
        List<Operand<TFloat32>> kernels = new ArrayList<>(ReferenceWeights.GATES);
        List<Operand<TFloat32>> recurrents = new ArrayList<>(ReferenceWeights.GATES);
        List<Operand<TFloat32>> biases = new ArrayList<>(ReferenceWeights.GATES);
        for (int g = 0; g < ReferenceWeights.GATES; g++) {
            kernels.add(tf.constant(layer.kernel[g]));
            recurrents.add(tf.constant(layer.recurrent[g]));
            biases.add(tf.constant(layer.bias[g]));
        }

        Operand<TFloat32> h = tf.constant(new float[1][architecture.getLstmUnits()]);
        Operand<TFloat32> c = h;
        for (Operand<TFloat32> step : steps) {
            Operand<TFloat32> in = tf.math.sigmoid(gate(tf, step, h, kernels, recurrents, biases, 0));
            Operand<TFloat32> forget = tf.math.sigmoid(gate(tf, step, h, kernels, recurrents, biases, 1));
            Operand<TFloat32> cell = tf.math.tanh(gate(tf, step, h, kernels, recurrents, biases, 2));
            Operand<TFloat32> out = tf.math.sigmoid(gate(tf, step, h, kernels, recurrents, biases, 3));
            c = tf.math.add(tf.math.mul(forget, c), tf.math.mul(in, cell));
            h = tf.math.mul(out, tf.math.tanh(c));
        }
        return h;
    }

    private static Operand<TFloat32> gate(Ops tf, Operand<TFloat32> step, Operand<TFloat32> h,
                                          List<Operand<TFloat32>> kernels, List<Operand<TFloat32>> recurrents,
                                          List<Operand<TFloat32>> biases, int g) {
        Operand<TFloat32> sum = tf.math.add(tf.linalg.matMul(step, kernels.get(g)),
                tf.linalg.matMul(h, recurrents.get(g)));
        return tf.nn.biasAdd(sum, biases.get(g));
    }

    static final class EncoderGraph {
        final Placeholder<TFloat32> input;
        final Operand<TFloat32> output;

        EncoderGraph(Placeholder<TFloat32> input, Operand<TFloat32> output) {
            this.input = input;
            this.output = output;
        }
    }
}
