package com.company.cropstress.encoder;

import com.company.cropstress.exception.EncoderWeightsException;
import org.tensorflow.Result;
import org.tensorflow.Session;
import org.tensorflow.ndarray.StdArrays;
import org.tensorflow.ndarray.buffer.DataBuffers;
import org.tensorflow.proto.ConfigProto;
import org.tensorflow.types.TFloat32;

/**
 * Feeds one patch through a session and reads back the embedding.
 */
final class SessionInference {

    private SessionInference() {
    }

    /**
     * Single-threaded kernels, so float reductions run in a fixed order.
     */
    static ConfigProto deterministicConfig() {
        return ConfigProto.newBuilder()
                .setIntraOpParallelismThreads(1)
                .setInterOpParallelismThreads(1)
                .build();
    }

    static float[] run(Session session, String inputNode, String outputNode,
                       float[][][][] frames, int embeddingDim) {
        try (TFloat32 input = TFloat32.tensorOf(StdArrays.ndCopyOf(new float[][][][][]{frames}));
             Result result = session.runner().feed(inputNode, input).fetch(outputNode).run()) {
            TFloat32 output = (TFloat32) result.get(0);
            long size = output.shape().size();
            if (size != embeddingDim) {
                throw new EncoderWeightsException("Encoder produced " + size + " values, expected " + embeddingDim);
            }
            float[] embedding = new float[embeddingDim];
            output.copyTo(DataBuffers.of(embedding, false, false));
            return embedding;
        }
    }
}
