package com.company.cropstress.encoder;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.Embedding;
import com.company.cropstress.domain.EncodingResult;
import com.company.cropstress.domain.Patch;
import com.company.cropstress.domain.enums.PatchStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Inference-only patch encoder: a per-timestep convolutional stage followed by a bidirectional
 * LSTM over the resulting vectors, run as a TensorFlow graph. Output depends only on the patch
 * and the shared model.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SpatioTemporalEncoder {

    private final EncoderModel model;
    private final PipelineProperties properties;

    /**
     * Encodes patches in parallel. Embeddings keep the input order; patches with too few usable
     * timesteps, or whose embedding is not finite, come back as excluded.
     */
    public EncodingResult encode(List<Patch> patches) {
        double[][] vectors = new double[patches.size()][];

        IntStream range = IntStream.range(0, patches.size());
        if (properties.isParallel()) {
            range = range.parallel();
        }
        range.forEach(i -> vectors[i] = embed(patches.get(i)));

        List<Embedding> embeddings = new ArrayList<>(patches.size());
        List<Patch> excluded = new ArrayList<>();
        for (int i = 0; i < patches.size(); i++) {
            if (vectors[i] == null) {
                excluded.add(patches.get(i).withStatus(PatchStatus.INSUFFICIENT_DATA));
            } else {
                embeddings.add(new Embedding(patches.get(i), vectors[i]));
            }
        }

        if (!excluded.isEmpty()) {
            log.debug("Encoder excluded {} of {} patches without a usable embedding",
                    excluded.size(), patches.size());
        }
        return new EncodingResult(List.copyOf(embeddings), List.copyOf(excluded));
    }

    /**
     * @return the embedding, or null when the patch has too few usable timesteps
     */
    public double[] embed(Patch patch) {
        float[][][][] frames = condition(patch);
        if (frames.length == 0 || frames.length < properties.getMinValidTimesteps()) {
            return null;
        }

        float[] output = model.embed(frames);
        double[] embedding = new double[output.length];
        for (int i = 0; i < output.length; i++) {
            if (!Float.isFinite(output[i])) {
                return null;
            }
            embedding[i] = output[i];
        }
        return embedding;
    }

    /**
     * Drops invalid timesteps, imputes the remaining gaps and standardizes every channel.
     * Frames are laid out as (timestep, row, column, channel).
     */
    float[][][][] condition(Patch patch) {
        int size = patch.size();
        int channels = patch.channels();
        ChannelNormalization normalization = model.getNormalization();

        List<Integer> valid = new ArrayList<>();
        for (int t = 0; t < patch.timesteps(); t++) {
            if (patch.isTimestepValid(t)) {
                valid.add(t);
            }
        }

        double[][][] pixelMean = new double[size][size][channels];
        double[][] frameMean = new double[valid.size()][channels];
        double[] patchMean = new double[channels];

        for (int ch = 0; ch < channels; ch++) {
            double patchSum = 0.0;
            int patchCount = 0;
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    double sum = 0.0;
                    int count = 0;
                    for (int t : valid) {
                        double v = patch.value(t, r, c, ch);
                        if (Double.isFinite(v)) {
                            sum += v;
                            count++;
                        }
                    }
                    pixelMean[r][c][ch] = count == 0 ? Double.NaN : sum / count;
                    patchSum += sum;
                    patchCount += count;
                }
            }
            patchMean[ch] = patchCount == 0 ? 0.0 : patchSum / patchCount;

            for (int i = 0; i < valid.size(); i++) {
                double sum = 0.0;
                int count = 0;
                for (int r = 0; r < size; r++) {
                    for (int c = 0; c < size; c++) {
                        double v = patch.value(valid.get(i), r, c, ch);
                        if (Double.isFinite(v)) {
                            sum += v;
                            count++;
                        }
                    }
                }
                frameMean[i][ch] = count == 0 ? Double.NaN : sum / count;
            }
        }

        float[][][][] frames = new float[valid.size()][size][size][channels];
        for (int i = 0; i < valid.size(); i++) {
            int t = valid.get(i);
            for (int r = 0; r < size; r++) {
                for (int c = 0; c < size; c++) {
                    for (int ch = 0; ch < channels; ch++) {
                        double v = patch.value(t, r, c, ch);
                        if (!Double.isFinite(v)) {
                            v = pixelMean[r][c][ch];
                        }
                        if (Double.isNaN(v)) {
                            v = frameMean[i][ch];
                        }
                        if (Double.isNaN(v)) {
                            v = patchMean[ch];
                        }
                        frames[i][r][c][ch] = normalization.standardize(ch, v);
                    }
                }
            }
        }
        return frames;
    }

    public EncoderModel getModel() {
        return model;
    }
}
