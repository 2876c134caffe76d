package com.company.cropstress.encoder;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.EncodingResult;
import com.company.cropstress.domain.Patch;
import com.company.cropstress.domain.PatchAnchor;
import com.company.cropstress.domain.enums.PatchStatus;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.support.TestEncoders;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpatioTemporalEncoderTest {

    private static final int SIZE = 8;
    private static final int CHANNELS = VegetationIndex.values().length;

    private final EncoderModel model = TestEncoders.smallModel();
    private final SpatioTemporalEncoder encoder = new SpatioTemporalEncoder(model, new PipelineProperties());

    @Test
    void embeddingHasConfiguredDimension() {
        double[] embedding = encoder.embed(patch(0, randomTensor(3, 1L), new boolean[]{true, true, true}));

        assertThat(embedding).hasSize(16);
        for (double v : embedding) {
            assertThat(v).isFinite().isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void encodingIsDeterministicAndOrderPreserving() {
        List<Patch> patches = List.of(
                patch(0, randomTensor(3, 1L), new boolean[]{true, true, true}),
                patch(1, randomTensor(3, 2L), new boolean[]{true, true, true}),
                patch(2, randomTensor(3, 3L), new boolean[]{true, true, true}));

        PipelineProperties sequential = new PipelineProperties();
        sequential.setParallel(false);
        EncodingResult parallel = encoder.encode(patches);
        EncodingResult serial = new SpatioTemporalEncoder(model, sequential).encode(patches);

        assertThat(parallel.getEmbeddings()).hasSize(3);
        for (int i = 0; i < 3; i++) {
            assertThat(parallel.getEmbeddings().get(i).getPatch().getOrdinal()).isEqualTo(i);
            assertThat(parallel.getEmbeddings().get(i).toArray())
                    .containsExactly(serial.getEmbeddings().get(i).toArray());
        }
        assertThat(parallel.getEmbeddings().get(0).toArray())
                .isNotEqualTo(parallel.getEmbeddings().get(1).toArray());
    }

    @Test
    void invalidTimestepsAreRemovedFromTheSequence() {
        double[][][][] two = randomTensor(2, 5L);
        double[][][][] three = new double[][][][]{two[0], nanFrame(), two[1]};

        double[] withoutGap = encoder.embed(patch(0, two, new boolean[]{true, true}));
        double[] withGap = encoder.embed(patch(0, three, new boolean[]{true, false, true}));

        assertThat(withGap).containsExactly(withoutGap);
    }

    @Test
    void missingValuesUseThePixelTemporalMean() {
        double[][][][] tensor = randomTensor(3, 9L);
        tensor[0][2][3][0] = 0.25;
        tensor[2][2][3][0] = 0.75;
        tensor[1][2][3][0] = 0.5;
        double[] complete = encoder.embed(patch(0, tensor, new boolean[]{true, true, true}));

        tensor[1][2][3][0] = Double.NaN;
        double[] imputed = encoder.embed(patch(0, tensor, new boolean[]{true, true, true}));

        assertThat(imputed).containsExactly(complete);
    }

    @Test
    void conditioningYieldsFiniteStandardizedFrames() {
        double[][][][] tensor = randomTensor(2, 4L);
        // pixel missing at every timestep falls back to the frame mean
        tensor[0][0][0][1] = Double.NaN;
        tensor[1][0][0][1] = Double.NaN;

        float[][][][] frames = encoder.condition(patch(0, tensor, new boolean[]{true, true}));

        assertThat((Object[]) frames).hasSize(2);
        for (float[][][] frame : frames) {
            assertThat((Object[]) frame).hasSize(SIZE);
            for (float[][] row : frame) {
                for (float[] pixel : row) {
                    assertThat(pixel).hasSize(CHANNELS);
                    for (float v : pixel) {
                        assertThat(v).isFinite();
                    }
                }
            }
        }
    }

    @Test
    void fullyInvalidPatchIsExcludedWithoutRunningTheModel() {
        Patch empty = patch(0, new double[][][][]{nanFrame(), nanFrame()}, new boolean[]{false, false});

        assertThat(encoder.condition(empty)).isEmpty();
        assertThat(encoder.embed(empty)).isNull();
    }

    @Test
    void nonFiniteModelOutputExcludesThePatch() {
        EncoderModel broken = mock(EncoderModel.class);
        when(broken.getNormalization()).thenReturn(ChannelNormalization.identity(CHANNELS));
        when(broken.embed(any())).thenReturn(new float[]{0.5f, Float.NaN});
        SpatioTemporalEncoder brokenEncoder = new SpatioTemporalEncoder(broken, new PipelineProperties());

        EncodingResult result = brokenEncoder.encode(
                List.of(patch(0, randomTensor(2, 3L), new boolean[]{true, true})));

        assertThat(result.getEmbeddings()).isEmpty();
        assertThat(result.getExcluded()).extracting(Patch::getStatus).containsExactly(PatchStatus.INSUFFICIENT_DATA);
    }

    @Test
    void standardizationUsesTheModelNormalization() {
        double[] mean = new double[CHANNELS];
        double[] std = new double[CHANNELS];
        Arrays.fill(std, 1.0);
        mean[0] = 0.5;
        std[0] = 0.25;
        EncoderModel scaled = mock(EncoderModel.class);
        when(scaled.getNormalization()).thenReturn(ChannelNormalization.of(mean, std, CHANNELS));
        SpatioTemporalEncoder scaledEncoder = new SpatioTemporalEncoder(scaled, new PipelineProperties());

        double[][][][] tensor = randomTensor(1, 6L);
        tensor[0][1][2][0] = 1.0;
        float[][][][] frames = scaledEncoder.condition(patch(0, tensor, new boolean[]{true}));

        assertThat(frames[0][1][2][0]).isEqualTo(2.0f);
        assertThat(frames[0][1][2][1]).isEqualTo((float) tensor[0][1][2][1]);
    }

    @Test
    void patchesBelowMinimumTimestepsAreExcluded() {
        PipelineProperties strict = new PipelineProperties();
        strict.setMinValidTimesteps(3);
        SpatioTemporalEncoder strictEncoder = new SpatioTemporalEncoder(model, strict);

        Patch shortPatch = patch(0, randomTensor(2, 1L), new boolean[]{true, true});
        Patch longPatch = patch(1, randomTensor(3, 2L), new boolean[]{true, true, true});

        EncodingResult result = strictEncoder.encode(List.of(shortPatch, longPatch));

        assertThat(result.getEmbeddings()).hasSize(1);
        assertThat(result.getEmbeddings().get(0).getPatch().getOrdinal()).isEqualTo(1);
        assertThat(result.getExcluded()).hasSize(1);
        assertThat(result.getExcluded().get(0).getStatus()).isEqualTo(PatchStatus.INSUFFICIENT_DATA);
    }

    private static Patch patch(int ordinal, double[][][][] tensor, boolean[] valid) {
        return new Patch(ordinal, new PatchAnchor(0, 0, SIZE), tensor, valid, PatchStatus.VALID);
    }

    private static double[][][][] randomTensor(int timesteps, long seed) {
        Random random = new Random(seed);
        double[][][][] tensor = new double[timesteps][SIZE][SIZE][CHANNELS];
        for (double[][][] frame : tensor) {
            for (double[][] row : frame) {
                for (double[] pixel : row) {
                    for (int ch = 0; ch < CHANNELS; ch++) {
                        pixel[ch] = random.nextDouble() * 2.0 - 1.0;
                    }
                }
            }
        }
        return tensor;
    }

    private static double[][][] nanFrame() {
        double[][][] frame = new double[SIZE][SIZE][CHANNELS];
        for (double[][] row : frame) {
            for (double[] pixel : row) {
                Arrays.fill(pixel, Double.NaN);
            }
        }
        return frame;
    }
}
