package com.company.cropstress.encoder;

import com.company.cropstress.exception.EncoderWeightsException;
import com.company.cropstress.support.TestEncoders;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceEncoderModelTest {

    private static final int SIZE = 8;
    private static final int CHANNELS = 13;

    @Test
    void sameSeedGivesSameFingerprintAndEmbeddings() {
        try (ReferenceEncoderModel first = ReferenceEncoderModel.generate(TestEncoders.smallArchitecture(), 7L);
             ReferenceEncoderModel second = ReferenceEncoderModel.generate(TestEncoders.smallArchitecture(), 7L)) {
            float[][][][] frames = frames(3, 1L);

            assertThat(second.getFingerprint()).isEqualTo(first.getFingerprint());
            assertThat(second.embed(frames)).containsExactly(first.embed(frames));
        }
    }

    @Test
    void fingerprintTracksSeedAndArchitecture() {
        EncoderArchitecture small = TestEncoders.smallArchitecture();
        EncoderArchitecture wider = EncoderArchitecture.builder()
                .inputChannels(small.getInputChannels())
                .convChannels(small.getConvChannels())
                .denseUnits(small.getDenseUnits())
                .spatialDim(small.getSpatialDim())
                .lstmUnits(12)
                .embeddingDim(small.getEmbeddingDim())
                .build();
        try (ReferenceEncoderModel base = ReferenceEncoderModel.generate(TestEncoders.smallArchitecture(), 7L);
             ReferenceEncoderModel reseeded = ReferenceEncoderModel.generate(TestEncoders.smallArchitecture(), 8L);
             ReferenceEncoderModel resized = ReferenceEncoderModel.generate(wider, 7L)) {

            assertThat(base.getFingerprint()).startsWith("sha256:").hasSize("sha256:".length() + 64);
            assertThat(reseeded.getFingerprint()).isNotEqualTo(base.getFingerprint());
            assertThat(resized.getFingerprint()).isNotEqualTo(base.getFingerprint());
        }
    }

    @Test
    void repeatedCallsAreBitIdentical() {
        EncoderModel model = TestEncoders.smallModel();
        float[][][][] frames = frames(4, 2L);

        float[] first = model.embed(frames);

        assertThat(first).hasSize(16);
        for (int i = 0; i < 5; i++) {
            assertThat(model.embed(frames)).containsExactly(first);
        }
    }

    @Test
    void servesSequencesOfAnyLength() {
        EncoderModel model = TestEncoders.smallModel();

        for (int timesteps : List.of(1, 2, 5)) {
            float[] embedding = model.embed(frames(timesteps, timesteps));
            assertThat(embedding).hasSize(16);
            for (float v : embedding) {
                assertThat(v).isFinite().isGreaterThanOrEqualTo(0.0f);
            }
        }
    }

    @Test
    void referenceNormalizationIsIdentity() {
        ChannelNormalization normalization = TestEncoders.smallModel().getNormalization();

        assertThat(normalization.getMean()).containsOnly(0.0).hasSize(CHANNELS);
        assertThat(normalization.getStd()).containsOnly(1.0).hasSize(CHANNELS);
        assertThat(normalization.standardize(3, 0.42)).isEqualTo(0.42f);
    }

    @Test
    void normalizationRejectsBadStd() {
        double[] std = new double[CHANNELS];

        assertThatThrownBy(() -> ChannelNormalization.of(null, std, CHANNELS))
                .isInstanceOf(EncoderWeightsException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> ChannelNormalization.of(new double[2], null, CHANNELS))
                .isInstanceOf(EncoderWeightsException.class)
                .hasMessageContaining("13 entries");
    }

    static float[][][][] frames(int timesteps, long seed) {
        Random random = new Random(seed);
        float[][][][] frames = new float[timesteps][SIZE][SIZE][CHANNELS];
        for (float[][][] frame : frames) {
            for (float[][] row : frame) {
                for (float[] pixel : row) {
                    for (int ch = 0; ch < CHANNELS; ch++) {
                        pixel[ch] = random.nextFloat() * 2.0f - 1.0f;
                    }
                }
            }
        }
        return frames;
    }
}
