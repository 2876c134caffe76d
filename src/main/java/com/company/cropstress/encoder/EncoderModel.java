package com.company.cropstress.encoder;

/**
 * A loaded encoder network. Implementations are thread-safe and shared by every analysis.
 */
public interface EncoderModel extends AutoCloseable {

    EncoderArchitecture getArchitecture();

    /**
     * @return "sha256:" followed by the hex digest of the parameters the model runs with
     */
    String getFingerprint();

    ChannelNormalization getNormalization();

    /**
     * Runs the network over one conditioned patch.
     *
     * @param frames standardized values laid out as (timestep, row, column, channel)
     * @return the embedding vector
     */
    float[] embed(float[][][][] frames);

    @Override
    void close();
}
