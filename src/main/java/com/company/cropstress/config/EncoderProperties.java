package com.company.cropstress.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "cropstress.encoder")
public class EncoderProperties {

    /**
     * TensorFlow SavedModel directory. When blank, the reference network is built from {@link #seed}.
     */
    private String weightsPath;

    private String inputNode = "frames";

    private String outputNode = "embedding";

    /**
     * Per-channel standardization of a loaded model; zero mean and unit std when unset.
     */
    private double[] channelMean;

    private double[] channelStd;

    private long seed = 20240115L;

    private int[] convChannels = {32, 64, 128};

    private int denseUnits = 256;

    private int spatialDim = 128;

    private int lstmUnits = 64;

    private int embeddingDim = 128;
}
