package com.company.cropstress.config;

import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.encoder.ChannelNormalization;
import com.company.cropstress.encoder.EncoderArchitecture;
import com.company.cropstress.encoder.EncoderModel;
import com.company.cropstress.encoder.ReferenceEncoderModel;
import com.company.cropstress.encoder.SavedModelEncoderModel;
import com.company.cropstress.exception.EncoderWeightsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.tensorflow.TensorFlow;

import java.nio.file.Path;

/**
 * Loads the encoder model once at startup. The model is closed with the context.
 */
@Configuration
@Slf4j
public class EncoderConfig {

    @Bean
    public EncoderModel encoderModel(EncoderProperties properties) {
        log.info("Using TensorFlow {}", tensorFlowVersion());

        EncoderArchitecture architecture = EncoderArchitecture.from(properties);
        int channels = VegetationIndex.values().length;
        if (architecture.getInputChannels() != channels) {
            throw new EncoderWeightsException("Encoder expects " + architecture.getInputChannels()
                    + " input channels, index table has " + channels);
        }

        EncoderModel model;
        if (StringUtils.hasText(properties.getWeightsPath())) {
            Path path = Path.of(properties.getWeightsPath());
            ChannelNormalization normalization =
                    ChannelNormalization.of(properties.getChannelMean(), properties.getChannelStd(), channels);
            model = SavedModelEncoderModel.load(path, architecture, normalization,
                    properties.getInputNode(), properties.getOutputNode());
            log.info("Loaded encoder model from {} ({})", path, model.getFingerprint());
        } else {
            model = ReferenceEncoderModel.generate(architecture, properties.getSeed());
            log.warn("No encoder model configured (cropstress.encoder.weights-path); "
                    + "using reference weights generated from seed {} ({})",
                    properties.getSeed(), model.getFingerprint());
        }
        log.info("Encoder architecture: {}", model.getArchitecture());
        return model;
    }

    private static String tensorFlowVersion() {
        try {
            return TensorFlow.version();
        } catch (LinkageError e) {
            throw new IllegalStateException("TensorFlow native library could not be loaded", e);
        }
    }
}
