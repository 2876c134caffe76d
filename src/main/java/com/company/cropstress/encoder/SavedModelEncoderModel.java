package com.company.cropstress.encoder;

import com.company.cropstress.exception.EncoderWeightsException;
import lombok.extern.slf4j.Slf4j;
import org.tensorflow.SavedModelBundle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Encoder loaded from a TensorFlow SavedModel directory. Inputs are fed to and the embedding is
 * fetched from the configured graph nodes.
 */
@Slf4j
public final class SavedModelEncoderModel implements EncoderModel {

    public static final String SERVING_TAG = "serve";

    private final SavedModelBundle bundle;
    private final EncoderArchitecture architecture;
    private final ChannelNormalization normalization;
    private final String inputNode;
    private final String outputNode;
    private final String fingerprint;

    private SavedModelEncoderModel(SavedModelBundle bundle, EncoderArchitecture architecture,
                                   ChannelNormalization normalization, String inputNode, String outputNode,
                                   String fingerprint) {
        this.bundle = bundle;
        this.architecture = architecture;
        this.normalization = normalization;
        this.inputNode = inputNode;
        this.outputNode = outputNode;
        this.fingerprint = fingerprint;
    }

    public static SavedModelEncoderModel load(Path modelDir, EncoderArchitecture architecture,
                                              ChannelNormalization normalization,
                                              String inputNode, String outputNode) {
        if (!Files.isDirectory(modelDir)) {
            throw new EncoderWeightsException("Encoder model directory not found: " + modelDir);
        }
        String fingerprint = fingerprint(modelDir, architecture, normalization);

        SavedModelBundle bundle;
        try {
            bundle = SavedModelBundle.loader(modelDir.toString())
                    .withTags(SERVING_TAG)
                    .withConfigProto(SessionInference.deterministicConfig())
                    .load();
        } catch (RuntimeException e) {
            throw new EncoderWeightsException("Failed to load encoder model from " + modelDir, e);
        }

        for (String node : List.of(inputNode, outputNode)) {
            if (bundle.graph().operation(node) == null) {
                bundle.close();
                throw new EncoderWeightsException("Encoder model " + modelDir + " has no node '" + node + "'");
            }
        }
        log.debug("Encoder model {} feeds '{}' and fetches '{}'", modelDir, inputNode, outputNode);
        return new SavedModelEncoderModel(bundle, architecture, normalization, inputNode, outputNode, fingerprint);
    }

    @Override
    public float[] embed(float[][][][] frames) {
        return SessionInference.run(bundle.session(), inputNode, outputNode, frames, architecture.getEmbeddingDim());
    }

    /**
     * Digest of every file under the model directory in path order, plus the declared
     * architecture and normalization.
     */
    private static String fingerprint(Path modelDir, EncoderArchitecture architecture,
                                      ChannelNormalization normalization) {
        Fingerprint digest = new Fingerprint();
        digest.update(architecture.toString());
        normalization.digest(digest);
        try (Stream<Path> walk = Files.walk(modelDir)) {
            List<Path> files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            for (Path file : files) {
                digest.update(modelDir.relativize(file).toString().replace('\\', '/'));
                digest.update(Files.readAllBytes(file));
            }
        } catch (IOException e) {
            throw new EncoderWeightsException("Failed to read encoder model from " + modelDir, e);
        }
        return digest.hex();
    }

    @Override
    public EncoderArchitecture getArchitecture() {
        return architecture;
    }

    @Override
    public String getFingerprint() {
        return fingerprint;
    }

    @Override
    public ChannelNormalization getNormalization() {
        return normalization;
    }

    @Override
    public void close() {
        bundle.close();
    }
}
