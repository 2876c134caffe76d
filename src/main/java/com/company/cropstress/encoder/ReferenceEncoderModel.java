package com.company.cropstress.encoder;

import lombok.extern.slf4j.Slf4j;
import org.tensorflow.Graph;
import org.tensorflow.Session;
import org.tensorflow.op.Ops;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encoder built in-process from seeded weights. The weights are graph constants; one graph and
 * session is built per distinct (timesteps, patch size) input shape and reused afterwards.
 */
@Slf4j
public final class ReferenceEncoderModel implements EncoderModel {

    private final EncoderArchitecture architecture;
    private final ChannelNormalization normalization;
    private final EncoderGraphBuilder graphBuilder;
    private final String fingerprint;
    private final Map<String, CompiledGraph> graphs = new ConcurrentHashMap<>();

    private ReferenceEncoderModel(EncoderArchitecture architecture, ReferenceWeights weights) {
        this.architecture = architecture;
        this.normalization = ChannelNormalization.identity(architecture.getInputChannels());
        this.graphBuilder = new EncoderGraphBuilder(architecture, weights);

        Fingerprint digest = new Fingerprint();
        digest.update(architecture.toString());
        normalization.digest(digest);
        weights.digest(digest);
        this.fingerprint = digest.hex();
    }

    /**
     * Identical architecture and seed give identical weights and fingerprint.
     */
    public static ReferenceEncoderModel generate(EncoderArchitecture architecture, long seed) {
        return new ReferenceEncoderModel(architecture, ReferenceWeights.generate(architecture, seed));
    }

    @Override
    public float[] embed(float[][][][] frames) {
        int timesteps = frames.length;
        int size = frames[0].length;
        CompiledGraph compiled = graphs.computeIfAbsent(timesteps + "x" + size, key -> compile(timesteps, size));
        return SessionInference.run(compiled.session, EncoderGraphBuilder.INPUT, EncoderGraphBuilder.OUTPUT,
                frames, architecture.getEmbeddingDim());
    }

    EncoderGraphBuilder graphBuilder() {
        return graphBuilder;
    }

    private CompiledGraph compile(int timesteps, int size) {
        log.debug("Building encoder graph for {} timesteps of {}x{} pixels", timesteps, size, size);
        Graph graph = new Graph();
        try {
            graphBuilder.build(Ops.create(graph), timesteps, size);
            return new CompiledGraph(graph, new Session(graph, SessionInference.deterministicConfig()));
        } catch (RuntimeException e) {
            graph.close();
            throw e;
        }
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
        graphs.values().forEach(CompiledGraph::close);
        graphs.clear();
    }

    private static final class CompiledGraph {
        private final Graph graph;
        private final Session session;

        private CompiledGraph(Graph graph, Session session) {
            this.graph = graph;
            this.session = session;
        }

        private void close() {
            session.close();
            graph.close();
        }
    }
}
