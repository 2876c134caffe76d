package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.AnomalyRecord;
import com.company.cropstress.domain.Embedding;
import com.company.cropstress.domain.enums.StressCategory;
import com.company.cropstress.domain.enums.StressLevel;
import com.company.cropstress.util.RasterMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Scores every valid patch for outlierness independently of the stress groups and flags the
 * highest-scoring fraction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetector {

    private final PipelineProperties properties;

    /**
     * @param levelByPatch stress level per patch ordinal, attached to the records for reference only
     * @param scoreByPatch the patch's own stress score, attached with its category
     */
    public List<AnomalyRecord> detect(List<Embedding> embeddings, Map<Integer, StressLevel> levelByPatch,
                                      Map<Integer, Double> scoreByPatch) {
        if (embeddings.isEmpty()) {
            return List.of();
        }

        double[][] standardized = RasterMath.standardizeColumns(
                embeddings.stream().map(Embedding::toArray).toArray(double[][]::new));

        IsolationForest forest = IsolationForest.fit(standardized,
                properties.getIsolationTrees(),
                properties.getIsolationSubsample(),
                new Well19937c(properties.getAnomalySeed()));

        double[] scores = new double[standardized.length];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = forest.score(standardized[i]);
        }

        int flagCount = flagCount(embeddings.size(), properties.getAnomalyFraction());
        boolean[] flagged = new boolean[scores.length];
        IntStream.range(0, scores.length)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                        .thenComparingInt(i -> embeddings.get(i).getPatch().getOrdinal()))
                .limit(flagCount)
                .forEach(i -> flagged[i] = true);

        List<AnomalyRecord> records = new ArrayList<>(embeddings.size());
        for (int i = 0; i < embeddings.size(); i++) {
            Embedding embedding = embeddings.get(i);
            int ordinal = embedding.getPatch().getOrdinal();
            double stressScore = scoreByPatch.getOrDefault(ordinal, Double.NaN);
            records.add(AnomalyRecord.builder()
                    .patchOrdinal(ordinal)
                    .anchor(embedding.getAnchor())
                    .score(scores[i])
                    .anomalous(flagged[i])
                    .stressLevel(levelByPatch.get(ordinal))
                    .stressScore(stressScore)
                    .stressCategory(StressCategory.forScore(stressScore))
                    .build());
        }

        if (log.isDebugEnabled()) {
            log.debug("Flagged {} of {} patches as anomalous: {}", flagCount, embeddings.size(),
                    records.stream().filter(AnomalyRecord::isAnomalous)
                            .map(r -> String.valueOf(r.getPatchOrdinal()))
                            .collect(Collectors.joining(",")));
        }
        return records;
    }

    static int flagCount(int n, double fraction) {
        return (int) Math.min(n, Math.round(fraction * n));
    }
}
