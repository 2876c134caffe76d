package com.company.cropstress.service;

import com.company.cropstress.config.PipelineProperties;
import com.company.cropstress.domain.ClusteringResult;
import com.company.cropstress.domain.Embedding;
import com.company.cropstress.domain.Patch;
import com.company.cropstress.domain.RasterStack;
import com.company.cropstress.domain.StressCluster;
import com.company.cropstress.domain.enums.StressLevel;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.company.cropstress.exception.InsufficientDataException;
import com.company.cropstress.util.RasterMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Partitions the valid patches into exactly three stress groups and orders them by stress score.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StressClusteringService {

    public static final int CLUSTER_COUNT = 3;

    static final double NDVI_WEIGHT = 0.40;
    static final double NDRE_WEIGHT = 0.30;
    static final double SMI_WEIGHT = 0.30;

    private final PipelineProperties properties;
    private final ClusterProfiler clusterProfiler;

    public ClusteringResult cluster(List<Embedding> embeddings, RasterStack rasterStack) {
        if (embeddings.size() < CLUSTER_COUNT) {
            throw new InsufficientDataException("Clustering needs at least " + CLUSTER_COUNT
                    + " valid patches, got " + embeddings.size());
        }
        long distinct = countDistinct(embeddings);
        if (distinct < CLUSTER_COUNT) {
            throw new InsufficientDataException("Clustering needs at least " + CLUSTER_COUNT
                    + " distinct embeddings, got " + distinct);
        }

        double[][] standardized = RasterMath.standardizeColumns(
                embeddings.stream().map(Embedding::toArray).toArray(double[][]::new));
        List<EmbeddingPoint> points = new ArrayList<>(embeddings.size());
        for (int i = 0; i < standardized.length; i++) {
            points.add(new EmbeddingPoint(i, standardized[i]));
        }

        KMeansPlusPlusClusterer<EmbeddingPoint> clusterer = new KMeansPlusPlusClusterer<>(
                CLUSTER_COUNT,
                properties.getClusteringMaxIterations(),
                new EuclideanDistance(),
                new Well19937c(properties.getClusteringSeed()),
                KMeansPlusPlusClusterer.EmptyClusterStrategy.LARGEST_VARIANCE);
        List<CentroidCluster<EmbeddingPoint>> raw = clusterer.cluster(points);

        List<Group> groups = new ArrayList<>(raw.size());
        for (CentroidCluster<EmbeddingPoint> cluster : raw) {
            List<Patch> members = cluster.getPoints().stream()
                    .sorted(Comparator.comparingInt(EmbeddingPoint::getPosition))
                    .map(p -> embeddings.get(p.getPosition()).getPatch())
                    .toList();
            if (members.isEmpty()) {
                throw new InsufficientDataException("Clustering produced an empty group");
            }
            ClusterProfiler.Profile profile = clusterProfiler.profile(members, rasterStack);
            groups.add(new Group(members, profile, stressScore(profile)));
        }

        groups.sort(GROUP_ORDER);

        Map<Integer, Double> scoreByPatch = new TreeMap<>();
        for (Embedding embedding : embeddings) {
            scoreByPatch.put(embedding.getPatch().getOrdinal(), patchStressScore(embedding.getPatch()));
        }

        List<StressCluster> clusters = new ArrayList<>(CLUSTER_COUNT);
        Map<Integer, StressLevel> levelByPatch = new TreeMap<>();
        for (int rank = 0; rank < groups.size(); rank++) {
            Group group = groups.get(rank);
            StressLevel level = StressLevel.forRank(rank);
            List<Double> memberScores = new ArrayList<>(group.members.size());
            for (Patch member : group.members) {
                levelByPatch.put(member.getOrdinal(), level);
                memberScores.add(scoreByPatch.get(member.getOrdinal()));
            }
            clusters.add(StressCluster.builder()
                    .level(level)
                    .stressScore(group.score)
                    .stressScoreSpread(RasterMath.summarize(memberScores))
                    .patchCount(group.members.size())
                    .areaPercentage(100.0 * group.members.size() / embeddings.size())
                    .anomalousPatchCount(0)
                    .indexStatistics(group.profile.getIndexStatistics())
                    .bandStatistics(group.profile.getBandStatistics())
                    .temporalTrends(group.profile.getTemporalTrends())
                    .anchors(group.members.stream().map(Patch::getAnchor).toList())
                    .build());
        }

        log.debug("Clustered {} patches: {}", embeddings.size(), clusters.stream()
                .map(c -> c.getLevel() + "=" + c.getPatchCount())
                .toList());

        return new ClusteringResult(List.copyOf(clusters), levelByPatch, scoreByPatch,
                properties.getClusteringSeed(), properties.getClusteringMaxIterations());
    }

    /**
     * Weighted greenness, chlorophyll and moisture deficit of a group's mean indices, in [0, 1]
     * for normalized-difference inputs. Missing terms are dropped and the weights renormalized.
     */
    static double stressScore(ClusterProfiler.Profile profile) {
        return stressScore(profile.meanOf(VegetationIndex.NDVI),
                profile.meanOf(VegetationIndex.NDRE),
                profile.meanOf(VegetationIndex.SMI));
    }

    /**
     * Stress score of one patch from its own mean indices over every pixel and timestep.
     */
    static double patchStressScore(Patch patch) {
        return stressScore(patchMean(patch, VegetationIndex.NDVI),
                patchMean(patch, VegetationIndex.NDRE),
                patchMean(patch, VegetationIndex.SMI));
    }

    private static double patchMean(Patch patch, VegetationIndex index) {
        SummaryStatistics stats = new SummaryStatistics();
        for (int t = 0; t < patch.timesteps(); t++) {
            for (int r = 0; r < patch.size(); r++) {
                for (int c = 0; c < patch.size(); c++) {
                    RasterMath.addFinite(stats, patch.value(t, r, c, index.ordinal()));
                }
            }
        }
        return stats.getN() == 0 ? Double.NaN : stats.getMean();
    }

    static double stressScore(double ndvi, double ndre, double smi) {
        double[] values = {ndvi, ndre, smi};
        double[] weights = {NDVI_WEIGHT, NDRE_WEIGHT, SMI_WEIGHT};
        double sum = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                sum += weights[i] * (1.0 - values[i]) / 2.0;
                weightSum += weights[i];
            }
        }
        return weightSum == 0.0 ? Double.NaN : sum / weightSum;
    }

    private static long countDistinct(List<Embedding> embeddings) {
        Set<List<Double>> seen = new HashSet<>();
        for (Embedding embedding : embeddings) {
            seen.add(Arrays.stream(embedding.toArray()).boxed().toList());
            if (seen.size() >= CLUSTER_COUNT) {
                break;
            }
        }
        return seen.size();
    }

    // NaN scores sort last (highest stress)
    private static final Comparator<Group> GROUP_ORDER = Comparator
            .<Group>comparingDouble(g -> g.score)
            .thenComparing(g -> g.members.size(), Comparator.reverseOrder())
            .thenComparingInt(g -> g.members.get(0).getOrdinal());

    private static final class Group {
        final List<Patch> members;
        final ClusterProfiler.Profile profile;
        final double score;

        Group(List<Patch> members, ClusterProfiler.Profile profile, double score) {
            this.members = members;
            this.profile = profile;
            this.score = score;
        }
    }

    private static final class EmbeddingPoint implements Clusterable {
        private final int position;
        private final double[] point;

        EmbeddingPoint(int position, double[] point) {
            this.position = position;
            this.point = point;
        }

        int getPosition() {
            return position;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
