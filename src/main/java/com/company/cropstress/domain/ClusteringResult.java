package com.company.cropstress.domain;

import com.company.cropstress.domain.enums.StressLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * The three relabelled clusters plus the level and own stress score of every clustered patch,
 * keyed by patch ordinal.
 */
@Getter
@AllArgsConstructor
public class ClusteringResult {
    private final List<StressCluster> clusters;
    private final Map<Integer, StressLevel> levelByPatch;
    private final Map<Integer, Double> scoreByPatch;
    private final long seed;
    private final int maxIterations;
}
