package com.company.cropstress.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the analysis pipeline. Defaults are the documented contract; the cluster count
 * is fixed at three and is not configurable.
 */
@Data
@ConfigurationProperties(prefix = "cropstress.pipeline")
public class PipelineProperties {

    private int patchSize = 8;

    private int stride = 4;

    /**
     * Slope magnitude (index units per day) below which a trend is STABLE.
     */
    private double stableSlopePerDay = 0.0005;

    private int rollingWindow = 3;

    /**
     * Minimum finite per-timestep spatial vectors for a patch to be embedded.
     */
    private int minValidTimesteps = 1;

    private long clusteringSeed = 42L;

    private int clusteringMaxIterations = 300;

    private long anomalySeed = 42L;

    private double anomalyFraction = 0.10;

    private int isolationTrees = 100;

    private int isolationSubsample = 256;

    private boolean parallel = true;
}
