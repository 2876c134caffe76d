package com.company.cropstress.util;

import com.company.cropstress.domain.RangeStatistics;
import com.company.cropstress.domain.ValueStatistics;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * NaN-aware reductions. Non-finite values are skipped; population standard deviation is used.
 */
public class RasterMath {

    public static ValueStatistics describe(double[] values) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (double v : values) {
            if (Double.isFinite(v)) {
                stats.addValue(v);
            }
        }
        if (stats.getN() == 0) {
            return ValueStatistics.empty();
        }
        return ValueStatistics.builder()
                .mean(stats.getMean())
                .std(Math.sqrt(stats.getPopulationVariance()))
                .min(stats.getMin())
                .max(stats.getMax())
                .median(stats.getPercentile(50))
                .validCount(stats.getN())
                .build();
    }

    public static RangeStatistics summarize(SummaryStatistics stats) {
        if (stats.getN() == 0) {
            return new RangeStatistics(Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }
        return new RangeStatistics(stats.getMean(), Math.sqrt(stats.getPopulationVariance()),
                stats.getMin(), stats.getMax(), stats.getN());
    }

    public static RangeStatistics summarize(Iterable<Double> values) {
        SummaryStatistics stats = new SummaryStatistics();
        for (Double v : values) {
            addFinite(stats, v);
        }
        return summarize(stats);
    }

    public static void addFinite(SummaryStatistics stats, double value) {
        if (Double.isFinite(value)) {
            stats.addValue(value);
        }
    }

    /**
     * Column-wise z-score of a row-per-sample matrix. Zero-variance columns are only centred.
     */
    public static double[][] standardizeColumns(double[][] rows) {
        if (rows.length == 0) {
            return new double[0][];
        }
        int dims = rows[0].length;
        double[][] out = new double[rows.length][dims];
        for (int d = 0; d < dims; d++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (double[] row : rows) {
                stats.addValue(row[d]);
            }
            double mean = stats.getMean();
            double std = Math.sqrt(stats.getPopulationVariance());
            for (int i = 0; i < rows.length; i++) {
                double centred = rows[i][d] - mean;
                out[i][d] = std > 0 ? centred / std : centred;
            }
        }
        return out;
    }
}
