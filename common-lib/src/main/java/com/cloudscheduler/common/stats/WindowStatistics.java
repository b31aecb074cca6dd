package com.cloudscheduler.common.stats;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Summary statistics over a window of values.
 *
 * <p>Every method returns {@code 0.0} for an empty window instead of {@code NaN}, so callers
 * can compare the result against thresholds without special-casing short forecasts.
 * Standard deviation is the population form (divisor n).
 */
public final class WindowStatistics {

    private WindowStatistics() {}

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : new DescriptiveStatistics(values).getMean();
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : new DescriptiveStatistics(values).getMax();
    }

    public static double stdDev(double[] values) {
        return values.length == 0 ? 0.0 : Math.sqrt(new DescriptiveStatistics(values).getPopulationVariance());
    }

    /** Extracts column {@code column} of {@code rows}. */
    public static double[] column(double[][] rows, int column) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][column];
        }
        return values;
    }
}
