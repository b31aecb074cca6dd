package com.cloudscheduler.common.confidence;

import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.stats.WindowStatistics;

/**
 * Scores how far a forecast built from a feature history can be trusted.
 *
 * <h3>Model</h3>
 * <pre>
 *   rows &lt; 24              → 0.5
 *   cv(x)                   = stdev(x) / (mean(x) + 1e-8)      over the last 24 rows
 *   stabilityScore          = 1 / (1 + cv(cpu) + cv(memory))
 *   dataScore               = min(1, rows / 168)               (one week of hourly data scores 1)
 *   confidence              = clamp(0.7 × stability + 0.3 × data, 0.1, 0.95)
 * </pre>
 *
 * <p>Pure static utility. No logging, no state.
 */
public final class ConfidenceEstimator {

    static final int    MIN_ROWS          = 24;
    static final int    FULL_DATA_ROWS    = 168;
    static final double INSUFFICIENT_DATA = 0.5;
    static final double FLOOR             = 0.1;
    static final double CEILING           = 0.95;
    private static final double EPSILON   = 1e-8;

    private ConfidenceEstimator() {}

    public static double estimate(FeatureMatrix features) {
        int rows = features.rowCount();
        if (rows < MIN_ROWS) {
            return INSUFFICIENT_DATA;
        }
        double[][] recent = features.lastBaseRows(MIN_ROWS);
        double cvCpu    = coefficientOfVariation(WindowStatistics.column(recent, FeatureMatrix.CPU));
        double cvMemory = coefficientOfVariation(WindowStatistics.column(recent, FeatureMatrix.MEMORY));

        double stabilityScore = 1.0 / (1.0 + cvCpu + cvMemory);
        double dataScore      = Math.min(1.0, rows / (double) FULL_DATA_ROWS);
        double confidence     = 0.7 * stabilityScore + 0.3 * dataScore;
        if (Double.isNaN(confidence)) {
            return FLOOR;
        }
        return Math.max(FLOOR, Math.min(CEILING, confidence));
    }

    static double coefficientOfVariation(double[] values) {
        return WindowStatistics.stdDev(values) / (WindowStatistics.mean(values) + EPSILON);
    }
}
