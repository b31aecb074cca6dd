package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.stats.WindowStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Degradation path used when a forecaster cannot produce (part of) its horizon.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Baseline = mean of each base metric over the last {@value #BASELINE_ROWS} rows, or the
 *       fixed defaults (cpu 20, memory 30, disk 15, network 1000) when there are no rows.</li>
 *   <li>Each step = baseline × (1 + N(0, {@value #NOISE_STD_DEV})) drawn independently per field
 *       in cpu, memory, disk, network order, then clamped.</li>
 * </ol>
 *
 * <p>All randomness comes from the caller's {@link ForecastContext#random()}, so a seeded
 * generator gives a reproducible forecast.
 */
public final class FallbackTrendEstimator {

    static final int    BASELINE_ROWS   = 24;
    static final double NOISE_STD_DEV   = 0.1;
    static final double[] DEFAULT_BASELINE = {20.0, 30.0, 15.0, 1000.0};

    private FallbackTrendEstimator() {}

    public static List<ForecastPoint> estimate(FeatureMatrix features, int horizon, ForecastContext context) {
        return estimateRemaining(features, 0, horizon, context);
    }

    /**
     * Produces steps {@code fromStep .. horizon-1} only, stamped {@code fromStep+1 .. horizon}
     * hours after {@code now}.
     */
    public static List<ForecastPoint> estimateRemaining(FeatureMatrix features, int fromStep,
                                                        int horizon, ForecastContext context) {
        double[] baseline = baseline(features);
        List<ForecastPoint> points = new ArrayList<>(Math.max(0, horizon - fromStep));
        for (int step = fromStep; step < horizon; step++) {
            double[] values = new double[FeatureMatrix.BASE_COLUMN_COUNT];
            for (int c = 0; c < values.length; c++) {
                values[c] = baseline[c] * (1.0 + context.random().nextGaussian() * NOISE_STD_DEV);
            }
            points.add(ForecastPoint.clamped(context.now(), step + 1, values));
        }
        return points;
    }

    static double[] baseline(FeatureMatrix features) {
        if (features == null || features.isEmpty()) {
            return DEFAULT_BASELINE.clone();
        }
        double[][] recent = features.lastBaseRows(BASELINE_ROWS);
        double[] baseline = new double[FeatureMatrix.BASE_COLUMN_COUNT];
        for (int c = 0; c < baseline.length; c++) {
            baseline[c] = WindowStatistics.mean(WindowStatistics.column(recent, c));
        }
        return baseline;
    }
}
