package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.model.ForecastPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-weight blend of the sequence and ensemble forecasts.
 *
 * <pre>
 *   combined = 0.6 × sequence + 0.4 × ensemble     (per field)
 * </pre>
 *
 * <p>An empty side yields the other side unchanged. Otherwise only the overlapping prefix is
 * blended, so unequal inputs produce the shorter length. Timestamps come from the sequence
 * forecast. Pure and stateless.
 */
public final class ForecastCombiner {

    static final double SEQUENCE_WEIGHT = 0.6;
    static final double ENSEMBLE_WEIGHT = 0.4;

    private ForecastCombiner() {}

    public static List<ForecastPoint> combine(List<ForecastPoint> sequence, List<ForecastPoint> ensemble) {
        if (sequence == null || sequence.isEmpty()) {
            return ensemble == null ? List.of() : ensemble;
        }
        if (ensemble == null || ensemble.isEmpty()) {
            return sequence;
        }
        int overlap = Math.min(sequence.size(), ensemble.size());
        List<ForecastPoint> combined = new ArrayList<>(overlap);
        for (int i = 0; i < overlap; i++) {
            ForecastPoint s = sequence.get(i);
            ForecastPoint e = ensemble.get(i);
            combined.add(new ForecastPoint(
                s.timestamp(),
                s.timestampOffsetHours(),
                blend(s.cpuUsagePercent(), e.cpuUsagePercent()),
                blend(s.memoryUsagePercent(), e.memoryUsagePercent()),
                blend(s.diskUsagePercent(), e.diskUsagePercent()),
                blend(s.networkUsage(), e.networkUsage())));
        }
        return combined;
    }

    private static double blend(double sequenceValue, double ensembleValue) {
        return SEQUENCE_WEIGHT * sequenceValue + ENSEMBLE_WEIGHT * ensembleValue;
    }
}
