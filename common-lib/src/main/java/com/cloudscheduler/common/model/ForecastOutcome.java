package com.cloudscheduler.common.model;

import java.util.List;

/**
 * Output of a single forecaster run.
 *
 * @param points         forecast points in step order
 * @param fallbackPoints how many trailing points were produced by the fallback estimator
 */
public record ForecastOutcome(List<ForecastPoint> points, int fallbackPoints) {

    public ForecastOutcome {
        points = List.copyOf(points);
    }

    public int modelPoints() {
        return points.size() - fallbackPoints;
    }

    public static ForecastOutcome fromModel(List<ForecastPoint> points) {
        return new ForecastOutcome(points, 0);
    }

    public static ForecastOutcome fromFallback(List<ForecastPoint> points) {
        return new ForecastOutcome(points, points.size());
    }
}
