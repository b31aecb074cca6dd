package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cloudscheduler.common.forecast.ForecastFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FallbackTrendEstimatorTest {

    @Test
    @DisplayName("baseline is the mean of the last 24 rows")
    void baselineOverRecentRows() {
        double[] baseline = FallbackTrendEstimator.baseline(constant(40, 60, 45, 20, 800));
        assertArrayEquals(new double[] {60, 45, 20, 800}, baseline, 1e-9);
    }

    @Test
    @DisplayName("no rows → fixed defaults 20/30/15/1000")
    void emptyFeaturesUseDefaults() {
        assertArrayEquals(new double[] {20, 30, 15, 1000},
            FallbackTrendEstimator.baseline(FeatureMatrix.empty()));
    }

    @Test
    @DisplayName("horizon points, hourly stamped, clamped, near the baseline")
    void estimateShape() {
        List<ForecastPoint> points = FallbackTrendEstimator.estimate(constant(30, 50, 40, 20, 1000), 12, context(1));
        assertEquals(12, points.size());
        assertHourlyOffsets(points);
        assertWithinBounds(points);
        // σ of the jitter is 5 at a baseline of 50
        points.forEach(p -> assertEquals(50, p.cpuUsagePercent(), 25));
    }

    @Test
    @DisplayName("same seed → same jitter")
    void seededIsReproducible() {
        FeatureMatrix features = constant(30, 50, 40, 20, 1000);
        assertEquals(FallbackTrendEstimator.estimate(features, 8, context(9)),
                     FallbackTrendEstimator.estimate(features, 8, context(9)));
    }

    @Test
    @DisplayName("estimateRemaining() continues offsets after the produced steps")
    void remainingOffsets() {
        List<ForecastPoint> tail = FallbackTrendEstimator.estimateRemaining(constant(30, 50, 40, 20, 1000), 5, 8, context(3));
        assertEquals(3, tail.size());
        assertEquals(6, tail.get(0).timestampOffsetHours());
        assertEquals(8, tail.get(2).timestampOffsetHours());
    }
}
