package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.feature.FeatureExtractor;
import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.model.MetricSample;
import org.apache.commons.math3.random.Well19937c;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

/** Shared histories and assertions for forecaster tests. */
final class ForecastFixtures {

    static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private ForecastFixtures() {}

    /** Hourly samples ending one hour before {@link #NOW}; cpu follows a daily sine around 50. */
    static FeatureMatrix dailyCycle(int hours) {
        List<MetricSample> samples = new ArrayList<>(hours);
        Instant start = NOW.minus(Duration.ofHours(hours));
        for (int i = 0; i < hours; i++) {
            double phase = 2 * Math.PI * i / 24.0;
            samples.add(MetricSample.of(start.plus(Duration.ofHours(i)),
                50 + 20 * Math.sin(phase), 40 + 5 * Math.cos(phase), 30 + 0.1 * i, 2_000 + 100 * Math.sin(phase)));
        }
        return FeatureExtractor.extract(samples);
    }

    static FeatureMatrix constant(int hours, double cpu, double memory, double disk, double network) {
        List<MetricSample> samples = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            samples.add(MetricSample.of(null, cpu, memory, disk, network));
        }
        return FeatureExtractor.extract(samples);
    }

    static ForecastContext context(long seed) {
        return new ForecastContext(NOW, new Well19937c(seed));
    }

    static void assertWithinBounds(List<ForecastPoint> points) {
        for (ForecastPoint p : points) {
            assertTrue(p.cpuUsagePercent() >= 0 && p.cpuUsagePercent() <= 100, "cpu out of range: " + p);
            assertTrue(p.memoryUsagePercent() >= 0 && p.memoryUsagePercent() <= 100, "memory out of range: " + p);
            assertTrue(p.diskUsagePercent() >= 0 && p.diskUsagePercent() <= 100, "disk out of range: " + p);
            assertTrue(p.networkUsage() >= 0, "network negative: " + p);
        }
    }

    static void assertHourlyOffsets(List<ForecastPoint> points) {
        for (int i = 0; i < points.size(); i++) {
            ForecastPoint p = points.get(i);
            assertTrue(p.timestampOffsetHours() == i + 1, "offset mismatch at " + i + ": " + p);
            assertTrue(p.timestamp().equals(NOW.plus(Duration.ofHours(i + 1))), "timestamp mismatch at " + i);
        }
    }
}
