package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.model.ForecastPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForecastCombinerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private static ForecastPoint point(int offset, double v) {
        return ForecastPoint.clamped(NOW, offset, v, v, v, v * 10);
    }

    @Test
    @DisplayName("blends 0.6 sequence + 0.4 ensemble per field")
    void weightedBlend() {
        List<ForecastPoint> combined = ForecastCombiner.combine(
            List.of(point(1, 50), point(2, 60)), List.of(point(1, 100), point(2, 10)));
        assertEquals(2, combined.size());
        assertEquals(70.0, combined.get(0).cpuUsagePercent(), 1e-9);
        assertEquals(700.0, combined.get(0).networkUsage(), 1e-9);
        assertEquals(40.0, combined.get(1).memoryUsagePercent(), 1e-9);
        assertEquals(2, combined.get(1).timestampOffsetHours());
    }

    @Test
    @DisplayName("empty side → other side unchanged")
    void emptySide() {
        List<ForecastPoint> only = List.of(point(1, 42));
        assertSame(only, ForecastCombiner.combine(List.of(), only));
        assertSame(only, ForecastCombiner.combine(only, List.of()));
        assertTrue(ForecastCombiner.combine(List.of(), List.of()).isEmpty());
    }

    @Test
    @DisplayName("unequal lengths → truncated to the overlap")
    void truncatesToOverlap() {
        List<ForecastPoint> combined = ForecastCombiner.combine(
            List.of(point(1, 10), point(2, 10), point(3, 10)), List.of(point(1, 20)));
        assertEquals(1, combined.size());
        assertEquals(14.0, combined.get(0).cpuUsagePercent(), 1e-9);
    }
}
