package com.cloudscheduler.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * A single hourly forecast step.
 *
 * <p>Percent fields are kept in [0, 100] and {@code networkUsage} is non-negative when the
 * point is built through {@link #clamped}. Points received from outside the engine (for
 * example on the schedule endpoint) are taken as-is.
 */
public record ForecastPoint(
    @JsonProperty("timestamp")            Instant timestamp,
    @JsonProperty("timestampOffsetHours") int timestampOffsetHours,
    @JsonProperty("cpuUsagePercent")
    @JsonAlias("cpu_usage_percent")       double cpuUsagePercent,
    @JsonProperty("memoryUsagePercent")
    @JsonAlias("memory_usage_percent")    double memoryUsagePercent,
    @JsonProperty("diskUsagePercent")
    @JsonAlias("disk_usage_percent")      double diskUsagePercent,
    @JsonProperty("networkUsage")
    @JsonAlias("network_usage")           double networkUsage
) {
    /**
     * Builds the point for step {@code offsetHours} after {@code now}, clamping every field
     * to its valid range.
     */
    public static ForecastPoint clamped(Instant now, int offsetHours, double cpu,
                                        double memory, double disk, double network) {
        return new ForecastPoint(
            now.plus(Duration.ofHours(offsetHours)),
            offsetHours,
            clampPercent(cpu),
            clampPercent(memory),
            clampPercent(disk),
            Math.max(0.0, network));
    }

    /** Same as {@link #clamped(Instant, int, double, double, double, double)} for a cpu/mem/disk/net vector. */
    public static ForecastPoint clamped(Instant now, int offsetHours, double[] values) {
        return clamped(now, offsetHours, values[0], values[1], values[2], values[3]);
    }

    private static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
