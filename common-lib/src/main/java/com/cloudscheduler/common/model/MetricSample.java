package com.cloudscheduler.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One utilization sample for a resource as supplied by the monitoring collaborator.
 * Every field is optional; gaps are filled by {@link com.cloudscheduler.common.feature.FeatureExtractor}.
 */
public record MetricSample(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("cpuUsagePercent")
    @JsonAlias("cpu_usage_percent")    Double cpuUsagePercent,
    @JsonProperty("memoryUsagePercent")
    @JsonAlias("memory_usage_percent") Double memoryUsagePercent,
    @JsonProperty("diskUsagePercent")
    @JsonAlias("disk_usage_percent")   Double diskUsagePercent,
    @JsonProperty("networkInBytes")
    @JsonAlias("network_in_bytes")     Double networkInBytes
) {
    public static MetricSample of(Instant timestamp, double cpu, double memory,
                                  double disk, double networkIn) {
        return new MetricSample(timestamp, cpu, memory, disk, networkIn);
    }

    /**
     * Snapshot of the sample in the key format the decision policy reads.
     * Absent fields are left out.
     */
    public Map<String, Double> asCurrentMetrics() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (cpuUsagePercent != null)    metrics.put("cpuUsagePercent", cpuUsagePercent);
        if (memoryUsagePercent != null) metrics.put("memoryUsagePercent", memoryUsagePercent);
        if (diskUsagePercent != null)   metrics.put("diskUsagePercent", diskUsagePercent);
        if (networkInBytes != null)     metrics.put("networkInBytes", networkInBytes);
        return metrics;
    }
}
