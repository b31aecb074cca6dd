package com.cloudscheduler.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ScheduleDecision(
    @JsonProperty("resourceId")       String resourceId,
    @JsonProperty("action")           ScalingAction action,
    @JsonProperty("confidence")       double confidence,      // 0.0 – 1.0
    @JsonProperty("aggregateMetrics") Map<String, Double> aggregateMetrics,  // avgCpu / avgMem / maxCpu / maxMem
    @JsonProperty("reasoning")        String reasoning
) {
    public static ScheduleDecision of(String resourceId, ScalingAction action, double confidence,
                                      Map<String, Double> aggregateMetrics, String reasoning) {
        return new ScheduleDecision(resourceId, action, confidence, Collections.unmodifiableMap(new LinkedHashMap<>(aggregateMetrics)), reasoning);
    }
}
