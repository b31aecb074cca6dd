package com.cloudscheduler.engine.model;

import com.cloudscheduler.common.model.ForecastPoint;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ScheduleRequest(
    @JsonProperty("resourceId")
    @JsonAlias("resource_id")       String resourceId,
    @JsonProperty("currentMetrics")
    @JsonAlias("current_metrics")   Map<String, Double> currentMetrics,
    @JsonProperty("predictedMetrics")
    @JsonAlias("predicted_metrics") List<ForecastPoint> predictedMetrics
) {}
