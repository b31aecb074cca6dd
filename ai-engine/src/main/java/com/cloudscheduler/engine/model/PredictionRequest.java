package com.cloudscheduler.engine.model;

import com.cloudscheduler.common.model.MetricSample;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code /predict} and {@code /recommend}. A missing horizon or seed falls back to the
 * configured defaults.
 */
public record PredictionRequest(
    @JsonProperty("resourceId")
    @JsonAlias("resource_id")        String resourceId,
    @JsonProperty("historicalData")
    @JsonAlias("historical_data")    List<MetricSample> historicalData,
    @JsonProperty("predictionHorizon")
    @JsonAlias("prediction_horizon") Integer predictionHorizon,
    @JsonProperty("seed")            Long seed
) {}
