package com.cloudscheduler.engine.model;

import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.model.ForecastResult;
import com.cloudscheduler.common.model.ModelInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record PredictionResponse(
    @JsonProperty("resourceId")        String resourceId,
    @JsonProperty("predictionHorizon") int predictionHorizon,
    @JsonProperty("predictions")       List<ForecastPoint> predictions,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("modelInfo")         ModelInfo modelInfo,
    @JsonProperty("generatedAt")       Instant generatedAt
) {
    public static PredictionResponse of(ForecastResult result, int horizon, Instant generatedAt) {
        return new PredictionResponse(result.resourceId(), horizon, result.predictions(),
                                      result.confidence(), result.modelInfo(), generatedAt);
    }
}
