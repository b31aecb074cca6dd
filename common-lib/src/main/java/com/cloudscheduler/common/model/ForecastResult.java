package com.cloudscheduler.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ForecastResult(
    @JsonProperty("resourceId")  String resourceId,
    @JsonProperty("predictions") List<ForecastPoint> predictions,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("modelInfo")   ModelInfo modelInfo
) {
    public static ForecastResult of(String resourceId, List<ForecastPoint> predictions,
                                    double confidence, ModelInfo modelInfo) {
        return new ForecastResult(resourceId, List.copyOf(predictions), confidence, modelInfo);
    }
}
