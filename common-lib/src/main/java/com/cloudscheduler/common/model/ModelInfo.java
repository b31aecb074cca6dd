package com.cloudscheduler.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Describes which models produced a forecast and how much of it came from the fallback estimator.
 */
public record ModelInfo(
    @JsonProperty("sequenceUsed")           boolean sequenceUsed,
    @JsonProperty("ensembleUsed")           boolean ensembleUsed,
    @JsonProperty("ensemble")               boolean ensemble,
    @JsonProperty("sequenceFallbackPoints") int sequenceFallbackPoints,
    @JsonProperty("ensembleFallbackPoints") int ensembleFallbackPoints
) {
    public static ModelInfo of(ForecastOutcome sequence, ForecastOutcome ensembleOutcome) {
        boolean sequenceUsed = sequence.modelPoints() > 0;
        boolean ensembleUsed = ensembleOutcome.modelPoints() > 0;
        return new ModelInfo(sequenceUsed, ensembleUsed, sequenceUsed && ensembleUsed,
                             sequence.fallbackPoints(), ensembleOutcome.fallbackPoints());
    }
}
