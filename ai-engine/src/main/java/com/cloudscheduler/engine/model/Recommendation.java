package com.cloudscheduler.engine.model;

import com.cloudscheduler.common.model.ForecastResult;
import com.cloudscheduler.common.model.ScheduleDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A forecast together with the scheduling decision derived from it. */
public record Recommendation(
    @JsonProperty("forecast") ForecastResult forecast,
    @JsonProperty("decision") ScheduleDecision decision
) {}
