package com.cloudscheduler.common.forecast;

import org.apache.commons.math3.random.RandomGenerator;

import java.time.Instant;

/**
 * Per-call inputs shared by a forecaster and its fallback path.
 *
 * @param now    instant that step {@code i} is stamped relative to ({@code now + (i+1)h})
 * @param random jitter source for the fallback estimator; owned by this call only
 */
public record ForecastContext(Instant now, RandomGenerator random) {}
