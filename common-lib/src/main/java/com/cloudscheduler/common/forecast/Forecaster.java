package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastOutcome;

/**
 * Strategy contract for producing an hourly resource-usage forecast from a feature history.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: per-call state lives on the stack; safe to call concurrently</li>
 *   <li><b>Total</b>:     never throw for a well-formed matrix; degrade through
 *                          {@link FallbackTrendEstimator} instead</li>
 *   <li><b>Exact</b>:     always return exactly {@code horizon} points</li>
 * </ul>
 *
 * <p>Current implementations: {@link SequenceForecaster} and {@link EnsembleRegressionForecaster}.
 */
public interface Forecaster {

    String name();

    ForecastOutcome forecast(FeatureMatrix features, int horizon, ForecastContext context);
}
