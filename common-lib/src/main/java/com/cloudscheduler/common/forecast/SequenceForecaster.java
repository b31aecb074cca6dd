package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.exception.ModelInferenceException;
import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastOutcome;
import com.cloudscheduler.common.model.ForecastPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Autoregressive forecaster over the last {@value #CONTEXT_WINDOW} rows of base metrics.
 *
 * <h3>Rollout</h3>
 * <ol>
 *   <li>Take the last 24 rows of cpu / memory / disk / network; left-pad with the earliest
 *       row when fewer exist.</li>
 *   <li>Standardize each column with the window's own statistics.</li>
 *   <li>Predict one step, de-standardize and clamp it into a {@link ForecastPoint}, then slide
 *       the standardized prediction into the window and repeat.</li>
 * </ol>
 *
 * <p>If the model fails at step {@code k}, points {@code 0..k-1} are kept and the rest come
 * from {@link FallbackTrendEstimator}.
 */
public class SequenceForecaster implements Forecaster {

    private static final Logger log = LoggerFactory.getLogger(SequenceForecaster.class);

    static final int CONTEXT_WINDOW = 24;

    private final SequenceModel model;

    public SequenceForecaster(SequenceModel model) {
        this.model = model;
    }

    @Override
    public String name() { return "SequenceForecaster"; }

    @Override
    public ForecastOutcome forecast(FeatureMatrix features, int horizon, ForecastContext context) {
        if (features.isEmpty()) {
            log.warn("[SequenceForecaster] No feature rows, using fallback for all {} steps", horizon);
            return ForecastOutcome.fromFallback(FallbackTrendEstimator.estimate(features, horizon, context));
        }

        List<ForecastPoint> points = new ArrayList<>(horizon);
        try {
            double[][] window = contextWindow(features);
            Standardizer scaler = Standardizer.fit(window);
            double[][] scaled = scaler.transform(window);

            for (int step = 0; step < horizon; step++) {
                double[] next = model.predictNext(scaled);
                if (next == null || next.length != FeatureMatrix.BASE_COLUMN_COUNT) {
                    throw new ModelInferenceException(name(), "Model returned "
                        + (next == null ? "null" : next.length + " values") + " at step " + step);
                }
                double[] raw = scaler.inverse(next);
                for (double v : raw) {
                    if (!Double.isFinite(v)) {
                        throw new ModelInferenceException(name(), "Non-finite prediction at step " + step);
                    }
                }
                points.add(ForecastPoint.clamped(context.now(), step + 1, raw));
                scaled = slide(scaled, next);
            }
            return ForecastOutcome.fromModel(points);
        } catch (RuntimeException e) {
            log.warn("[SequenceForecaster] Inference failed after {} of {} steps, falling back: {}",
                points.size(), horizon, e.getMessage());
            log.debug("[SequenceForecaster] Inference failure detail", e);
        }

        int produced = points.size();
        points.addAll(FallbackTrendEstimator.estimateRemaining(features, produced, horizon, context));
        return new ForecastOutcome(points, horizon - produced);
    }

    /** Last {@value #CONTEXT_WINDOW} base rows, left-padded with the earliest available row. */
    static double[][] contextWindow(FeatureMatrix features) {
        double[][] available = features.lastBaseRows(CONTEXT_WINDOW);
        if (available.length == CONTEXT_WINDOW) {
            return available;
        }
        double[][] window = new double[CONTEXT_WINDOW][];
        int padding = CONTEXT_WINDOW - available.length;
        for (int i = 0; i < padding; i++) {
            window[i] = available[0].clone();
        }
        System.arraycopy(available, 0, window, padding, available.length);
        return window;
    }

    private static double[][] slide(double[][] window, double[] next) {
        double[][] shifted = new double[window.length][];
        System.arraycopy(window, 1, shifted, 0, window.length - 1);
        shifted[window.length - 1] = next.clone();
        return shifted;
    }
}
