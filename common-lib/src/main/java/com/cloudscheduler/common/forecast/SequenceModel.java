package com.cloudscheduler.common.forecast;

/**
 * Inference-only recurrent model used by {@link SequenceForecaster}.
 *
 * <p>Implementations hold immutable trained parameters and must be safe to share between
 * concurrent calls.
 */
public interface SequenceModel {

    /**
     * Predicts the next step from a standardized window.
     *
     * @param window {@code [steps][features]}, oldest first, already standardized
     * @return standardized prediction for the next step, {@code features} wide
     * @throws com.cloudscheduler.common.exception.ModelInferenceException if no finite
     *         prediction can be produced
     */
    double[] predictNext(double[][] window);
}
