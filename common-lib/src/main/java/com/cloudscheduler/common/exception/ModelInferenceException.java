package com.cloudscheduler.common.exception;

/**
 * Raised inside a forecaster when a model cannot produce a step. Always recovered by the
 * fallback estimator; never leaves the engine.
 */
public class ModelInferenceException extends ForecastingException {

    public ModelInferenceException(String model, String message) {
        super(model, message);
    }

    public ModelInferenceException(String model, String message, Throwable cause) {
        super(model, message, cause);
    }
}
