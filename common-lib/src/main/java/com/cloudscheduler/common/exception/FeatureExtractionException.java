package com.cloudscheduler.common.exception;

public class FeatureExtractionException extends ForecastingException {

    public FeatureExtractionException(String message) {
        super("FeatureExtractor", message);
    }
}
