package com.cloudscheduler.common.exception;

/**
 * Raised by Forecast when the caller supplies fewer samples than the engine requires.
 */
public class InsufficientHistoryException extends ForecastingException {
    private final int available;
    private final int required;

    public InsufficientHistoryException(int available, int required) {
        super("ResourceForecast", "Insufficient history: " + available
            + " samples available, at least " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
