package com.cloudscheduler.common.exception;

/**
 * Root of the engine's exception taxonomy.
 *
 * <p>{@link #getMessage()} is prefixed with the raising component, e.g.
 * {@code [FeatureExtractor] sample 3 is null}, for log lines. API error bodies carry the
 * component and {@link #getDetail()} separately.
 */
public class ForecastingException extends RuntimeException {
    private final String component;
    private final String detail;

    public ForecastingException(String component, String detail) {
        this(component, detail, null);
    }

    public ForecastingException(String component, String detail, Throwable cause) {
        super("[" + component + "] " + detail, cause);
        this.component = component;
        this.detail = detail;
    }

    /** Name of the pipeline stage or model that failed. */
    public String getComponent() {
        return component;
    }

    /** The message without the component prefix. */
    public String getDetail() {
        return detail;
    }
}
