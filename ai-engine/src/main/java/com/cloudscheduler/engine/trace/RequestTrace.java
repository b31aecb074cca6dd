package com.cloudscheduler.engine.trace;

import org.slf4j.Logger;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Per-request trace id for the engine API, carried in the Reactor Context.
 *
 * <p>Each endpoint hands its pipeline to {@link #traced}, which stamps the caller's
 * {@value #TRACE_ID_HEADER} (or a generated id) into the Context and logs one outcome line per
 * request with the elapsed time:
 * <pre>
 *     Mono&lt;PredictionResponse&gt; pipeline = forecastService.forecastAsync(...).map(...);
 *     return RequestTrace.traced(pipeline, traceIdHeader, log, "predict", resourceId);
 * </pre>
 *
 * <p>MDC holds the id only while an outcome line is written. The forecast itself runs on
 * bounded-elastic workers, so nothing is left behind on those threads.
 */
public final class RequestTrace {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String TRACE_ID_KEY    = "traceId";

    private RequestTrace() {}

    /**
     * Wraps one API operation with trace id propagation and outcome logging.
     *
     * @param pipeline    the operation, not yet subscribed
     * @param headerValue the {@value #TRACE_ID_HEADER} request header, may be {@code null}
     * @param log         logger of the calling controller
     * @param operation   short operation name for the log line
     * @param resourceId  resource the request concerns, may be {@code null}
     * @return the pipeline, emitting and failing exactly as before
     */
    public static <T> Mono<T> traced(Mono<T> pipeline, String headerValue, Logger log,
                                     String operation, String resourceId) {
        String traceId = resolve(headerValue);
        return Mono.defer(() -> pipeline.doOnEach(outcome(log, operation, resourceId, System.nanoTime())))
            .contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** The caller's id when supplied, otherwise a fresh random one. */
    public static String resolve(String headerValue) {
        return headerValue == null || headerValue.isBlank() ? UUID.randomUUID().toString() : headerValue.trim();
    }

    /** Trace id of the surrounding request, {@code "unknown"} outside {@link #traced}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    // INFO on success, WARN with the error message on failure; completion is ignored
    private static <T> Consumer<Signal<T>> outcome(Logger log, String operation, String resourceId,
                                                   long startedNanos) {
        return signal -> {
            if (!signal.isOnNext() && !signal.isOnError()) {
                return;
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            String traceId = getTraceId(signal.getContextView());
            if (signal.isOnNext()) {
                withMdc(traceId, () -> log.info("[EngineApi] operation={} resource={} status=ok elapsedMs={}",
                    operation, resourceId, elapsedMs));
            } else {
                withMdc(traceId, () -> log.warn("[EngineApi] operation={} resource={} status=failed elapsedMs={} error={}",
                    operation, resourceId, elapsedMs, signal.getThrowable().getMessage()));
            }
        };
    }
}
