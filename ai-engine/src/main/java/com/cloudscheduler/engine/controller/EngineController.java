package com.cloudscheduler.engine.controller;

import com.cloudscheduler.common.model.ScheduleDecision;
import com.cloudscheduler.engine.model.HealthStatus;
import com.cloudscheduler.engine.model.PredictionRequest;
import com.cloudscheduler.engine.model.PredictionResponse;
import com.cloudscheduler.engine.model.Recommendation;
import com.cloudscheduler.engine.model.ScheduleRequest;
import com.cloudscheduler.engine.service.ResourceForecastService;
import com.cloudscheduler.engine.service.SchedulingDecisionService;
import com.cloudscheduler.engine.trace.RequestTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@RestController
@RequestMapping("/api/v1")
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private final ResourceForecastService forecastService;
    private final SchedulingDecisionService decisionService;
    private final Clock clock;

    public EngineController(ResourceForecastService forecastService,
                            SchedulingDecisionService decisionService,
                            Clock clock) {
        this.forecastService = forecastService;
        this.decisionService = decisionService;
        this.clock = clock;
    }

    @PostMapping("/predict")
    public Mono<ResponseEntity<PredictionResponse>> predict(
            @RequestBody PredictionRequest request,
            @RequestHeader(value = RequestTrace.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        Mono<PredictionResponse> pipeline = Mono.defer(() -> {
                requireResourceId(request.resourceId());
                return forecastService.forecastAsync(request.resourceId(), request.historicalData(),
                    request.predictionHorizon(), request.seed());
            })
            // horizon already validated by the forecast
            .map(result -> PredictionResponse.of(result,
                forecastService.resolveHorizon(request.predictionHorizon()), clock.instant()));
        return RequestTrace.traced(pipeline, traceIdHeader, log, "predict", request.resourceId())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/schedule")
    public Mono<ResponseEntity<ScheduleDecision>> schedule(
            @RequestBody ScheduleRequest request,
            @RequestHeader(value = RequestTrace.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        Mono<ScheduleDecision> pipeline = Mono.fromCallable(() -> {
                requireResourceId(request.resourceId());
                return decisionService.decide(request.resourceId(), request.currentMetrics(),
                    request.predictedMetrics());
            })
            .subscribeOn(Schedulers.boundedElastic());
        return RequestTrace.traced(pipeline, traceIdHeader, log, "schedule", request.resourceId())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/recommend")
    public Mono<ResponseEntity<Recommendation>> recommend(
            @RequestBody PredictionRequest request,
            @RequestHeader(value = RequestTrace.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        Mono<Recommendation> pipeline = Mono.fromCallable(() -> {
                requireResourceId(request.resourceId());
                return decisionService.recommend(request.resourceId(), request.historicalData(),
                    request.predictionHorizon(), request.seed());
            })
            .subscribeOn(Schedulers.boundedElastic());
        return RequestTrace.traced(pipeline, traceIdHeader, log, "recommend", request.resourceId())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(new HealthStatus("healthy", "AI scheduling engine is running", clock.instant()));
    }

    private static void requireResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId is required");
        }
    }
}
