package com.cloudscheduler.engine.service;

import com.cloudscheduler.common.decision.DecisionPolicy;
import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.model.ForecastResult;
import com.cloudscheduler.common.model.MetricSample;
import com.cloudscheduler.common.model.ScheduleDecision;
import com.cloudscheduler.engine.model.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class SchedulingDecisionService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingDecisionService.class);

    private final ResourceForecastService forecastService;

    public SchedulingDecisionService(ResourceForecastService forecastService) {
        this.forecastService = forecastService;
    }

    /** Never throws; see {@link DecisionPolicy#decide}. */
    public ScheduleDecision decide(String resourceId, Map<String, Double> currentMetrics,
                                   List<ForecastPoint> predictions) {
        ScheduleDecision decision = DecisionPolicy.decide(resourceId,
            currentMetrics == null ? Map.of() : currentMetrics, predictions);
        log.info("[SchedulingDecision] resource={} action={} confidence={} reasoning=\"{}\"",
            resourceId, decision.action().wireName(), decision.confidence(), decision.reasoning());
        return decision;
    }

    /**
     * Forecasts, then decides on the result using the latest sample as the current metrics.
     */
    public Recommendation recommend(String resourceId, List<MetricSample> history, Integer horizon, Long seed) {
        ForecastResult forecast = forecastService.forecast(resourceId, history, horizon, seed);
        Map<String, Double> current = history.get(history.size() - 1).asCurrentMetrics();
        return new Recommendation(forecast, decide(resourceId, current, forecast.predictions()));
    }
}
