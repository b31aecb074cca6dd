package com.cloudscheduler.engine.service;

import com.cloudscheduler.common.confidence.ConfidenceEstimator;
import com.cloudscheduler.common.exception.InsufficientHistoryException;
import com.cloudscheduler.common.feature.FeatureExtractor;
import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.forecast.ForecastCombiner;
import com.cloudscheduler.common.forecast.ForecastContext;
import com.cloudscheduler.common.forecast.Forecaster;
import com.cloudscheduler.common.model.ForecastOutcome;
import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.model.ForecastResult;
import com.cloudscheduler.common.model.MetricSample;
import com.cloudscheduler.common.model.ModelInfo;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Produces a combined multi-step forecast for one resource.
 *
 * <pre>
 *   history ─► FeatureExtractor ─┬─► SequenceForecaster ─┐
 *                                ├─► EnsembleForecaster ─┴─► ForecastCombiner ─► predictions
 *                                └─► ConfidenceEstimator ─────────────────────► confidence
 * </pre>
 *
 * <p>Stateless: every call builds its own random generators from the supplied seed
 * ({@code seed} for the sequence forecaster, {@code seed + 1} for the ensemble), so identical
 * history, horizon, seed and clock give identical output.
 */
@Service
public class ResourceForecastService {

    private static final Logger log = LoggerFactory.getLogger(ResourceForecastService.class);

    public static final int MIN_HISTORY = 24;

    private final Forecaster sequenceForecaster;
    private final Forecaster ensembleForecaster;
    private final Clock clock;
    private final int defaultHorizon;
    private final int maxHorizon;
    private final long defaultSeed;

    public ResourceForecastService(@Qualifier("sequenceForecaster") Forecaster sequenceForecaster,
                                   @Qualifier("ensembleRegressionForecaster") Forecaster ensembleForecaster,
                                   Clock clock,
                                   @Value("${engine.forecast.default-horizon:24}") int defaultHorizon,
                                   @Value("${engine.forecast.max-horizon:168}") int maxHorizon,
                                   @Value("${engine.forecast.default-seed:42}") long defaultSeed) {
        this.sequenceForecaster = sequenceForecaster;
        this.ensembleForecaster = ensembleForecaster;
        this.clock = clock;
        this.defaultHorizon = defaultHorizon;
        this.maxHorizon = maxHorizon;
        this.defaultSeed = defaultSeed;
    }

    /**
     * @param horizon hours ahead, {@code null} for the configured default
     * @param seed    jitter seed, {@code null} for the configured default
     * @throws InsufficientHistoryException if fewer than {@value #MIN_HISTORY} samples are given;
     *                                      checked before the horizon
     * @throws IllegalArgumentException     if the horizon is outside {@code [1, max-horizon]}
     */
    public ForecastResult forecast(String resourceId, List<MetricSample> history, Integer horizon, Long seed) {
        int available = history == null ? 0 : history.size();
        if (available < MIN_HISTORY) {
            throw new InsufficientHistoryException(available, MIN_HISTORY);
        }
        int steps = resolveHorizon(horizon);
        long effectiveSeed = seed != null ? seed : defaultSeed;

        log.info("[ResourceForecast] Forecasting resource={} samples={} horizon={} seed={}",
            resourceId, available, steps, effectiveSeed);
        FeatureMatrix features = FeatureExtractor.extract(history);
        Instant now = clock.instant();

        ForecastOutcome sequence = sequenceForecaster.forecast(features, steps,
            new ForecastContext(now, new Well19937c(effectiveSeed)));
        ForecastOutcome ensemble = ensembleForecaster.forecast(features, steps,
            new ForecastContext(now, new Well19937c(effectiveSeed + 1)));

        List<ForecastPoint> combined = ForecastCombiner.combine(sequence.points(), ensemble.points());
        if (combined.size() != steps) {
            log.warn("[ResourceForecast] Combined forecast has {} points, expected {} (sequence={}, ensemble={})",
                combined.size(), steps, sequence.points().size(), ensemble.points().size());
        }
        double confidence = ConfidenceEstimator.estimate(features);
        ModelInfo modelInfo = ModelInfo.of(sequence, ensemble);

        log.info("[ResourceForecast] resource={} points={} confidence={} sequenceFallback={} ensembleFallback={}",
            resourceId, combined.size(), String.format("%.3f", confidence),
            sequence.fallbackPoints(), ensemble.fallbackPoints());
        return ForecastResult.of(resourceId, combined, confidence, modelInfo);
    }

    /**
     * Runs {@link #forecast} on the bounded-elastic scheduler.
     */
    public Mono<ForecastResult> forecastAsync(String resourceId, List<MetricSample> history,
                                              Integer horizon, Long seed) {
        return Mono.fromCallable(() -> forecast(resourceId, history, horizon, seed))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public int resolveHorizon(Integer horizon) {
        int steps = horizon != null ? horizon : defaultHorizon;
        if (steps < 1 || steps > maxHorizon) {
            throw new IllegalArgumentException("predictionHorizon must be between 1 and " + maxHorizon
                + ", got " + steps);
        }
        return steps;
    }
}
