package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.exception.ModelInferenceException;
import com.cloudscheduler.common.feature.FeatureMatrix;
import com.cloudscheduler.common.model.ForecastOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.cloudscheduler.common.forecast.ForecastFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SequenceForecasterTest {

    /** Predicts the last row of the window; throws from step {@code failAt} on. */
    private static final class EchoModel implements SequenceModel {
        private final int failAt;
        private int calls;

        EchoModel(int failAt) {
            this.failAt = failAt;
        }

        @Override
        public double[] predictNext(double[][] window) {
            if (calls++ >= failAt) {
                throw new ModelInferenceException("EchoModel", "forced failure");
            }
            return window[window.length - 1].clone();
        }
    }

    @Nested
    @DisplayName("rollout")
    class Rollout {

        @Test
        @DisplayName("healthy model fills the whole horizon without fallback")
        void fullHorizon() {
            ForecastOutcome outcome = new SequenceForecaster(new EchoModel(Integer.MAX_VALUE))
                .forecast(dailyCycle(48), 12, context(1));
            assertEquals(12, outcome.points().size());
            assertEquals(0, outcome.fallbackPoints());
            assertHourlyOffsets(outcome.points());
        }

        @Test
        @DisplayName("echo model reproduces the last observed row after de-standardization")
        void echoReturnsLastRow() {
            FeatureMatrix features = constant(30, 61, 42, 17, 900);
            ForecastOutcome outcome = new SequenceForecaster(new EchoModel(Integer.MAX_VALUE))
                .forecast(features, 3, context(1));
            outcome.points().forEach(p -> {
                assertEquals(61, p.cpuUsagePercent(), 1e-9);
                assertEquals(900, p.networkUsage(), 1e-9);
            });
        }

        @Test
        @DisplayName("real LSTM with seeded weights stays in bounds")
        void seededLstmBounds() {
            SequenceForecaster forecaster = new SequenceForecaster(new LstmSequenceModel(LstmWeights.seeded(7)));
            ForecastOutcome outcome = forecaster.forecast(dailyCycle(72), 48, context(1));
            assertEquals(48, outcome.points().size());
            assertWithinBounds(outcome.points());
        }
    }

    @Nested
    @DisplayName("failure recovery")
    class Recovery {

        @Test
        @DisplayName("failure at step k keeps k model points and falls back for the rest")
        void partialFallback() {
            ForecastOutcome outcome = new SequenceForecaster(new EchoModel(5))
                .forecast(dailyCycle(48), 24, context(1));
            assertEquals(24, outcome.points().size());
            assertEquals(19, outcome.fallbackPoints());
            assertEquals(5, outcome.modelPoints());
            assertHourlyOffsets(outcome.points());
            assertWithinBounds(outcome.points());
        }

        @Test
        @DisplayName("wrong output width treated as a failure")
        void wrongWidth() {
            SequenceModel narrow = window -> new double[] {1.0, 2.0};
            ForecastOutcome outcome = new SequenceForecaster(narrow).forecast(dailyCycle(30), 6, context(1));
            assertEquals(6, outcome.fallbackPoints());
        }

        @Test
        @DisplayName("no rows → fallback for every step")
        void emptyFeatures() {
            ForecastOutcome outcome = new SequenceForecaster(new EchoModel(Integer.MAX_VALUE))
                .forecast(FeatureMatrix.empty(), 4, context(1));
            assertEquals(4, outcome.points().size());
            assertEquals(4, outcome.fallbackPoints());
        }
    }

    @Test
    @DisplayName("short history left-padded with the earliest row")
    void contextWindowPadding() {
        FeatureMatrix features = constant(3, 10, 20, 30, 40);
        double[][] window = SequenceForecaster.contextWindow(features);
        assertEquals(SequenceForecaster.CONTEXT_WINDOW, window.length);
        assertArrayEquals(new double[] {10, 20, 30, 40}, window[0]);
        assertArrayEquals(new double[] {10, 20, 30, 40}, window[23]);
    }
}
