package com.cloudscheduler.engine.service;

import com.cloudscheduler.common.model.MetricSample;
import com.cloudscheduler.common.model.ScalingAction;
import com.cloudscheduler.common.model.ScheduleDecision;
import com.cloudscheduler.engine.model.Recommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingDecisionServiceTest {

    /** Sequence model that repeats the last row, so a flat history forecasts itself. */
    private final SchedulingDecisionService service = new SchedulingDecisionService(
        ResourceForecastServiceTest.service(window -> window[window.length - 1].clone()));

    private static List<MetricSample> flatHistory(int hours, double cpu, double memory) {
        List<MetricSample> samples = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            samples.add(MetricSample.of(null, cpu, memory, 30, 1_000));
        }
        return samples;
    }

    @Test
    @DisplayName("sustained 95% cpu → scale_up recommendation")
    void recommendScaleUp() {
        Recommendation rec = service.recommend("vm-9", flatHistory(30, 95, 40), 12, 1L);
        assertEquals(12, rec.forecast().predictions().size());
        assertEquals(ScalingAction.SCALE_UP, rec.decision().action());
        assertEquals(0.9, rec.decision().confidence());
        assertEquals(95.0, rec.decision().aggregateMetrics().get("maxCpu"), 1e-6);
    }

    @Test
    @DisplayName("idle resource → scale_down recommendation")
    void recommendScaleDown() {
        Recommendation rec = service.recommend("vm-9", flatHistory(30, 8, 15), 6, 1L);
        assertEquals(ScalingAction.SCALE_DOWN, rec.decision().action());
    }

    @Test
    @DisplayName("decide() with no predictions and no current metrics → maintain")
    void decideTotal() {
        ScheduleDecision d = service.decide("vm-9", null, List.of());
        assertEquals(ScalingAction.MAINTAIN, d.action());
        assertEquals(0.1, d.confidence());
        assertEquals(Map.of("avgCpu", 0.0, "avgMem", 0.0, "maxCpu", 0.0, "maxMem", 0.0), d.aggregateMetrics());
    }
}
