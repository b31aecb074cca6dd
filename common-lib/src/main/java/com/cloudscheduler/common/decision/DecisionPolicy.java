package com.cloudscheduler.common.decision;

import com.cloudscheduler.common.model.ForecastPoint;
import com.cloudscheduler.common.model.ScalingAction;
import com.cloudscheduler.common.model.ScheduleDecision;
import com.cloudscheduler.common.stats.WindowStatistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Threshold policy turning the near-term forecast into a {@link ScheduleDecision}.
 *
 * <p>Only the first {@value #DECISION_WINDOW} forecast points are considered. Rules are
 * evaluated in order:
 * <pre>
 *   default                                        → MAINTAIN    0.8
 *   max cpu &gt; 85 or max mem &gt; 85                 → SCALE_UP    0.9
 *   else avg cpu &gt; 70 or avg mem &gt; 70            → SCALE_UP    0.7
 *   else avg cpu &lt; 20, avg mem &lt; 30, max cpu &lt; 40 → SCALE_DOWN  0.6
 *   stdev cpu &gt; 20 or stdev mem &gt; 20              → OPTIMIZE    0.5   (overrides the above)
 * </pre>
 *
 * <p>Total: never throws. An empty window yields MAINTAIN at 0.1 with zero aggregates; any
 * internal failure yields MAINTAIN at 0.1 with no aggregates and the error text as reasoning.
 */
public final class DecisionPolicy {

    public static final int DECISION_WINDOW = 6;

    static final double PEAK_THRESHOLD          = 85.0;
    static final double HIGH_AVERAGE_THRESHOLD  = 70.0;
    static final double LOW_CPU_AVERAGE         = 20.0;
    static final double LOW_MEMORY_AVERAGE      = 30.0;
    static final double LOW_CPU_PEAK            = 40.0;
    static final double VOLATILITY_THRESHOLD    = 20.0;
    static final double FAIL_CLOSED_CONFIDENCE  = 0.1;

    private DecisionPolicy() {}

    /**
     * @param resourceId     echoed into the decision
     * @param currentMetrics latest observed metrics; accepted for the caller's contract, not
     *                       consulted by the thresholds
     * @param predictions    forecast points in horizon order
     */
    public static ScheduleDecision decide(String resourceId,
                                          Map<String, Double> currentMetrics,
                                          List<ForecastPoint> predictions) {
        try {
            if (predictions == null || predictions.isEmpty()) {
                return ScheduleDecision.of(resourceId, ScalingAction.MAINTAIN, FAIL_CLOSED_CONFIDENCE,
                    aggregates(0, 0, 0, 0),
                    "No forecast points available, keeping current configuration");
            }
            List<ForecastPoint> window = predictions.subList(0, Math.min(DECISION_WINDOW, predictions.size()));
            double[] cpu = new double[window.size()];
            double[] memory = new double[window.size()];
            for (int i = 0; i < window.size(); i++) {
                ForecastPoint point = window.get(i);
                cpu[i] = point.cpuUsagePercent();
                memory[i] = point.memoryUsagePercent();
            }

            double avgCpu = WindowStatistics.mean(cpu);
            double avgMem = WindowStatistics.mean(memory);
            double maxCpu = WindowStatistics.max(cpu);
            double maxMem = WindowStatistics.max(memory);
            double stdCpu = WindowStatistics.stdDev(cpu);
            double stdMem = WindowStatistics.stdDev(memory);

            ScalingAction action = ScalingAction.MAINTAIN;
            double confidence = 0.8;
            String reasoning = "Resource usage is normal, keeping current configuration";

            if (maxCpu > PEAK_THRESHOLD || maxMem > PEAK_THRESHOLD) {
                action = ScalingAction.SCALE_UP;
                confidence = 0.9;
                reasoning = format("CPU or memory usage is predicted to exceed 85%% within the next "
                    + "6 hours (CPU: %.1f%%, memory: %.1f%%), scaling up is recommended", maxCpu, maxMem);
            } else if (avgCpu > HIGH_AVERAGE_THRESHOLD || avgMem > HIGH_AVERAGE_THRESHOLD) {
                action = ScalingAction.SCALE_UP;
                confidence = 0.7;
                reasoning = format("Average load over the next 6 hours is predicted to be high "
                    + "(CPU: %.1f%%, memory: %.1f%%), moderate scale-up is recommended", avgCpu, avgMem);
            } else if (avgCpu < LOW_CPU_AVERAGE && avgMem < LOW_MEMORY_AVERAGE && maxCpu < LOW_CPU_PEAK) {
                action = ScalingAction.SCALE_DOWN;
                confidence = 0.6;
                reasoning = format("Load over the next 6 hours is predicted to be low "
                    + "(CPU: %.1f%%, memory: %.1f%%), consider scaling down to save cost", avgCpu, avgMem);
            }

            if (stdCpu > VOLATILITY_THRESHOLD || stdMem > VOLATILITY_THRESHOLD) {
                action = ScalingAction.OPTIMIZE;
                confidence = 0.5;
                reasoning = format("Predicted load is volatile (CPU stdev: %.1f, memory stdev: %.1f), "
                    + "optimizing the scheduling strategy is recommended", stdCpu, stdMem);
            }

            return ScheduleDecision.of(resourceId, action, confidence,
                aggregates(avgCpu, avgMem, maxCpu, maxMem), reasoning);
        } catch (RuntimeException e) {
            return ScheduleDecision.of(resourceId, ScalingAction.MAINTAIN, FAIL_CLOSED_CONFIDENCE,
                Map.of(), "Decision analysis failed: " + e);
        }
    }

    private static Map<String, Double> aggregates(double avgCpu, double avgMem, double maxCpu, double maxMem) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("avgCpu", avgCpu);
        metrics.put("avgMem", avgMem);
        metrics.put("maxCpu", maxCpu);
        metrics.put("maxMem", maxMem);
        return metrics;
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
