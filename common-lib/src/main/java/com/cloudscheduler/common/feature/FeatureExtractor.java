package com.cloudscheduler.common.feature;

import com.cloudscheduler.common.exception.FeatureExtractionException;
import com.cloudscheduler.common.model.MetricSample;
import com.cloudscheduler.common.stats.WindowStatistics;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts a chronological {@link MetricSample} history into a {@link FeatureMatrix}.
 *
 * <h3>Columns (in order)</h3>
 * <ol>
 *   <li>Base metrics: cpu, memory, disk, network-in. A missing value repeats the previous
 *       sample's value; with no previous value it is 0.</li>
 *   <li>Calendar: hour (0–23), day of week (Monday = 0) and day of month, in UTC. Present
 *       only when at least one sample carries a timestamp.</li>
 *   <li>Trailing moving averages of cpu and memory over 3 and 12 rows. Rows before the
 *       first full window take the first full-window average; a series shorter than the
 *       window yields 0 throughout.</li>
 * </ol>
 *
 * <p>Pure static utility. No logging, no state.
 */
public final class FeatureExtractor {

    public static final String CPU_COLUMN     = "cpu_usage_percent";
    public static final String MEMORY_COLUMN  = "memory_usage_percent";
    public static final String DISK_COLUMN    = "disk_usage_percent";
    public static final String NETWORK_COLUMN = "network_in_bytes";

    public static final String HOUR_COLUMN         = "hour";
    public static final String DAY_OF_WEEK_COLUMN  = "day_of_week";
    public static final String DAY_OF_MONTH_COLUMN = "day_of_month";

    public static final List<String> BASE_COLUMNS =
        List.of(CPU_COLUMN, MEMORY_COLUMN, DISK_COLUMN, NETWORK_COLUMN);

    static final int SHORT_WINDOW = 3;
    static final int LONG_WINDOW  = 12;

    private static final List<Function<MetricSample, Double>> BASE_FIELDS = List.of(
        MetricSample::cpuUsagePercent,
        MetricSample::memoryUsagePercent,
        MetricSample::diskUsagePercent,
        MetricSample::networkInBytes
    );

    private FeatureExtractor() {}

    /**
     * @param samples chronological history, at least one element
     * @throws FeatureExtractionException if the history is empty, contains a null sample or a
     *                                    non-finite value
     */
    public static FeatureMatrix extract(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new FeatureExtractionException("No samples to extract features from");
        }
        int n = samples.size();
        for (int i = 0; i < n; i++) {
            if (samples.get(i) == null) {
                throw new FeatureExtractionException("Sample " + i + " is null");
            }
        }

        double[][] base = baseMetrics(samples);
        boolean hasTimestamps = samples.stream().anyMatch(s -> s.timestamp() != null);
        double[][] calendar = hasTimestamps ? calendarFeatures(samples) : new double[n][0];

        double[] cpu    = WindowStatistics.column(base, FeatureMatrix.CPU);
        double[] memory = WindowStatistics.column(base, FeatureMatrix.MEMORY);
        double[][] averages = {
            movingAverage(cpu, SHORT_WINDOW),
            movingAverage(cpu, LONG_WINDOW),
            movingAverage(memory, SHORT_WINDOW),
            movingAverage(memory, LONG_WINDOW)
        };

        List<String> columns = new ArrayList<>(BASE_COLUMNS);
        if (hasTimestamps) {
            columns.addAll(List.of(HOUR_COLUMN, DAY_OF_WEEK_COLUMN, DAY_OF_MONTH_COLUMN));
        }
        columns.add(CPU_COLUMN + "_ma" + SHORT_WINDOW);
        columns.add(CPU_COLUMN + "_ma" + LONG_WINDOW);
        columns.add(MEMORY_COLUMN + "_ma" + SHORT_WINDOW);
        columns.add(MEMORY_COLUMN + "_ma" + LONG_WINDOW);

        double[][] rows = new double[n][columns.size()];
        for (int i = 0; i < n; i++) {
            int c = 0;
            for (double v : base[i])     rows[i][c++] = v;
            for (double v : calendar[i]) rows[i][c++] = v;
            for (double[] ma : averages) rows[i][c++] = ma[i];
        }
        return FeatureMatrix.of(columns, rows);
    }

    // ── base metrics ─────────────────────────────────────────────────────────

    private static double[][] baseMetrics(List<MetricSample> samples) {
        double[][] base = new double[samples.size()][FeatureMatrix.BASE_COLUMN_COUNT];
        double[] lastSeen = new double[FeatureMatrix.BASE_COLUMN_COUNT];
        for (int i = 0; i < samples.size(); i++) {
            MetricSample sample = samples.get(i);
            for (int c = 0; c < FeatureMatrix.BASE_COLUMN_COUNT; c++) {
                Double value = BASE_FIELDS.get(c).apply(sample);
                if (value != null) {
                    if (!Double.isFinite(value)) {
                        throw new FeatureExtractionException("Sample " + i + " has non-finite "
                            + BASE_COLUMNS.get(c) + ": " + value);
                    }
                    lastSeen[c] = value;
                }
                base[i][c] = lastSeen[c];
            }
        }
        return base;
    }

    // ── calendar ─────────────────────────────────────────────────────────────

    private static double[][] calendarFeatures(List<MetricSample> samples) {
        double[][] calendar = new double[samples.size()][3];
        Instant lastSeen = null;
        for (int i = 0; i < samples.size(); i++) {
            Instant timestamp = samples.get(i).timestamp();
            if (timestamp != null) {
                lastSeen = timestamp;
            }
            if (lastSeen != null) {
                ZonedDateTime utc = lastSeen.atZone(ZoneOffset.UTC);
                calendar[i][0] = utc.getHour();
                calendar[i][1] = utc.getDayOfWeek().getValue() - 1;
                calendar[i][2] = utc.getDayOfMonth();
            }
        }
        return calendar;
    }

    // ── moving averages ──────────────────────────────────────────────────────

    /**
     * Trailing mean over {@code window} rows ending at each row. Rows before the first full
     * window repeat the first full-window value.
     */
    static double[] movingAverage(double[] values, int window) {
        double[] result = new double[values.length];
        if (values.length < window) {
            return result;
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            if (i >= window - 1) {
                result[i] = sum / window;
            }
        }
        for (int i = 0; i < window - 1; i++) {
            result[i] = result[window - 1];
        }
        return result;
    }
}
