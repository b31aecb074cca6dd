package com.cloudscheduler.common.forecast;

import com.cloudscheduler.common.stats.WindowStatistics;

/**
 * Per-column zero-mean / unit-variance scaling fitted on one window. A column with zero
 * deviation is scaled by 1.
 */
final class Standardizer {

    private final double[] means;
    private final double[] scales;

    private Standardizer(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    static Standardizer fit(double[][] rows) {
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];
        for (int c = 0; c < width; c++) {
            double[] column = WindowStatistics.column(rows, c);
            means[c] = WindowStatistics.mean(column);
            double std = WindowStatistics.stdDev(column);
            scales[c] = std == 0.0 ? 1.0 : std;
        }
        return new Standardizer(means, scales);
    }

    double[][] transform(double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            scaled[r] = new double[rows[r].length];
            for (int c = 0; c < rows[r].length; c++) {
                scaled[r][c] = (rows[r][c] - means[c]) / scales[c];
            }
        }
        return scaled;
    }

    double[] inverse(double[] scaled) {
        double[] raw = new double[scaled.length];
        for (int c = 0; c < scaled.length; c++) {
            raw[c] = scaled[c] * scales[c] + means[c];
        }
        return raw;
    }
}
