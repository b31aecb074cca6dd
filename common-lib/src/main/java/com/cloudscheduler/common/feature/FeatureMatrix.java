package com.cloudscheduler.common.feature;

import com.cloudscheduler.common.exception.FeatureExtractionException;

import java.util.Arrays;
import java.util.List;

/**
 * Rectangular numeric table derived from a sample history. Row {@code i} belongs to sample {@code i}.
 *
 * <p>The first four columns are always the base metrics in {@link #CPU}, {@link #MEMORY},
 * {@link #DISK}, {@link #NETWORK} order; forecasters rely on that prefix. Rows are defensively
 * copied on the way in and out, so an instance can be shared between forecasters of one call.
 */
public final class FeatureMatrix {

    public static final int CPU     = 0;
    public static final int MEMORY  = 1;
    public static final int DISK    = 2;
    public static final int NETWORK = 3;
    public static final int BASE_COLUMN_COUNT = 4;

    private final List<String> columns;
    private final double[][] rows;

    private FeatureMatrix(List<String> columns, double[][] rows) {
        this.columns = List.copyOf(columns);
        this.rows = copy(rows);
    }

    /**
     * @throws FeatureExtractionException if a row is missing, its width differs from the
     *                                    column count, or it holds a non-finite value
     */
    public static FeatureMatrix of(List<String> columns, double[][] rows) {
        if (columns.size() < BASE_COLUMN_COUNT) {
            throw new FeatureExtractionException("Feature table needs the " + BASE_COLUMN_COUNT
                + " base metric columns, got " + columns);
        }
        for (int i = 0; i < rows.length; i++) {
            double[] row = rows[i];
            if (row == null || row.length != columns.size()) {
                throw new FeatureExtractionException("Row " + i + " is not rectangular: expected "
                    + columns.size() + " columns, got " + (row == null ? "null" : row.length));
            }
            for (int c = 0; c < row.length; c++) {
                if (!Double.isFinite(row[c])) {
                    throw new FeatureExtractionException("Row " + i + " column " + columns.get(c)
                        + " is not a finite number: " + row[c]);
                }
            }
        }
        return new FeatureMatrix(columns, rows);
    }

    public static FeatureMatrix empty() {
        return new FeatureMatrix(FeatureExtractor.BASE_COLUMNS, new double[0][]);
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    public double[] row(int index) {
        return rows[index].clone();
    }

    public double value(int row, int column) {
        return rows[row][column];
    }

    /** Values of the named column, oldest first. */
    public double[] column(String name) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature column: " + name);
        }
        return column(index);
    }

    public double[] column(int index) {
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][index];
        }
        return values;
    }

    /**
     * The base metric columns of the last {@code count} rows (or all rows when fewer exist),
     * oldest first.
     */
    public double[][] lastBaseRows(int count) {
        int from = Math.max(0, rows.length - count);
        double[][] tail = new double[rows.length - from][];
        for (int i = from; i < rows.length; i++) {
            tail[i - from] = Arrays.copyOf(rows[i], BASE_COLUMN_COUNT);
        }
        return tail;
    }

    /** The base metric columns of every row, oldest first. */
    public double[][] baseRows() {
        return lastBaseRows(rows.length);
    }

    private static double[][] copy(double[][] source) {
        double[][] target = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i].clone();
        }
        return target;
    }
}
