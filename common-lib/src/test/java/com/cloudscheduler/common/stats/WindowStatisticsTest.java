package com.cloudscheduler.common.stats;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WindowStatisticsTest {

    @Test
    void emptyWindowIsZero() {
        assertEquals(0.0, WindowStatistics.mean(new double[0]));
        assertEquals(0.0, WindowStatistics.max(new double[0]));
        assertEquals(0.0, WindowStatistics.stdDev(new double[0]));
    }

    @Test
    void populationStdDev() {
        assertEquals(2.0, WindowStatistics.stdDev(new double[] {2, 4, 4, 4, 5, 5, 7, 9}), 1e-12);
    }

    @Test
    void column() {
        assertArrayEquals(new double[] {2, 5}, WindowStatistics.column(new double[][] {{1, 2}, {4, 5}}, 1));
    }
}
