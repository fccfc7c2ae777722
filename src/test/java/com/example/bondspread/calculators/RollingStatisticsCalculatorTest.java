package com.example.bondspread.calculators;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RollingStatisticsCalculatorTest {

    private final double[] values = {1, 2, 3, 4, 5, 6};

    @Test
    void testRollingMeanIncludesCurrentStep() {
        double[] mean = RollingStatisticsCalculator.mean(values, 3, 3);

        assertTrue(Double.isNaN(mean[0]));
        assertTrue(Double.isNaN(mean[1]));
        assertEquals(2.0, mean[2], 1e-9);
        assertEquals(5.0, mean[5], 1e-9);
    }

    @Test
    void testMinPeriodsBelowWindow() {
        double[] median = RollingStatisticsCalculator.percentile(values, 4, 2, 50);

        assertTrue(Double.isNaN(median[0]));
        assertEquals(1.5, median[1], 1e-9);
        assertEquals(2.5, median[3], 1e-9);
        assertEquals(4.5, median[5], 1e-9);
    }

    @Test
    void testRollingStdNeedsTwoPoints() {
        double[] std = RollingStatisticsCalculator.std(values, 3, 1);

        assertTrue(Double.isNaN(std[0]));
        assertEquals(Math.sqrt(0.5), std[1], 1e-9);
        assertEquals(1.0, std[5], 1e-9);
    }

    @Test
    void testGapsAreSkipped() {
        double[] withGap = {1, Double.NaN, 3};

        double[] mean = RollingStatisticsCalculator.mean(withGap, 3, 2);

        assertTrue(Double.isNaN(mean[1]));
        assertEquals(2.0, mean[2], 1e-9);
    }

    @Test
    void testDiff() {
        double[] diff = RollingStatisticsCalculator.diff(values, 2);

        assertTrue(Double.isNaN(diff[1]));
        assertEquals(2.0, diff[2], 1e-9);
        assertEquals(2.0, diff[5], 1e-9);
    }
}
