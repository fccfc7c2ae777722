package com.example.bondspread.calculators;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Перцентили с линейной интерполяцией между соседними порядковыми статистиками (R-7)
 */
public final class PercentileCalculator {
    private PercentileCalculator() {
    }

    public static double percentile(double[] values, double level) {
        if (values.length == 0) {
            return Double.NaN;
        }
        if (level <= 0) {
            double min = values[0];
            for (double v : values) {
                min = Math.min(min, v);
            }
            return min;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, Math.min(level, 100.0));
    }

    /**
     * Доля значений строго меньше current, в процентах
     */
    public static double rankBelow(double current, double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        int below = 0;
        for (double v : values) {
            if (v < current) {
                below++;
            }
        }
        return (double) below / values.length * 100;
    }
}
