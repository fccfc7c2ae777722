package com.example.bondspread.calculators;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Arrays;

/**
 * Скользящие статистики по окну фиксированной длины, включая текущую точку.
 * Пропуски (NaN) не учитываются; если в окне меньше minPeriods значений, результат NaN.
 */
public final class RollingStatisticsCalculator {
    private RollingStatisticsCalculator() {
    }

    public static double[] mean(double[] values, int window, int minPeriods) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            DescriptiveStatistics stats = windowStats(values, i, window);
            result[i] = stats.getN() >= minPeriods && stats.getN() > 0 ? stats.getMean() : Double.NaN;
        }
        return result;
    }

    public static double[] std(double[] values, int window, int minPeriods) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            DescriptiveStatistics stats = windowStats(values, i, window);
            result[i] = stats.getN() >= Math.max(minPeriods, 2) ? stats.getStandardDeviation() : Double.NaN;
        }
        return result;
    }

    public static double[] percentile(double[] values, int window, int minPeriods, double level) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            DescriptiveStatistics stats = windowStats(values, i, window);
            result[i] = stats.getN() >= minPeriods && stats.getN() > 0
                    ? PercentileCalculator.percentile(stats.getValues(), level)
                    : Double.NaN;
        }
        return result;
    }

    /**
     * Разность с значением periods шагов назад; первые periods элементов NaN
     */
    public static double[] diff(double[] values, int periods) {
        double[] result = new double[values.length];
        Arrays.fill(result, Double.NaN);
        for (int i = periods; i < values.length; i++) {
            result[i] = values[i] - values[i - periods];
        }
        return result;
    }

    private static DescriptiveStatistics windowStats(double[] values, int end, int window) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int j = Math.max(0, end - window + 1); j <= end; j++) {
            if (!Double.isNaN(values[j])) {
                stats.addValue(values[j]);
            }
        }
        return stats;
    }
}
