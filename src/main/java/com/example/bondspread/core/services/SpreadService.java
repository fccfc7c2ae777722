package com.example.bondspread.core.services;

import com.example.bondspread.calculators.PercentileCalculator;
import com.example.bondspread.calculators.RollingStatisticsCalculator;
import com.example.bondspread.common.exceptions.EmptySpreadSeriesException;
import com.example.bondspread.common.model.SpreadHistoryPoint;
import com.example.bondspread.common.model.SpreadObservation;
import com.example.bondspread.common.model.SpreadPoint;
import com.example.bondspread.common.model.SpreadStats;
import com.example.bondspread.common.model.YieldPoint;
import com.example.bondspread.common.utils.NumberUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Спреды доходности между двумя облигациями и статистика их распределения
 */
@Slf4j
@Service
public class SpreadService {

    public static final int DEFAULT_LOOKBACK = 252;
    public static final int ANOMALY_WINDOW = 20;
    public static final double DEFAULT_ANOMALY_THRESHOLD_STD = 2.0;

    private static final int SHORT_WINDOW = 20;
    private static final int LONG_WINDOW = 60;

    /**
     * Спред = (YTM_long - YTM_short) × 100 б.п., два знака
     */
    public double calculateSpread(double ytmLong, double ytmShort) {
        return NumberUtil.round((ytmLong - ytmShort) * 100, 2);
    }

    /**
     * Серия спредов по совпадающим меткам времени; несовпавшие и пустые точки отбрасываются
     */
    public List<SpreadPoint> calculateSpreadSeries(List<YieldPoint> longSeries, List<YieldPoint> shortSeries) {
        List<SpreadPoint> result = new ArrayList<>();
        for (SpreadObservation observation : calculateSpreadObservations(longSeries, shortSeries)) {
            result.add(SpreadPoint.of(observation.getTimestamp(), observation.getSpreadBp()));
        }
        return result;
    }

    /**
     * То же выравнивание, но с исходными доходностями - вход для бэктеста
     */
    public List<SpreadObservation> calculateSpreadObservations(List<YieldPoint> longSeries, List<YieldPoint> shortSeries) {
        Map<LocalDateTime, Double> longByTime = toMap(longSeries);
        Map<LocalDateTime, Double> shortByTime = toMap(shortSeries);

        List<SpreadObservation> result = new ArrayList<>();
        for (Map.Entry<LocalDateTime, Double> entry : longByTime.entrySet()) {
            Double ytmShort = shortByTime.get(entry.getKey());
            if (NumberUtil.isMissing(ytmShort)) {
                continue;
            }
            result.add(SpreadObservation.of(entry.getKey(), entry.getValue(), ytmShort));
        }
        return result;
    }

    public SpreadStats calculateSpreadStats(List<Double> series) {
        return calculateSpreadStats(series, DEFAULT_LOOKBACK);
    }

    /**
     * Статистика по последним lookback непустым значениям.
     *
     * @throws EmptySpreadSeriesException если окно пустое
     */
    public SpreadStats calculateSpreadStats(List<Double> series, int lookback) {
        double[] window = window(series, lookback);
        if (window.length == 0) {
            throw new EmptySpreadSeriesException();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(window);
        double current = window[window.length - 1];
        double mean = stats.getMean();
        // выборочное стандартное отклонение (n - 1), для одной точки не определено
        double std = window.length > 1 ? stats.getStandardDeviation() : Double.NaN;
        double zscore = std > 0 ? (current - mean) / std : 0.0;

        return SpreadStats.builder()
                .current(NumberUtil.round(current, 2))
                .mean(NumberUtil.round(mean, 2))
                .std(NumberUtil.round(std, 2))
                .min(NumberUtil.round(stats.getMin(), 2))
                .max(NumberUtil.round(stats.getMax(), 2))
                .percentile10(NumberUtil.round(PercentileCalculator.percentile(window, 10), 2))
                .percentile25(NumberUtil.round(PercentileCalculator.percentile(window, 25), 2))
                .percentile50(NumberUtil.round(PercentileCalculator.percentile(window, 50), 2))
                .percentile75(NumberUtil.round(PercentileCalculator.percentile(window, 75), 2))
                .percentile90(NumberUtil.round(PercentileCalculator.percentile(window, 90), 2))
                .zscore(NumberUtil.round(zscore, 2))
                .lookbackDays(window.length)
                .build();
    }

    /**
     * Перцентиль произвольного уровня по последним lookback значениям, два знака; NaN для пустого окна
     */
    public double calculatePercentile(List<Double> series, int lookback, double level) {
        double[] window = window(series, lookback);
        return NumberUtil.round(PercentileCalculator.percentile(window, level), 2);
    }

    /**
     * Перцентиль-ранг текущего спреда (0-100, один знак). Для пустого окна 50.
     *
     * @param lookback окно; null или <= 0 - весь ряд
     */
    public double getSpreadPercentileRank(double current, List<Double> series, Integer lookback) {
        int size = lookback != null && lookback > 0 ? lookback : Integer.MAX_VALUE;
        double[] window = window(series, size);
        if (window.length == 0) {
            return 50.0;
        }
        return NumberUtil.round(PercentileCalculator.rankBelow(current, window), 1);
    }

    public double getSpreadPercentileRank(double current, List<Double> series) {
        return getSpreadPercentileRank(current, series, null);
    }

    public List<Boolean> detectAnomalies(List<Double> series) {
        return detectAnomalies(series, DEFAULT_ANOMALY_THRESHOLD_STD);
    }

    /**
     * Аномалии: отклонение от скользящего среднего (20) больше thresholdStd скользящих σ.
     * Пока окно не заполнено, аномалий нет.
     */
    public List<Boolean> detectAnomalies(List<Double> series, double thresholdStd) {
        double[] values = toArray(series);
        double[] rollingMean = RollingStatisticsCalculator.mean(values, ANOMALY_WINDOW, ANOMALY_WINDOW);
        double[] rollingStd = RollingStatisticsCalculator.std(values, ANOMALY_WINDOW, ANOMALY_WINDOW);

        List<Boolean> anomalies = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double upper = rollingMean[i] + thresholdStd * rollingStd[i];
            double lower = rollingMean[i] - thresholdStd * rollingStd[i];
            // сравнения с NaN ложны
            anomalies.add(values[i] > upper || values[i] < lower);
        }
        return anomalies;
    }

    /**
     * Изменение спреда за periods шагов, NaN в начале ряда
     */
    public List<Double> calculateSpreadChange(List<Double> series, int periods) {
        if (periods < 1) {
            throw new IllegalArgumentException("periods должно быть >= 1: " + periods);
        }
        double[] diff = RollingStatisticsCalculator.diff(toArray(series), periods);
        return Arrays.stream(diff).boxed().toList();
    }

    /**
     * Спред, нормализованный на среднюю дюрацию пары (к 10 годам)
     */
    public double calculateDurationWeightedSpread(double ytmLong, double ytmShort,
                                                  double durationLong, double durationShort) {
        double avgDuration = (durationLong + durationShort) / 2;
        if (!(avgDuration > 0)) {
            throw new IllegalArgumentException("Средняя дюрация должна быть положительной: " + avgDuration);
        }
        double spread = (ytmLong - ytmShort) * 100;
        return NumberUtil.round(spread / avgDuration * 10, 2);
    }

    /**
     * История спреда пары со скользящими средними и σ по 20 и 60 наблюдениям
     */
    public List<SpreadHistoryPoint> buildSpreadHistory(List<YieldPoint> longSeries, List<YieldPoint> shortSeries) {
        List<SpreadObservation> observations = calculateSpreadObservations(longSeries, shortSeries);
        double[] spreads = observations.stream().mapToDouble(SpreadObservation::getSpreadBp).toArray();

        double[] mean20 = RollingStatisticsCalculator.mean(spreads, SHORT_WINDOW, SHORT_WINDOW);
        double[] std20 = RollingStatisticsCalculator.std(spreads, SHORT_WINDOW, SHORT_WINDOW);
        double[] mean60 = RollingStatisticsCalculator.mean(spreads, LONG_WINDOW, LONG_WINDOW);
        double[] std60 = RollingStatisticsCalculator.std(spreads, LONG_WINDOW, LONG_WINDOW);

        List<SpreadHistoryPoint> history = new ArrayList<>(observations.size());
        for (int i = 0; i < observations.size(); i++) {
            SpreadObservation observation = observations.get(i);
            history.add(SpreadHistoryPoint.builder()
                    .timestamp(observation.getTimestamp())
                    .spreadBp(spreads[i])
                    .ytmLong(observation.getYtmLong())
                    .ytmShort(observation.getYtmShort())
                    .spreadMean20(mean20[i])
                    .spreadStd20(std20[i])
                    .spreadMean60(mean60[i])
                    .spreadStd60(std60[i])
                    .build());
        }
        log.debug("История спреда: {} точек из {}/{}", history.size(), longSeries.size(), shortSeries.size());
        return history;
    }

    public List<Double> spreadValues(List<SpreadPoint> points) {
        return points.stream().map(SpreadPoint::getSpreadBp).toList();
    }

    /**
     * Последние lookback непустых значений ряда
     */
    private double[] window(List<Double> series, int lookback) {
        if (lookback < 1) {
            throw new IllegalArgumentException("lookback должно быть >= 1: " + lookback);
        }
        double[] clean = series.stream()
                .filter(v -> !NumberUtil.isMissing(v))
                .mapToDouble(Double::doubleValue)
                .toArray();
        int from = Math.max(0, clean.length - lookback);
        return Arrays.copyOfRange(clean, from, clean.length);
    }

    private double[] toArray(List<Double> series) {
        return series.stream()
                .mapToDouble(v -> v == null ? Double.NaN : v)
                .toArray();
    }

    private Map<LocalDateTime, Double> toMap(List<YieldPoint> series) {
        Map<LocalDateTime, Double> result = new TreeMap<>();
        series.stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getTimestamp() != null && !NumberUtil.isMissing(p.getValue()))
                .forEach(p -> result.put(p.getTimestamp(), p.getValue()));
        return result;
    }
}
