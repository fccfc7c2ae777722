package com.example.bondspread.core.services;

import com.example.bondspread.common.model.BondPair;
import com.example.bondspread.common.model.SpreadObservation;
import com.example.bondspread.common.model.SpreadPoint;
import com.example.bondspread.common.utils.NumberUtil;
import com.example.bondspread.config.BacktestSettings;
import com.example.bondspread.core.backtest.BacktestSimulator;
import com.example.bondspread.trading.model.BacktestResult;
import com.example.bondspread.trading.model.EquityPoint;
import com.example.bondspread.trading.model.Position;
import com.example.bondspread.trading.model.StrategyMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Бэктест стратегии возврата спреда к медиане
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {
    private final BacktestSettings backtestSettings;

    public BacktestResult runBacktest(List<SpreadObservation> history, String pairName) {
        return runBacktest(history, pairName, null, null, backtestSettings);
    }

    public BacktestResult runBacktest(List<SpreadObservation> history, String pairName,
                                      LocalDate startDate, LocalDate endDate) {
        return runBacktest(history, pairName, startDate, endDate, backtestSettings);
    }

    /**
     * Прогон одной пары. Короткая история (меньше minHistoryDays наблюдений) даёт пустой результат.
     * Фильтр по датам применяется уже после проверки длины истории.
     *
     * @param startDate включительно, null - без ограничения
     * @param endDate   включительно, null - без ограничения
     */
    public BacktestResult runBacktest(List<SpreadObservation> history, String pairName,
                                      LocalDate startDate, LocalDate endDate, BacktestSettings settings) {
        List<SpreadObservation> prepared = history.stream()
                .filter(o -> o.getTimestamp() != null && !NumberUtil.isMissing(o.getSpreadBp()))
                .sorted(Comparator.comparing(SpreadObservation::getTimestamp))
                .toList();

        if (prepared.isEmpty() || prepared.size() < settings.getMinHistoryDays()) {
            log.warn("⚠️ Недостаточно данных для бэктеста {}: {} наблюдений, нужно {}",
                    pairName, prepared.size(), settings.getMinHistoryDays());
            return BacktestResult.empty(pairName, settings.getInitialCapital());
        }

        List<SpreadObservation> filtered = prepared.stream()
                .filter(o -> startDate == null || !o.getDate().isBefore(startDate))
                .filter(o -> endDate == null || !o.getDate().isAfter(endDate))
                .toList();

        BacktestSimulator simulator = new BacktestSimulator(settings, pairName);
        List<Position> positions = simulator.run(filtered);

        BacktestResult result = calculateResults(pairName, settings, positions, simulator.getEquityCurve());
        log.info("📈 Бэктест {}: сделок {}, win rate {}%, P&L {} б.п. / {} руб., капитал {}",
                pairName, result.getTotalTrades(), result.getWinRate(), result.getTotalPnlBp(),
                result.getTotalPnlRub(), result.getFinalCapital());
        return result;
    }

    /**
     * Бэктест по голому ряду спредов с настройками по умолчанию
     */
    public BacktestResult quickBacktest(List<SpreadPoint> spreadSeries, String pairName) {
        List<SpreadObservation> history = spreadSeries.stream()
                .map(p -> SpreadObservation.ofSpread(p.getTimestamp(), p.getSpreadBp()))
                .toList();
        return runBacktest(history, pairName, null, null, BacktestSettings.defaults());
    }

    /**
     * Отдельный прогон на каждую пару. Пары без истории пропускаются.
     *
     * @return результаты по имени пары в порядке списка пар
     */
    public Map<String, BacktestResult> runMultiPairBacktest(Map<String, List<SpreadObservation>> historyByPair,
                                                            List<BondPair> pairs,
                                                            LocalDate startDate, LocalDate endDate) {
        Map<String, BacktestResult> results = new LinkedHashMap<>();
        for (BondPair pair : pairs) {
            String pairName = pair.getPairName();
            List<SpreadObservation> history = historyByPair.get(pairName);
            if (history == null || history.isEmpty()) {
                log.warn("⚠️ Нет данных спреда для {}", pairName);
                continue;
            }
            results.put(pairName, runBacktest(history, pairName, startDate, endDate));
        }
        return results;
    }

    /**
     * Агрегированные метрики по результатам нескольких пар
     */
    public StrategyMetrics calculateStrategyMetrics(Map<String, BacktestResult> results) {
        if (results.isEmpty()) {
            return StrategyMetrics.empty();
        }

        int totalTrades = 0;
        int totalWinning = 0;
        double totalPnlBp = 0;
        double totalPnlRub = 0;
        int profitablePairs = 0;
        Map.Entry<String, BacktestResult> best = null;
        Map.Entry<String, BacktestResult> worst = null;

        for (Map.Entry<String, BacktestResult> entry : results.entrySet()) {
            BacktestResult result = entry.getValue();
            totalTrades += result.getTotalTrades();
            totalWinning += result.getWinningTrades();
            totalPnlBp += result.getTotalPnlBp();
            totalPnlRub += result.getTotalPnlRub();
            if (result.getTotalPnlBp() > 0) {
                profitablePairs++;
            }
            if (best == null || result.getTotalPnlBp() > best.getValue().getTotalPnlBp()) {
                best = entry;
            }
            if (worst == null || result.getTotalPnlBp() <= worst.getValue().getTotalPnlBp()) {
                worst = entry;
            }
        }

        double winRate = totalTrades > 0 ? (double) totalWinning / totalTrades * 100 : 0.0;
        return StrategyMetrics.builder()
                .totalPairs(results.size())
                .totalTrades(totalTrades)
                .totalWinning(totalWinning)
                .winRate(NumberUtil.round(winRate, 2))
                .totalPnlBp(NumberUtil.round(totalPnlBp, 2))
                .totalPnlRub(NumberUtil.round(totalPnlRub, 2))
                .avgPnlPerPair(NumberUtil.round(totalPnlBp / results.size(), 2))
                .bestPair(best.getKey())
                .bestPairPnlBp(best.getValue().getTotalPnlBp())
                .worstPair(worst.getKey())
                .worstPairPnlBp(worst.getValue().getTotalPnlBp())
                .profitablePairs(profitablePairs)
                .build();
    }

    private BacktestResult calculateResults(String pairName, BacktestSettings settings,
                                            List<Position> positions, List<EquityPoint> equityCurve) {
        double initialCapital = settings.getInitialCapital();
        if (positions.isEmpty()) {
            return BacktestResult.empty(pairName, initialCapital);
        }

        DescriptiveStatistics all = new DescriptiveStatistics();
        DescriptiveStatistics winning = new DescriptiveStatistics();
        DescriptiveStatistics losing = new DescriptiveStatistics();
        DescriptiveStatistics holding = new DescriptiveStatistics();
        double totalPnlRub = 0;

        // просадка по накопленному P&L в порядке сделок
        double cumulativeBp = 0;
        double peakBp = 0;
        double maxDrawdownBp = 0;

        for (Position position : positions) {
            double pnlBp = position.getPnlBp();
            all.addValue(pnlBp);
            holding.addValue(position.getHoldingDays());
            totalPnlRub += position.getPnlRub();
            if (position.isWinning()) {
                winning.addValue(pnlBp);
            } else {
                losing.addValue(pnlBp);
            }

            cumulativeBp += pnlBp;
            peakBp = Math.max(peakBp, cumulativeBp);
            maxDrawdownBp = Math.max(maxDrawdownBp, peakBp - cumulativeBp);
        }

        int totalTrades = positions.size();
        double totalPnlBp = all.getSum();
        double grossProfit = winning.getSum();
        double grossLoss = Math.abs(losing.getSum());
        double profitFactor = grossLoss > 0 ? grossProfit / grossLoss : 0.0;
        double finalCapital = equityCurve.get(equityCurve.size() - 1).getCapital();

        return BacktestResult.builder()
                .pairName(pairName)
                .initialCapital(initialCapital)
                .finalCapital(NumberUtil.round(finalCapital, 2))
                .totalTrades(totalTrades)
                .winningTrades((int) winning.getN())
                .losingTrades((int) losing.getN())
                .totalPnlBp(NumberUtil.round(totalPnlBp, 2))
                .totalPnlRub(NumberUtil.round(totalPnlRub, 2))
                .totalPnlPercent(NumberUtil.round(totalPnlRub / initialCapital * 100, 2))
                .avgPnlBp(NumberUtil.round(all.getMean(), 2))
                .avgWinningBp(winning.getN() > 0 ? NumberUtil.round(winning.getMean(), 2) : 0.0)
                .avgLosingBp(losing.getN() > 0 ? NumberUtil.round(losing.getMean(), 2) : 0.0)
                .avgHoldingDays(NumberUtil.round(holding.getMean(), 1))
                .maxDrawdownBp(NumberUtil.round(maxDrawdownBp, 2))
                .maxDrawdownRub(NumberUtil.round(maxDrawdownRub(initialCapital, equityCurve), 2))
                .sharpeRatio(NumberUtil.round(sharpeRatio(all), 3))
                .winRate(NumberUtil.round(winning.getN() * 100.0 / totalTrades, 2))
                .profitFactor(NumberUtil.round(profitFactor, 3))
                .equityCurve(List.copyOf(equityCurve))
                .positions(List.copyOf(positions))
                .build();
    }

    /**
     * Максимальная просадка капитала в рублях, начиная с начального капитала
     */
    double maxDrawdownRub(double initialCapital, List<EquityPoint> equityCurve) {
        double peak = initialCapital;
        double maxDrawdown = 0;
        for (EquityPoint point : equityCurve) {
            peak = Math.max(peak, point.getCapital());
            maxDrawdown = Math.max(maxDrawdown, peak - point.getCapital());
        }
        return maxDrawdown;
    }

    /**
     * Среднее / выборочное σ по P&L сделок в б.п.; 0 при менее чем двух сделках или нулевом σ
     */
    double sharpeRatio(DescriptiveStatistics pnlBp) {
        if (pnlBp.getN() < 2) {
            return 0.0;
        }
        double std = pnlBp.getStandardDeviation();
        return std > 0 ? pnlBp.getMean() / std : 0.0;
    }
}
