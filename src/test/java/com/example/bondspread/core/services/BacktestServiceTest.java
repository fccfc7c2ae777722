package com.example.bondspread.core.services;

import com.example.bondspread.common.model.BondPair;
import com.example.bondspread.common.model.SpreadObservation;
import com.example.bondspread.common.model.SpreadPoint;
import com.example.bondspread.common.utils.JsonUtils;
import com.example.bondspread.config.BacktestSettings;
import com.example.bondspread.trading.model.BacktestResult;
import com.example.bondspread.trading.model.ExitReasonType;
import com.example.bondspread.trading.model.Position;
import com.example.bondspread.trading.model.PositionState;
import com.example.bondspread.trading.model.SignalDirection;
import com.example.bondspread.trading.model.StrategyMetrics;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class BacktestServiceTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    // 20 шагов прогрева: спред колеблется между 40 и 160 б.п.
    private static final List<Double> WARM_UP = List.of(
            100.0, 80.0, 120.0, 60.0, 140.0, 40.0, 160.0, 90.0, 110.0, 70.0,
            130.0, 50.0, 150.0, 100.0, 85.0, 115.0, 95.0, 105.0, 100.0, 100.0);

    // стоп и тейк вне досягаемости, удержание не ограничено
    private final BacktestSettings wideSettings = BacktestSettings.defaults().toBuilder()
            .minHistoryDays(20)
            .stopLossBp(1000.0)
            .takeProfitBp(1000.0)
            .maxHoldingDays(1000)
            .build();

    private final BacktestService backtestService = new BacktestService(wideSettings);

    private static List<SpreadObservation> history(List<Double> tail) {
        List<Double> spreads = Stream.concat(WARM_UP.stream(), tail.stream()).toList();
        List<SpreadObservation> observations = new ArrayList<>();
        for (int i = 0; i < spreads.size(); i++) {
            observations.add(SpreadObservation.ofSpread(START.plusDays(i), spreads.get(i)));
        }
        return observations;
    }

    @Test
    void testSingleMeanReversionTrade() {
        BacktestResult result = backtestService.runBacktest(history(List.of(40.0, 70.0, 100.0, 95.0, 105.0, 100.0)), "A_B");

        assertEquals(1, result.getTotalTrades());
        Position position = result.getPositions().get(0);
        assertEquals(SignalDirection.LONG_SHORT, position.getDirection());
        assertEquals(LocalDate.of(2024, 1, 21), position.getEntryDate());
        assertEquals(LocalDate.of(2024, 1, 23), position.getExitDate());
        assertEquals(40.0, position.getEntrySpread());
        assertEquals(100.0, position.getExitSpread());
        assertEquals(PositionState.CLOSED, position.getState());
        assertEquals(ExitReasonType.MEAN_REVERSION, position.getExitReason());
        assertEquals(2, position.getHoldingDays());
        assertEquals(250_000.0, position.getSize(), 1e-9);
        // |изменение спреда| - затраты на спред
        assertEquals(59.5, position.getPnlBp(), 1e-9);
        assertEquals(1237.5, position.getPnlRub(), 1e-9);

        assertEquals(1, result.getWinningTrades());
        assertEquals(100.0, result.getWinRate());
        assertEquals(1_001_237.5, result.getFinalCapital());
        assertEquals(0.12, result.getTotalPnlPercent());
        assertEquals(0.0, result.getMaxDrawdownBp());
        assertEquals(0.0, result.getSharpeRatio());
        assertEquals(1, result.getEquityCurve().size());
        assertEquals(LocalDate.of(2024, 1, 23), result.getEquityCurve().get(0).getDate());
    }

    @Test
    void testStopLossThenTakeProfitOnReentry() {
        BacktestSettings settings = wideSettings.toBuilder().stopLossBp(20.0).takeProfitBp(30.0).build();

        BacktestResult result = backtestService.runBacktest(history(List.of(40.0, 15.0, 100.0)), "A_B", null, null, settings);

        assertEquals(2, result.getTotalTrades());
        Position stopped = result.getPositions().get(0);
        Position taken = result.getPositions().get(1);

        assertEquals(PositionState.STOPPED, stopped.getState());
        assertEquals(ExitReasonType.STOP_LOSS, stopped.getExitReason());
        assertEquals(-25.5, stopped.getPnlBp(), 1e-9);
        assertEquals(-887.5, stopped.getPnlRub(), 1e-9);

        // новая позиция открыта на шаге закрытия, от уменьшенного капитала
        assertEquals(stopped.getExitDate(), taken.getEntryDate());
        assertEquals(249_778.125, taken.getSize(), 1e-6);
        assertEquals(PositionState.TAKEN, taken.getState());
        assertEquals(84.5, taken.getPnlBp(), 1e-9);
        assertEquals(1860.85, taken.getPnlRub(), 0.01);

        assertEquals(59.0, result.getTotalPnlBp());
        assertEquals(50.0, result.getWinRate());
        assertEquals(84.5, result.getAvgWinningBp());
        assertEquals(-25.5, result.getAvgLosingBp());
        assertEquals(3.314, result.getProfitFactor());
        assertEquals(25.5, result.getMaxDrawdownBp());
        assertEquals(887.5, result.getMaxDrawdownRub());
        assertEquals(0.379, result.getSharpeRatio());
        assertEquals(1.0, result.getAvgHoldingDays());
        assertEquals(1_000_973.35, result.getFinalCapital());
    }

    @Test
    void testShortSpreadPosition() {
        BacktestResult result = backtestService.runBacktest(history(List.of(160.0, 200.0, 90.0)), "A_B");

        Position position = result.getPositions().get(0);
        assertEquals(SignalDirection.SHORT_LONG, position.getDirection());
        assertEquals(ExitReasonType.MEAN_REVERSION, position.getExitReason());
        assertEquals(69.5, position.getPnlBp(), 1e-9);
    }

    @Test
    void testMaxHoldingExit() {
        BacktestSettings settings = wideSettings.toBuilder().maxHoldingDays(2).build();

        BacktestResult result = backtestService.runBacktest(history(List.of(40.0, 45.0, 50.0, 55.0)), "A_B", null, null, settings);

        assertEquals(1, result.getTotalTrades());
        Position position = result.getPositions().get(0);
        assertEquals(ExitReasonType.MAX_HOLDING, position.getExitReason());
        assertEquals(PositionState.CLOSED, position.getState());
        assertEquals(9.5, position.getPnlBp(), 1e-9);
        // комиссия больше дохода по спреду
        assertEquals(-12.5, position.getPnlRub(), 1e-9);
    }

    @Test
    void testShortHistoryGivesEmptyResult() {
        BacktestService defaultService = new BacktestService(BacktestSettings.defaults());

        BacktestResult result = defaultService.runBacktest(history(List.of(40.0, 70.0, 100.0)), "A_B");

        assertTrue(result.isEmpty());
        assertTrue(result.getPositions().isEmpty());
        assertEquals(1_000_000.0, result.getFinalCapital());
    }

    @Test
    void testOpenPositionAtEndIsNotCounted() {
        List<SpreadObservation> observations = history(List.of(40.0, 70.0, 100.0));

        // позиция открыта 21 января, к концу периода спред не вернулся к медиане
        BacktestResult result = backtestService.runBacktest(observations, "A_B", null, LocalDate.of(2024, 1, 22));

        assertTrue(result.isEmpty());
    }

    @Test
    void testMissingSpreadsAreDropped() {
        List<SpreadObservation> observations = new ArrayList<>(history(List.of(40.0, 70.0, 100.0)));
        observations.add(5, SpreadObservation.ofSpread(START.plusHours(5 * 24 + 12), null));

        BacktestResult result = backtestService.runBacktest(observations, "A_B");

        assertEquals(1, result.getTotalTrades());
        assertEquals(59.5, result.getTotalPnlBp());
    }

    @Test
    void testYieldsCarriedIntoPositions() {
        List<SpreadObservation> observations = new ArrayList<>();
        List<Double> spreads = Stream.concat(WARM_UP.stream(), Stream.of(40.0, 70.0, 100.0)).toList();
        for (int i = 0; i < spreads.size(); i++) {
            observations.add(SpreadObservation.of(START.plusDays(i), 10.0 + spreads.get(i) / 100, 10.0));
        }

        Position position = backtestService.runBacktest(observations, "A_B").getPositions().get(0);

        assertEquals(10.4, position.getEntryYtmLong(), 1e-9);
        assertEquals(10.0, position.getEntryYtmShort(), 1e-9);
        assertEquals(11.0, position.getExitYtmLong(), 1e-9);
    }

    @Test
    void testQuickBacktestUsesDefaultSettings() {
        List<SpreadPoint> series = history(List.of(40.0, 70.0, 100.0)).stream()
                .map(o -> SpreadPoint.of(o.getTimestamp(), o.getSpreadBp()))
                .toList();

        // по умолчанию нужно 100 наблюдений
        assertTrue(backtestService.quickBacktest(series, "TEST").isEmpty());
    }

    @Test
    void testMultiPairSkipsPairsWithoutData() {
        Map<String, List<SpreadObservation>> data = Map.of(
                "A_B", history(List.of(40.0, 70.0, 100.0)),
                "C_D", List.of());

        Map<String, BacktestResult> results = backtestService.runMultiPairBacktest(
                data, List.of(BondPair.of("A", "B"), BondPair.of("C", "D"), BondPair.of("E", "F")), null, null);

        assertEquals(List.of("A_B"), List.copyOf(results.keySet()));
        assertEquals(1, results.get("A_B").getTotalTrades());
    }

    @Test
    void testStrategyMetrics() {
        Map<String, BacktestResult> results = new LinkedHashMap<>();
        results.put("A_B", BacktestResult.builder().pairName("A_B").totalTrades(1).winningTrades(1)
                .totalPnlBp(59.5).totalPnlRub(1237.5).build());
        results.put("C_D", BacktestResult.builder().pairName("C_D").totalTrades(2).winningTrades(0)
                .totalPnlBp(-10.0).totalPnlRub(-600.0).build());
        results.put("E_F", BacktestResult.empty("E_F", 1_000_000.0));

        StrategyMetrics metrics = backtestService.calculateStrategyMetrics(results);

        assertEquals(3, metrics.getTotalPairs());
        assertEquals(3, metrics.getTotalTrades());
        assertEquals(1, metrics.getTotalWinning());
        assertEquals(33.33, metrics.getWinRate());
        assertEquals(49.5, metrics.getTotalPnlBp());
        assertEquals(637.5, metrics.getTotalPnlRub());
        assertEquals(16.5, metrics.getAvgPnlPerPair());
        assertEquals("A_B", metrics.getBestPair());
        assertEquals("C_D", metrics.getWorstPair());
        assertEquals(-10.0, metrics.getWorstPairPnlBp());
        assertEquals(1, metrics.getProfitablePairs());

        assertEquals(StrategyMetrics.empty(), backtestService.calculateStrategyMetrics(Map.of()));
    }

    @Test
    void testResultSerialization() {
        BacktestResult result = backtestService.runBacktest(history(List.of(40.0, 70.0, 100.0)), "A_B");

        String json = JsonUtils.toJson(result);

        assertTrue(json.contains("\"total_trades\":1"), json);
        assertTrue(json.contains("\"exit_reason\":\"MEAN_REVERSION\""), json);
        assertTrue(json.contains("\"entry_date\":\"2024-01-21\""), json);
        assertTrue(json.contains("\"holding_days\":2"), json);
    }
}
