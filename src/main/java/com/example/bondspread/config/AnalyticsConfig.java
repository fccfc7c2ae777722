package com.example.bondspread.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class AnalyticsConfig {

    @Bean
    public SignalSettings signalSettings(
            @Value("${analytics.signal.percentile-window:252}") int percentileWindow,
            @Value("${analytics.signal.entry-threshold-low:10.0}") double entryThresholdLow,
            @Value("${analytics.signal.entry-threshold-mid:25.0}") double entryThresholdMid,
            @Value("${analytics.signal.exit-threshold-mid:75.0}") double exitThresholdMid,
            @Value("${analytics.signal.exit-threshold-high:90.0}") double exitThresholdHigh,
            @Value("${analytics.signal.zscore-threshold:1.5}") double zscoreThreshold,
            @Value("${analytics.signal.min-confidence:0.3}") double minConfidence,
            @Value("${analytics.signal.min-observations:20}") int minObservations,
            @Value("${analytics.signal.expiry-hours:4}") int signalExpiryHours) {
        SignalSettings settings = SignalSettings.builder()
                .percentileWindow(percentileWindow)
                .entryThresholdLow(entryThresholdLow)
                .entryThresholdMid(entryThresholdMid)
                .exitThresholdMid(exitThresholdMid)
                .exitThresholdHigh(exitThresholdHigh)
                .zscoreThreshold(zscoreThreshold)
                .minConfidence(minConfidence)
                .minObservations(minObservations)
                .signalExpiryHours(signalExpiryHours)
                .build()
                .validate();
        log.info("🔧 Настройки сигналов: {}", settings);
        return settings;
    }

    @Bean
    public BacktestSettings backtestSettings(
            @Value("${analytics.backtest.initial-capital:1000000.0}") double initialCapital,
            @Value("${analytics.backtest.position-size-pct:0.25}") double positionSizePct,
            @Value("${analytics.backtest.commission-rate:0.0005}") double commissionRate,
            @Value("${analytics.backtest.spread-cost-bp:0.5}") double spreadCostBp,
            @Value("${analytics.backtest.max-holding-days:10}") int maxHoldingDays,
            @Value("${analytics.backtest.stop-loss-bp:20.0}") double stopLossBp,
            @Value("${analytics.backtest.take-profit-bp:30.0}") double takeProfitBp,
            @Value("${analytics.backtest.min-history-days:100}") int minHistoryDays,
            @Value("${analytics.backtest.percentile-window:252}") int percentileWindow,
            @Value("${analytics.backtest.min-percentile-periods:20}") int minPercentilePeriods) {
        BacktestSettings settings = BacktestSettings.builder()
                .initialCapital(initialCapital)
                .positionSizePct(positionSizePct)
                .commissionRate(commissionRate)
                .spreadCostBp(spreadCostBp)
                .maxHoldingDays(maxHoldingDays)
                .stopLossBp(stopLossBp)
                .takeProfitBp(takeProfitBp)
                .minHistoryDays(minHistoryDays)
                .percentileWindow(percentileWindow)
                .minPercentilePeriods(minPercentilePeriods)
                .build()
                .validate();
        log.info("🔧 Настройки бэктеста: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
