package com.example.bondspread.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Результат одного прогона бэктеста. Только для чтения.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestResult {

    String pairName;
    double initialCapital;
    double finalCapital;

    int totalTrades;
    int winningTrades;
    int losingTrades;

    // Доходность
    double totalPnlBp;
    double totalPnlRub;
    double totalPnlPercent;

    // Средние значения
    double avgPnlBp;
    double avgWinningBp;
    double avgLosingBp;
    double avgHoldingDays;

    // Риск-метрики
    double maxDrawdownBp;
    double maxDrawdownRub;
    double sharpeRatio;
    double winRate;
    double profitFactor;

    @Builder.Default
    List<EquityPoint> equityCurve = List.of();
    @Builder.Default
    List<Position> positions = List.of();

    public static BacktestResult empty(String pairName, double initialCapital) {
        return BacktestResult.builder()
                .pairName(pairName)
                .initialCapital(initialCapital)
                .finalCapital(initialCapital)
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalTrades == 0;
    }
}
