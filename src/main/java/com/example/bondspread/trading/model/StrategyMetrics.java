package com.example.bondspread.trading.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Агрегированные метрики стратегии по нескольким парам
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StrategyMetrics {
    int totalPairs;
    int totalTrades;
    int totalWinning;
    double winRate;
    double totalPnlBp;
    double totalPnlRub;
    double avgPnlPerPair;
    String bestPair;
    double bestPairPnlBp;
    String worstPair;
    double worstPairPnlBp;
    int profitablePairs;

    public static StrategyMetrics empty() {
        return StrategyMetrics.builder().build();
    }
}
