package com.example.bondspread.config;

import com.example.bondspread.common.exceptions.InvalidSettingsException;
import lombok.Builder;
import lombok.Value;

/**
 * Настройки бэктеста
 */
@Value
@Builder(toBuilder = true)
public class BacktestSettings {

    @Builder.Default
    double initialCapital = 1_000_000.0;
    @Builder.Default
    double positionSizePct = 0.25; // доля капитала на позицию
    @Builder.Default
    double commissionRate = 0.0005; // комиссия за сторону сделки
    @Builder.Default
    double spreadCostBp = 0.5;
    @Builder.Default
    int maxHoldingDays = 10;
    @Builder.Default
    double stopLossBp = 20.0;
    @Builder.Default
    double takeProfitBp = 30.0;
    @Builder.Default
    int minHistoryDays = 100;
    @Builder.Default
    int percentileWindow = 252;
    @Builder.Default
    int minPercentilePeriods = 20;

    public static BacktestSettings defaults() {
        return BacktestSettings.builder().build();
    }

    public BacktestSettings validate() {
        if (!(initialCapital > 0)) {
            throw new InvalidSettingsException("initialCapital должен быть положительным: " + initialCapital);
        }
        if (!(positionSizePct > 0 && positionSizePct <= 1)) {
            throw new InvalidSettingsException("positionSizePct вне (0, 1]: " + positionSizePct);
        }
        if (commissionRate < 0 || spreadCostBp < 0) {
            throw new InvalidSettingsException("Комиссия и затраты на спред не могут быть отрицательными");
        }
        if (maxHoldingDays < 0 || minHistoryDays < 0) {
            throw new InvalidSettingsException("maxHoldingDays и minHistoryDays не могут быть отрицательными");
        }
        if (!(stopLossBp > 0) || !(takeProfitBp > 0)) {
            throw new InvalidSettingsException("stopLossBp и takeProfitBp должны быть положительными");
        }
        if (percentileWindow < 1 || minPercentilePeriods < 1 || minPercentilePeriods > percentileWindow) {
            throw new InvalidSettingsException(String.format(
                    "Некорректное окно перцентилей: window=%d, minPeriods=%d", percentileWindow, minPercentilePeriods));
        }
        return this;
    }
}
