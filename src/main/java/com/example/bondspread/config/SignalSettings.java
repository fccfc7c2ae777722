package com.example.bondspread.config;

import com.example.bondspread.common.exceptions.InvalidSettingsException;
import lombok.Builder;
import lombok.Value;

/**
 * Настройки генерации торговых сигналов
 */
@Value
@Builder(toBuilder = true)
public class SignalSettings {

    @Builder.Default
    int percentileWindow = 252; // окно для перцентилей, наблюдений
    @Builder.Default
    double entryThresholdLow = 10.0; // P10 - сильный вход
    @Builder.Default
    double entryThresholdMid = 25.0; // P25 - умеренный вход
    @Builder.Default
    double exitThresholdMid = 75.0; // P75 - умеренный выход
    @Builder.Default
    double exitThresholdHigh = 90.0; // P90 - сильный выход
    @Builder.Default
    double zscoreThreshold = 1.5;
    @Builder.Default
    double minConfidence = 0.3;
    @Builder.Default
    int minObservations = 20;
    @Builder.Default
    int signalExpiryHours = 4;

    public static SignalSettings defaults() {
        return SignalSettings.builder().build();
    }

    public SignalSettings validate() {
        if (percentileWindow < 1) {
            throw new InvalidSettingsException("percentileWindow должно быть >= 1: " + percentileWindow);
        }
        if (!(0 < entryThresholdLow && entryThresholdLow <= entryThresholdMid
                && entryThresholdMid <= exitThresholdMid && exitThresholdMid <= exitThresholdHigh
                && exitThresholdHigh <= 100)) {
            throw new InvalidSettingsException(String.format(
                    "Пороги перцентилей должны возрастать в (0, 100]: %s/%s/%s/%s",
                    entryThresholdLow, entryThresholdMid, exitThresholdMid, exitThresholdHigh));
        }
        if (minConfidence < 0 || minConfidence > 1) {
            throw new InvalidSettingsException("minConfidence вне [0, 1]: " + minConfidence);
        }
        if (minObservations < 1) {
            throw new InvalidSettingsException("minObservations должно быть >= 1: " + minObservations);
        }
        if (signalExpiryHours < 0) {
            throw new InvalidSettingsException("signalExpiryHours не может быть отрицательным: " + signalExpiryHours);
        }
        return this;
    }
}
