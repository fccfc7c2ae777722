package com.example.bondspread.config;

import com.example.bondspread.common.exceptions.InvalidSettingsException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SettingsTest {

    @Test
    void testDefaultsAreValid() {
        assertDoesNotThrow(() -> SignalSettings.defaults().validate());
        assertDoesNotThrow(() -> BacktestSettings.defaults().validate());
    }

    @Test
    void testThresholdsMustIncrease() {
        SignalSettings settings = SignalSettings.defaults().toBuilder()
                .entryThresholdMid(80.0)
                .build();

        assertThrows(InvalidSettingsException.class, settings::validate);
    }

    @Test
    void testSignalLimits() {
        assertThrows(InvalidSettingsException.class,
                () -> SignalSettings.defaults().toBuilder().minConfidence(1.5).build().validate());
        assertThrows(InvalidSettingsException.class,
                () -> SignalSettings.defaults().toBuilder().percentileWindow(0).build().validate());
    }

    @Test
    void testBacktestLimits() {
        assertThrows(InvalidSettingsException.class,
                () -> BacktestSettings.defaults().toBuilder().positionSizePct(1.5).build().validate());
        assertThrows(InvalidSettingsException.class,
                () -> BacktestSettings.defaults().toBuilder().initialCapital(0.0).build().validate());
        assertThrows(InvalidSettingsException.class,
                () -> BacktestSettings.defaults().toBuilder().stopLossBp(-5.0).build().validate());
        assertThrows(InvalidSettingsException.class,
                () -> BacktestSettings.defaults().toBuilder().minPercentilePeriods(300).build().validate());
    }
}
