package com.example.bondspread.common.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class NumberUtil {
    private NumberUtil() {
    }

    /**
     * Округление HALF_UP; NaN и бесконечности возвращаются как есть
     */
    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static boolean isMissing(Double value) {
        return value == null || value.isNaN();
    }
}
