package com.example.bondspread.common.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * База расчёта дней. Хранится в параметрах облигации, но все расчёты
 * долей года идут по Actual/365.25 (см. YearFractionCalculator).
 */
@Getter
@RequiredArgsConstructor
public enum DayCountBasis {
    ACT_ACT("ACT/ACT"),
    ACT_365("ACT/365"),
    ACT_360("ACT/360"),
    THIRTY_360("30/360");

    private final String code;

    public static DayCountBasis fromCode(String code) {
        if (code == null || code.isBlank()) {
            return ACT_ACT;
        }
        for (DayCountBasis basis : values()) {
            if (basis.code.equalsIgnoreCase(code.trim()) || basis.name().equalsIgnoreCase(code.trim())) {
                return basis;
            }
        }
        throw new IllegalArgumentException("Неизвестная база расчёта дней: " + code);
    }
}
