package com.example.bondspread.calculators;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Доли года для дисконтирования. Всегда Actual/365.25, независимо от базы в параметрах облигации.
 */
public final class YearFractionCalculator {

    public static final double DAYS_IN_YEAR = 365.25;

    private YearFractionCalculator() {
    }

    public static double yearFraction(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to) / DAYS_IN_YEAR;
    }
}
