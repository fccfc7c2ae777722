package com.example.bondspread.trading.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Капитал после закрытия сделки
 */
@Value(staticConstructor = "of")
public class EquityPoint {
    LocalDate date;
    double capital;
}
