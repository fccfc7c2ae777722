package com.example.bondspread.common.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Денежный поток облигации: купон или купон + номинал
 */
@Value
public class CashFlow {
    LocalDate date;
    double amount;
}
