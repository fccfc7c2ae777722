package com.example.bondspread.common.exceptions;

/**
 * Пустое окно ряда спредов при расчёте статистики
 */
public class EmptySpreadSeriesException extends BondSpreadException {

    public EmptySpreadSeriesException() {
        super("Пустой ряд спредов");
    }
}
