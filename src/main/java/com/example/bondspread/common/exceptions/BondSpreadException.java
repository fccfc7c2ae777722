package com.example.bondspread.common.exceptions;

/**
 * Базовое исключение аналитики спредов
 */
public class BondSpreadException extends RuntimeException {

    public BondSpreadException(String message) {
        super(message);
    }

    public BondSpreadException(String message, Throwable cause) {
        super(message, cause);
    }
}
