package com.example.bondspread.common.exceptions;

import lombok.Getter;

/**
 * Некорректные статические параметры облигации (ошибка программиста, а не данных)
 */
@Getter
public class InvalidBondParamsException extends BondSpreadException {

    private final String isin;

    public InvalidBondParamsException(String isin, String message) {
        super(isin != null ? isin + ": " + message : message);
        this.isin = isin;
    }
}
