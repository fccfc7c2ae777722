package com.example.bondspread.common.exceptions;

public class InvalidSettingsException extends BondSpreadException {

    public InvalidSettingsException(String message) {
        super(message);
    }
}
