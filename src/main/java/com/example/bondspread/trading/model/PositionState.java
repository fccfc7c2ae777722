package com.example.bondspread.trading.model;

/**
 * Состояние позиции в бэктесте
 */
public enum PositionState {
    OPEN,       // Открыта
    CLOSED,     // Закрыта по возврату к среднему или по времени
    STOPPED,    // Закрыта по стоп-лоссу
    TAKEN;      // Закрыта по тейк-профиту

    public boolean isTerminal() {
        return this != OPEN;
    }
}
