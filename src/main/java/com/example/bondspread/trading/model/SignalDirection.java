package com.example.bondspread.trading.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Направление позиции по спреду
 */
@Getter
@RequiredArgsConstructor
public enum SignalDirection {
    LONG_SHORT("Покупать длинную, продавать короткую"), // прибыль при расширении спреда
    SHORT_LONG("Продавать длинную, покупать короткую"), // прибыль при сужении спреда
    FLAT("Без позиции");

    private final String description;
}
