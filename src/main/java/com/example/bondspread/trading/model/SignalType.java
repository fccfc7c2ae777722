package com.example.bondspread.trading.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SignalType {
    STRONG_BUY("Сильная покупка спреда (ниже P10)"),
    BUY("Покупка спреда (ниже P25)"),
    NEUTRAL("Нейтрально"),
    SELL("Продажа спреда (выше P75)"),
    STRONG_SELL("Сильная продажа спреда (выше P90)"),
    NO_DATA("Недостаточно данных");

    private final String description;
}
