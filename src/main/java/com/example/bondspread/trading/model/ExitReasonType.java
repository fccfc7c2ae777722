package com.example.bondspread.trading.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExitReasonType {
    STOP_LOSS(PositionState.STOPPED, "Выход по стопу"),
    TAKE_PROFIT(PositionState.TAKEN, "Выход по тейку"),
    MEAN_REVERSION(PositionState.CLOSED, "Выход по возврату к медиане"),
    MAX_HOLDING(PositionState.CLOSED, "Выход по времени удержания");

    private final PositionState state;
    private final String description;
}
