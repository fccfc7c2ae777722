package com.example.bondspread.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Позиция по спреду в бэктесте. Изменяется только пока OPEN, после закрытия неизменна.
 */
@Getter
@ToString
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Position {

    private final String pairName;
    private final SignalDirection direction;
    private final LocalDate entryDate;
    private final double entrySpread;
    private final Double entryYtmLong;
    private final Double entryYtmShort;
    private final double size; // размер позиции в рублях
    private final double stopLossBp;
    private final double takeProfitBp;

    @Builder.Default
    private PositionState state = PositionState.OPEN;
    private LocalDate exitDate;
    private Double exitSpread;
    private Double exitYtmLong;
    private Double exitYtmShort;
    private double pnlBp;
    private double pnlRub;
    private int holdingDays;
    private ExitReasonType exitReason;

    /**
     * Переоценка открытой позиции по текущему спреду
     */
    public void markToMarket(double currentSpread, LocalDate currentDate) {
        requireOpen();
        double spreadChange = currentSpread - entrySpread;
        this.pnlBp = direction == SignalDirection.LONG_SHORT ? spreadChange : -spreadChange;
        this.holdingDays = (int) ChronoUnit.DAYS.between(entryDate, currentDate);
    }

    public void close(ExitReasonType reason,
                      LocalDate date,
                      double spread,
                      Double ytmLong,
                      Double ytmShort,
                      double finalPnlBp,
                      double finalPnlRub) {
        requireOpen();
        this.state = reason.getState();
        this.exitReason = reason;
        this.exitDate = date;
        this.exitSpread = spread;
        this.exitYtmLong = ytmLong;
        this.exitYtmShort = ytmShort;
        this.pnlBp = finalPnlBp;
        this.pnlRub = finalPnlRub;
    }

    @JsonIgnore
    public boolean isOpen() {
        return state == PositionState.OPEN;
    }

    @JsonIgnore
    public boolean isWinning() {
        return pnlBp > 0;
    }

    private void requireOpen() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Позиция " + pairName + " уже закрыта: " + state);
        }
    }
}
