package com.example.bondspread.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Торговый сигнал по паре облигаций. Создаётся на каждую оценку и не изменяется.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradingSignal {
    String pairName;
    String bondLong; // ISIN длинной облигации
    String bondShort; // ISIN короткой облигации
    SignalType signalType;
    SignalDirection direction;
    double confidence; // 0..1, три знака
    double spreadBp;
    double spreadMean;
    double spreadZscore;
    double percentileRank;
    double expectedReturnBp;
    LocalDateTime timestamp;
    LocalDateTime expiresAt;

    @JsonIgnore
    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    @JsonIgnore
    public boolean isActionable() {
        return signalType != SignalType.NO_DATA && signalType != SignalType.NEUTRAL;
    }
}
