package com.example.bondspread.common.model;

import com.example.bondspread.common.utils.NumberUtil;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Наблюдение пары: доходности длинной и короткой облигации и спред между ними в б.п.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SpreadObservation {
    LocalDateTime timestamp;
    Double ytmLong;
    Double ytmShort;
    Double spreadBp;

    public static SpreadObservation of(LocalDateTime timestamp, double ytmLong, double ytmShort) {
        return new SpreadObservation(timestamp, ytmLong, ytmShort, NumberUtil.round((ytmLong - ytmShort) * 100, 2));
    }

    /**
     * Наблюдение только со спредом, без исходных доходностей
     */
    public static SpreadObservation ofSpread(LocalDateTime timestamp, Double spreadBp) {
        return new SpreadObservation(timestamp, null, null, spreadBp);
    }

    public LocalDate getDate() {
        return timestamp.toLocalDate();
    }
}
