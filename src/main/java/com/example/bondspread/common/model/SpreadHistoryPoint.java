package com.example.bondspread.common.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Строка истории спреда со скользящими средними и стандартными отклонениями (NaN пока окно не заполнено)
 */
@Value
@Builder
public class SpreadHistoryPoint {
    LocalDateTime timestamp;
    double spreadBp;
    double ytmLong;
    double ytmShort;
    double spreadMean20;
    double spreadStd20;
    double spreadMean60;
    double spreadStd60;
}
