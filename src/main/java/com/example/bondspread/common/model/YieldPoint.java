package com.example.bondspread.common.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Точка входного ряда: доходность в % или чистая цена
 */
@Value(staticConstructor = "of")
public class YieldPoint {
    LocalDateTime timestamp;
    Double value;
}
