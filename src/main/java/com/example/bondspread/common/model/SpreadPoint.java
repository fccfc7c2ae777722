package com.example.bondspread.common.model;

import lombok.Value;

import java.time.LocalDateTime;

@Value(staticConstructor = "of")
public class SpreadPoint {
    LocalDateTime timestamp;
    Double spreadBp;
}
