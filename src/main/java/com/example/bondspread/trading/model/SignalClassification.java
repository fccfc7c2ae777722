package com.example.bondspread.trading.model;

import lombok.Value;

@Value(staticConstructor = "of")
public class SignalClassification {
    SignalType signalType;
    SignalDirection direction;
    double confidence;
}
