package com.example.bondspread.common.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class BondMetrics {
    String isin;
    LocalDate settlementDate;
    double ytm;
    double cleanPricePercent;
    double accruedInterest;
    double macaulayDuration;
    double modifiedDuration;
    double convexity;
}
