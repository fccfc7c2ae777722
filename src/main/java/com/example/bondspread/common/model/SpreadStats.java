package com.example.bondspread.common.model;

import lombok.Builder;
import lombok.Value;

/**
 * Снимок статистики спреда по скользящему окну
 */
@Value
@Builder
public class SpreadStats {
    double current;
    double mean;
    double std;
    double min;
    double max;
    double percentile10;
    double percentile25;
    double percentile50;
    double percentile75;
    double percentile90;
    double zscore;
    int lookbackDays;
}
