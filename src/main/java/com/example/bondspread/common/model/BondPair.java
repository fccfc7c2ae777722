package com.example.bondspread.common.model;

import lombok.Value;

/**
 * Пара облигаций: длинная (long) и короткая (short)
 */
@Value(staticConstructor = "of")
public class BondPair {
    String bondLong;
    String bondShort;

    public String getPairName() {
        return bondLong + "_" + bondShort;
    }

    @Override
    public String toString() {
        return getPairName();
    }
}
