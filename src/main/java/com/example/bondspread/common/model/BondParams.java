package com.example.bondspread.common.model;

import com.example.bondspread.common.exceptions.InvalidBondParamsException;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Статические параметры облигации с фиксированным купоном и погашением в конце срока.
 * Создаётся один раз на инструмент и не изменяется.
 */
@Value
public class BondParams {

    public static final double DEFAULT_FACE_VALUE = 1000.0;
    public static final int DEFAULT_COUPON_FREQUENCY = 2;
    public static final int MAX_COUPON_FREQUENCY = 365;

    String isin;
    String name;
    double faceValue;
    double couponRate; // % годовых
    int couponFrequency; // купонов в год
    LocalDate maturityDate;
    LocalDate issueDate;
    DayCountBasis dayCountBasis;
    Double accruedInterest; // явно заданный НКД, иначе null

    @Builder(toBuilder = true)
    private BondParams(String isin,
                       String name,
                       Double faceValue,
                       Double couponRate,
                       Integer couponFrequency,
                       LocalDate maturityDate,
                       LocalDate issueDate,
                       DayCountBasis dayCountBasis,
                       Double accruedInterest) {
        if (isin == null || isin.isBlank()) {
            throw new InvalidBondParamsException(null, "ISIN не задан");
        }
        this.isin = isin;
        this.name = name != null && !name.isBlank() ? name : isin;
        this.faceValue = faceValue != null ? faceValue : DEFAULT_FACE_VALUE;
        this.couponRate = couponRate != null ? couponRate : 0.0;
        this.couponFrequency = couponFrequency != null ? couponFrequency : DEFAULT_COUPON_FREQUENCY;
        this.maturityDate = maturityDate;
        this.issueDate = issueDate;
        this.dayCountBasis = dayCountBasis != null ? dayCountBasis : DayCountBasis.ACT_ACT;
        this.accruedInterest = accruedInterest;
        validate();
    }

    private void validate() {
        if (!(faceValue > 0) || Double.isInfinite(faceValue)) {
            throw new InvalidBondParamsException(isin, "номинал должен быть положительным: " + faceValue);
        }
        if (couponRate < 0 || !Double.isFinite(couponRate)) {
            throw new InvalidBondParamsException(isin, "ставка купона не может быть отрицательной: " + couponRate);
        }
        if (couponFrequency <= 0 || couponFrequency > MAX_COUPON_FREQUENCY) {
            throw new InvalidBondParamsException(isin, "частота купонов вне [1, 365]: " + couponFrequency);
        }
        if (maturityDate == null) {
            throw new InvalidBondParamsException(isin, "дата погашения не задана");
        }
        if (issueDate != null && !issueDate.isBefore(maturityDate)) {
            throw new InvalidBondParamsException(isin, "дата размещения не раньше даты погашения");
        }
        if (accruedInterest != null && (accruedInterest < 0 || !Double.isFinite(accruedInterest))) {
            throw new InvalidBondParamsException(isin, "НКД не может быть отрицательным: " + accruedInterest);
        }
    }

    public Optional<Double> getAccruedInterestOverride() {
        return Optional.ofNullable(accruedInterest);
    }
}
