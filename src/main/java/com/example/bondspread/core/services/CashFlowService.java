package com.example.bondspread.core.services;

import com.example.bondspread.common.model.BondParams;
import com.example.bondspread.common.model.CashFlow;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * График купонов и погашения облигации с фиксированным купоном
 */
@Service
public class CashFlowService {

    private static final int MONTHS_IN_YEAR = 12;
    private static final int DAYS_IN_YEAR = 365;

    /**
     * Денежные потоки строго после даты расчёта, по возрастанию дат.
     * Последний поток = купон + номинал. Пусто, если дата расчёта не раньше погашения.
     */
    public List<CashFlow> generateCashFlows(BondParams params, LocalDate settlement) {
        LocalDate maturity = params.getMaturityDate();
        if (!settlement.isBefore(maturity)) {
            return List.of();
        }

        double coupon = couponPerPeriod(params);

        // Идём от погашения назад на один купонный период
        List<LocalDate> couponDates = new ArrayList<>();
        int step = 0;
        LocalDate couponDate = maturity;
        while (couponDate.isAfter(settlement)) {
            couponDates.add(couponDate);
            step++;
            couponDate = shiftBack(params, maturity, step);
        }
        Collections.reverse(couponDates);

        List<CashFlow> cashFlows = new ArrayList<>(couponDates.size());
        for (int i = 0; i < couponDates.size() - 1; i++) {
            cashFlows.add(new CashFlow(couponDates.get(i), coupon));
        }
        cashFlows.add(new CashFlow(couponDates.get(couponDates.size() - 1), coupon + params.getFaceValue()));
        return List.copyOf(cashFlows);
    }

    public double couponPerPeriod(BondParams params) {
        return params.getFaceValue() * params.getCouponRate() / 100 / params.getCouponFrequency();
    }

    /**
     * Приблизительная длина купонного периода в днях
     */
    public int periodDays(BondParams params) {
        return DAYS_IN_YEAR / params.getCouponFrequency();
    }

    // Смещение считается от даты погашения, чтобы не накапливать сдвиг дня месяца
    private LocalDate shiftBack(BondParams params, LocalDate maturity, int periods) {
        int frequency = params.getCouponFrequency();
        if (frequency <= MONTHS_IN_YEAR && MONTHS_IN_YEAR % frequency == 0) {
            return maturity.minusMonths((long) periods * (MONTHS_IN_YEAR / frequency));
        }
        return maturity.minusDays((long) periods * periodDays(params));
    }
}
