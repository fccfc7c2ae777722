package com.example.bondspread.core.services;

import com.example.bondspread.calculators.YearFractionCalculator;
import com.example.bondspread.common.model.BondMetrics;
import com.example.bondspread.common.model.BondParams;
import com.example.bondspread.common.model.CashFlow;
import com.example.bondspread.common.utils.NumberUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;
import org.apache.commons.math3.analysis.differentiation.UnivariateDifferentiableFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.NewtonRaphsonSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.NoBracketingException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Доходность к погашению, цена из доходности, дюрация и выпуклость.
 * Все доли года считаются по Actual/365.25.
 * Чистая и грязная цена связаны через явно заданный НКД облигации (см. pricingAccrued).
 * Пустой Optional означает, что инструмент нельзя оценить на эту дату.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class YtmService {

    static final double YTM_LOWER_BOUND = 0.1;
    static final double YTM_UPPER_BOUND = 50.0;
    static final double NEWTON_INITIAL_GUESS = 7.0;

    private static final int MAX_EVALUATIONS = 200;
    private static final double ABSOLUTE_ACCURACY = 1e-10;
    private static final double PRICE_TOLERANCE = 1e-6;

    private final CashFlowService cashFlowService;

    /**
     * Чистая цена в % от номинала (4 знака) для заданной доходности
     */
    public Optional<Double> priceFromYtm(double ytm, BondParams params, LocalDate settlement) {
        List<CashFlow> cashFlows = cashFlowService.generateCashFlows(params, settlement);
        if (cashFlows.isEmpty()) {
            return Optional.empty();
        }
        double dirtyPrice = presentValue(ytm, cashFlows, settlement);
        if (!Double.isFinite(dirtyPrice)) {
            return Optional.empty();
        }
        return Optional.of(NumberUtil.round((dirtyPrice - pricingAccrued(params)) / params.getFaceValue() * 100, 4));
    }

    /**
     * YTM в % годовых из цены. Цена до 100 включительно считается процентом от номинала,
     * больше 100 - суммой в валюте номинала.
     */
    public Optional<Double> calculateYtm(double price, BondParams params, LocalDate settlement, boolean dirtyPrice) {
        double amount = price <= 100 ? price * params.getFaceValue() / 100 : price;
        return calculateYtmFromAbsolutePrice(amount, params, settlement, dirtyPrice);
    }

    public Optional<Double> calculateYtm(double price, BondParams params, LocalDate settlement) {
        return calculateYtm(price, params, settlement, false);
    }

    /**
     * YTM из цены в валюте номинала, без эвристики процента от номинала
     */
    public Optional<Double> calculateYtmFromAbsolutePrice(double amount,
                                                          BondParams params,
                                                          LocalDate settlement,
                                                          boolean dirtyPrice) {
        if (!(amount > 0) || Double.isInfinite(amount)) {
            log.debug("{}: некорректная цена {}", params.getIsin(), amount);
            return Optional.empty();
        }
        List<CashFlow> cashFlows = cashFlowService.generateCashFlows(params, settlement);
        if (cashFlows.isEmpty()) {
            log.debug("{}: дата расчёта {} не раньше погашения {}", params.getIsin(), settlement, params.getMaturityDate());
            return Optional.empty();
        }

        double target = dirtyPrice ? amount : amount + pricingAccrued(params);
        PresentValueFunction npv = new PresentValueFunction(cashFlows, settlement, target);

        Optional<Double> ytm = solveBrent(npv, params.getIsin());
        if (ytm.isEmpty()) {
            ytm = solveNewton(npv, params.getIsin());
        }
        return ytm.map(y -> NumberUtil.round(y, 4));
    }

    /**
     * Приблизительная доходность: (C + (F - P) / n) / ((F + P) / 2)
     */
    public double calculateYtmSimple(double pricePercent, BondParams params, LocalDate settlement) {
        double yearsToMaturity = YearFractionCalculator.yearFraction(settlement, params.getMaturityDate());
        if (yearsToMaturity <= 0) {
            return params.getCouponRate();
        }
        double face = params.getFaceValue();
        double annualCoupon = face * params.getCouponRate() / 100;
        double priceAbs = pricePercent * face / 100;

        double numerator = annualCoupon + (face - priceAbs) / yearsToMaturity;
        double denominator = (face + priceAbs) / 2;
        return NumberUtil.round(numerator / denominator * 100, 2);
    }

    /**
     * Дюрация Маколея в годах
     */
    public Optional<Double> macaulayDuration(double ytm, BondParams params, LocalDate settlement) {
        List<CashFlow> cashFlows = cashFlowService.generateCashFlows(params, settlement);
        if (cashFlows.isEmpty()) {
            return Optional.empty();
        }
        double price = 0.0;
        double weightedTime = 0.0;
        for (CashFlow cf : cashFlows) {
            double years = YearFractionCalculator.yearFraction(settlement, cf.getDate());
            double pv = cf.getAmount() / Math.pow(1 + ytm / 100, years);
            price += pv;
            weightedTime += pv * years;
        }
        if (!(price > 0) || !Double.isFinite(weightedTime)) {
            return Optional.empty();
        }
        return Optional.of(NumberUtil.round(weightedTime / price, 4));
    }

    public Optional<Double> modifiedDuration(double ytm, BondParams params, LocalDate settlement) {
        return macaulayDuration(ytm, params, settlement)
                .map(duration -> NumberUtil.round(duration / (1 + ytm / 100), 4));
    }

    public Optional<Double> convexity(double ytm, BondParams params, LocalDate settlement) {
        List<CashFlow> cashFlows = cashFlowService.generateCashFlows(params, settlement);
        if (cashFlows.isEmpty()) {
            return Optional.empty();
        }
        double price = 0.0;
        double weighted = 0.0;
        for (CashFlow cf : cashFlows) {
            double years = YearFractionCalculator.yearFraction(settlement, cf.getDate());
            double pv = cf.getAmount() / Math.pow(1 + ytm / 100, years);
            price += pv;
            weighted += pv * years * (years + 1);
        }
        if (!(price > 0) || !Double.isFinite(weighted)) {
            return Optional.empty();
        }
        double base = 1 + ytm / 100;
        return Optional.of(NumberUtil.round(weighted / (price * base * base), 4));
    }

    /**
     * НКД в валюте номинала. Если не задан явно - половина купона за период
     * (упрощение: дата расчёта считается серединой купонного периода).
     */
    public Optional<Double> accruedInterest(BondParams params, LocalDate settlement) {
        if (!settlement.isBefore(params.getMaturityDate())) {
            return Optional.empty();
        }
        if (params.getAccruedInterest() != null) {
            return Optional.of(params.getAccruedInterest());
        }
        return Optional.of(NumberUtil.round(cashFlowService.couponPerPeriod(params) / 2, 2));
    }

    /**
     * НКД для перехода между чистой и грязной ценой: только явно заданный, иначе 0.
     * Приближение половиной купона здесь не используется.
     */
    double pricingAccrued(BondParams params) {
        return params.getAccruedInterestOverride().orElse(0.0);
    }

    /**
     * Сводные метрики облигации по чистой цене в % от номинала
     */
    public Optional<BondMetrics> analyze(double pricePercent, BondParams params, LocalDate settlement) {
        Optional<Double> ytm = calculateYtmFromAbsolutePrice(
                pricePercent * params.getFaceValue() / 100, params, settlement, false);
        if (ytm.isEmpty()) {
            return Optional.empty();
        }
        double y = ytm.get();
        Optional<Double> duration = macaulayDuration(y, params, settlement);
        Optional<Double> modified = modifiedDuration(y, params, settlement);
        Optional<Double> convexity = convexity(y, params, settlement);
        if (duration.isEmpty() || modified.isEmpty() || convexity.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(BondMetrics.builder()
                .isin(params.getIsin())
                .settlementDate(settlement)
                .ytm(y)
                .cleanPricePercent(pricePercent)
                .accruedInterest(accruedInterest(params, settlement).orElse(0.0))
                .macaulayDuration(duration.get())
                .modifiedDuration(modified.get())
                .convexity(convexity.get())
                .build());
    }

    private Optional<Double> solveBrent(PresentValueFunction npv, String isin) {
        try {
            double ytm = new BrentSolver(ABSOLUTE_ACCURACY)
                    .solve(MAX_EVALUATIONS, npv, YTM_LOWER_BOUND, YTM_UPPER_BOUND);
            return Optional.of(ytm);
        } catch (NoBracketingException e) {
            log.debug("{}: корень вне [{}, {}], переходим к методу Ньютона", isin, YTM_LOWER_BOUND, YTM_UPPER_BOUND);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            log.debug("{}: метод Брента не сошёлся: {}", isin, e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<Double> solveNewton(PresentValueFunction npv, String isin) {
        try {
            double ytm = new NewtonRaphsonSolver(ABSOLUTE_ACCURACY)
                    .solve(MAX_EVALUATIONS, npv, -YTM_UPPER_BOUND, 10 * YTM_UPPER_BOUND, NEWTON_INITIAL_GUESS);
            if (Double.isFinite(ytm) && ytm > -100 && Math.abs(npv.value(ytm)) <= PRICE_TOLERANCE * npv.target) {
                return Optional.of(ytm);
            }
            log.debug("{}: метод Ньютона дал некорректный корень {}", isin, ytm);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            log.debug("{}: метод Ньютона не сошёлся: {}", isin, e.getMessage());
        }
        return Optional.empty();
    }

    private static double presentValue(double ytm, List<CashFlow> cashFlows, LocalDate settlement) {
        double price = 0.0;
        for (CashFlow cf : cashFlows) {
            double years = YearFractionCalculator.yearFraction(settlement, cf.getDate());
            price += cf.getAmount() / Math.pow(1 + ytm / 100, years);
        }
        return price;
    }

    /**
     * NPV(y) - целевая грязная цена; y в % годовых
     */
    private static final class PresentValueFunction implements UnivariateDifferentiableFunction {
        private final double[] amounts;
        private final double[] years;
        private final double target;

        PresentValueFunction(List<CashFlow> cashFlows, LocalDate settlement, double target) {
            this.amounts = new double[cashFlows.size()];
            this.years = new double[cashFlows.size()];
            for (int i = 0; i < cashFlows.size(); i++) {
                amounts[i] = cashFlows.get(i).getAmount();
                years[i] = YearFractionCalculator.yearFraction(settlement, cashFlows.get(i).getDate());
            }
            this.target = target;
        }

        @Override
        public double value(double ytm) {
            double base = 1 + ytm / 100;
            double npv = 0.0;
            for (int i = 0; i < amounts.length; i++) {
                npv += amounts[i] / Math.pow(base, years[i]);
            }
            return npv - target;
        }

        @Override
        public DerivativeStructure value(DerivativeStructure ytm) {
            DerivativeStructure base = ytm.divide(100).add(1);
            DerivativeStructure npv = ytm.getField().getZero();
            for (int i = 0; i < amounts.length; i++) {
                npv = npv.add(base.pow(-years[i]).multiply(amounts[i]));
            }
            return npv.subtract(target);
        }
    }
}
