package com.example.bondspread.core.services;

import com.example.bondspread.common.model.BondParams;
import com.example.bondspread.common.model.CashFlow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CashFlowServiceTest {

    private final CashFlowService cashFlowService = new CashFlowService();

    private final BondParams ofz26207 = BondParams.builder()
            .isin("SU26207RMFS9")
            .name("ОФЗ-ПД 26207")
            .couponRate(8.15)
            .couponFrequency(2)
            .maturityDate(LocalDate.of(2027, 2, 3))
            .build();

    @Test
    void testSemiAnnualSchedule() {
        List<CashFlow> flows = cashFlowService.generateCashFlows(ofz26207, LocalDate.of(2025, 2, 27));

        assertEquals(4, flows.size());
        assertEquals(LocalDate.of(2025, 8, 3), flows.get(0).getDate());
        assertEquals(LocalDate.of(2026, 2, 3), flows.get(1).getDate());
        assertEquals(LocalDate.of(2026, 8, 3), flows.get(2).getDate());
        assertEquals(LocalDate.of(2027, 2, 3), flows.get(3).getDate());

        assertEquals(40.75, flows.get(0).getAmount(), 1e-9);
        assertEquals(40.75, flows.get(2).getAmount(), 1e-9);
        // последний поток - купон + номинал
        assertEquals(1040.75, flows.get(3).getAmount(), 1e-9);
    }

    @Test
    void testDatesStrictlyIncreasingAndAfterSettlement() {
        LocalDate settlement = LocalDate.of(2026, 2, 3);
        List<CashFlow> flows = cashFlowService.generateCashFlows(ofz26207, settlement);

        // купон в дату расчёта не включается
        assertEquals(2, flows.size());
        for (int i = 0; i < flows.size(); i++) {
            assertTrue(flows.get(i).getDate().isAfter(settlement));
            if (i > 0) {
                assertTrue(flows.get(i).getDate().isAfter(flows.get(i - 1).getDate()));
            }
        }
    }

    @Test
    void testEmptyAtOrAfterMaturity() {
        assertTrue(cashFlowService.generateCashFlows(ofz26207, LocalDate.of(2027, 2, 3)).isEmpty());
        assertTrue(cashFlowService.generateCashFlows(ofz26207, LocalDate.of(2028, 1, 1)).isEmpty());
    }

    @Test
    void testSingleFlowBeforeMaturity() {
        List<CashFlow> flows = cashFlowService.generateCashFlows(ofz26207, LocalDate.of(2027, 1, 20));

        assertEquals(1, flows.size());
        assertEquals(1040.75, flows.get(0).getAmount(), 1e-9);
    }

    @Test
    void testMonthEndMaturityDoesNotDrift() {
        BondParams params = ofz26207.toBuilder()
                .isin("TEST")
                .maturityDate(LocalDate.of(2027, 8, 31))
                .build();

        List<CashFlow> flows = cashFlowService.generateCashFlows(params, LocalDate.of(2026, 1, 1));

        assertEquals(List.of(LocalDate.of(2026, 2, 28), LocalDate.of(2026, 8, 31),
                        LocalDate.of(2027, 2, 28), LocalDate.of(2027, 8, 31)),
                flows.stream().map(CashFlow::getDate).toList());
    }

    @Test
    void testNonMonthlyFrequencyUsesDays() {
        BondParams params = ofz26207.toBuilder()
                .isin("TEST")
                .couponFrequency(5)
                .maturityDate(LocalDate.of(2026, 1, 1))
                .build();

        List<CashFlow> flows = cashFlowService.generateCashFlows(params, LocalDate.of(2025, 6, 1));

        assertEquals(73, cashFlowService.periodDays(params));
        assertEquals(LocalDate.of(2026, 1, 1).minusDays(73), flows.get(flows.size() - 2).getDate());
        assertEquals(16.3, cashFlowService.couponPerPeriod(params), 1e-9);
    }
}
