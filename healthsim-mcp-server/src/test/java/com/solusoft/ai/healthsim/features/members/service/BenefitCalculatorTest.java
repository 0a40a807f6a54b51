package com.solusoft.ai.healthsim.features.members.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.features.members.model.Accumulator;
import com.solusoft.ai.healthsim.features.members.model.BenefitResult;
import com.solusoft.ai.healthsim.features.members.model.ClaimLine;
import com.solusoft.ai.healthsim.features.members.model.Plan;

public class BenefitCalculatorTest {

    private final BenefitCalculator calculator = new BenefitCalculator();
    private final Plan gold = PlanCatalog.get("PPO-GOLD");

    private static Map<String, Accumulator> accumulators(Plan plan, String deductibleUsed, String oopUsed) {
        Map<String, Accumulator> map = new LinkedHashMap<>();
        map.put(Accumulator.DEDUCTIBLE, new Accumulator(Accumulator.DEDUCTIBLE, plan.deductibleIndividual(), new BigDecimal(deductibleUsed)));
        map.put(Accumulator.OUT_OF_POCKET, new Accumulator(Accumulator.OUT_OF_POCKET, plan.oopMaxIndividual(), new BigDecimal(oopUsed)));
        return map;
    }

    private static ClaimLine line(String cpt, String allowed) {
        return ClaimLine.unadjudicated(1, cpt, 1, new BigDecimal(allowed).multiply(BigDecimal.valueOf(2)), new BigDecimal(allowed));
    }

    @Test
    public void testOfficeVisit_takesCopayWithoutDeductible() {
        Map<String, Accumulator> acc = accumulators(gold, "0", "0");

        BenefitResult result = calculator.adjudicate(List.of(line("99213", "80.00")), gold, acc);

        assertEquals(new BigDecimal("20.00"), result.copay());
        assertEquals(0, result.deductible().signum());
        assertEquals(new BigDecimal("60.00"), result.paid());
        assertEquals(0, acc.get(Accumulator.DEDUCTIBLE).getUsed().signum());
        assertEquals(0, new BigDecimal("20.00").compareTo(acc.get(Accumulator.OUT_OF_POCKET).getUsed()));
    }

    @Test
    public void testEmergencyVisit_takesErCopay() {
        BenefitResult result = calculator.adjudicate(List.of(line("99285", "400.00")), gold, accumulators(gold, "0", "0"));

        assertEquals(0, new BigDecimal("150.00").compareTo(result.copay()));
    }

    @Test
    public void testProcedure_deductibleThenCoinsurance() {
        Map<String, Accumulator> acc = accumulators(gold, "0", "0");

        BenefitResult result = calculator.adjudicate(List.of(line("73721", "1000.00")), gold, acc);

        assertEquals(0, new BigDecimal("500").compareTo(result.deductible()));
        assertEquals(new BigDecimal("100.00"), result.coinsurance());
        assertEquals(0, new BigDecimal("400.00").compareTo(result.paid()));
        assertEquals(0, acc.get(Accumulator.DEDUCTIBLE).remaining().signum());
        assertEquals(0, new BigDecimal("600.00").compareTo(acc.get(Accumulator.OUT_OF_POCKET).getUsed()));
    }

    @Test
    public void testOutOfPocketCap_trimsCoinsuranceThenDeductible() {
        Map<String, Accumulator> acc = accumulators(gold, "0", "2950.00");

        BenefitResult result = calculator.adjudicate(List.of(line("73721", "1000.00")), gold, acc);

        assertEquals(0, result.coinsurance().signum());
        assertEquals(0, new BigDecimal("50.00").compareTo(result.deductible()));
        assertEquals(0, new BigDecimal("50.00").compareTo(result.patientResponsibility()));
        assertEquals(0, new BigDecimal("950.00").compareTo(result.paid()));
        assertEquals(0, acc.get(Accumulator.OUT_OF_POCKET).remaining().signum());
    }

    @Test
    public void testHdhp_officeVisitGoesToDeductible() {
        Plan hdhp = PlanCatalog.get("HDHP-HSA");

        BenefitResult result = calculator.adjudicate(List.of(line("99214", "150.00")), hdhp, accumulators(hdhp, "0", "0"));

        assertEquals(0, result.copay().signum());
        assertEquals(0, new BigDecimal("150.00").compareTo(result.deductible()));
        assertEquals(0, result.paid().signum());
    }

    @Test
    public void testLineTotals_matchSummary() {
        List<ClaimLine> lines = List.of(
                ClaimLine.unadjudicated(1, "99213", 1, new BigDecimal("150.00"), new BigDecimal("90.00")),
                ClaimLine.unadjudicated(2, "80053", 1, new BigDecimal("60.00"), new BigDecimal("40.00")));

        BenefitResult result = calculator.adjudicate(lines, gold, accumulators(gold, "480.00", "600.00"));

        BigDecimal paid = result.lines().stream().map(ClaimLine::paid).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, paid.compareTo(result.paid()));
        assertEquals(0, result.allowed().compareTo(result.paid().add(result.patientResponsibility())));
        // 20 remaining deductible, then 20% of the other 20
        assertEquals(0, new BigDecimal("20.00").compareTo(result.lines().get(1).deductible()));
        assertEquals(new BigDecimal("4.00"), result.lines().get(1).coinsurance());
    }
}
