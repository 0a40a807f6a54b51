package com.solusoft.ai.healthsim.features.members.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.solusoft.ai.healthsim.features.members.model.Accumulator;
import com.solusoft.ai.healthsim.features.members.model.BenefitResult;
import com.solusoft.ai.healthsim.features.members.model.ClaimLine;
import com.solusoft.ai.healthsim.features.members.model.Plan;
import com.solusoft.ai.healthsim.features.members.model.PlanType;

/**
 * Applies a plan's cost sharing to professional claim lines and advances the member's accumulators.
 * <p>
 * Office visits (CPT 992xx) take the PCP copay and emergency visits (9928x) the ER copay, with no
 * deductible, except on HDHP plans where every service goes through the deductible. Other services
 * consume the remaining deductible and then coinsurance. The patient share of each line is capped by
 * what remains of the out-of-pocket maximum.
 */
public class BenefitCalculator {

    public BenefitResult adjudicate(List<ClaimLine> lines, Plan plan, Map<String, Accumulator> accumulators) {
        Accumulator deductible = accumulators.get(Accumulator.DEDUCTIBLE);
        Accumulator outOfPocket = accumulators.get(Accumulator.OUT_OF_POCKET);

        List<ClaimLine> adjudicated = new ArrayList<>();
        BigDecimal totalAllowed = BigDecimal.ZERO;
        BigDecimal totalPaid = BigDecimal.ZERO;
        BigDecimal totalDeductible = BigDecimal.ZERO;
        BigDecimal totalCopay = BigDecimal.ZERO;
        BigDecimal totalCoinsurance = BigDecimal.ZERO;

        for (ClaimLine line : lines) {
            BigDecimal allowed = line.allowed();
            BigDecimal copay = BigDecimal.ZERO;
            BigDecimal deductiblePart = BigDecimal.ZERO;
            BigDecimal coinsurance = BigDecimal.ZERO;

            BigDecimal visitCopay = copayFor(line.cptCode(), plan);
            if (visitCopay != null) {
                copay = visitCopay.min(allowed);
            } else {
                deductiblePart = allowed.min(deductible.remaining());
                coinsurance = allowed.subtract(deductiblePart)
                        .multiply(BigDecimal.valueOf(plan.coinsurancePercent()))
                        .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
            }

            // out-of-pocket cap: trim coinsurance first, then copay, then deductible
            BigDecimal room = outOfPocket.remaining();
            BigDecimal excess = deductiblePart.add(copay).add(coinsurance).subtract(room);
            if (excess.signum() > 0) {
                BigDecimal cut = excess.min(coinsurance);
                coinsurance = coinsurance.subtract(cut);
                excess = excess.subtract(cut);
                cut = excess.min(copay);
                copay = copay.subtract(cut);
                excess = excess.subtract(cut);
                deductiblePart = deductiblePart.subtract(excess.min(deductiblePart));
            }

            deductible.apply(deductiblePart);
            BigDecimal patientShare = deductiblePart.add(copay).add(coinsurance);
            outOfPocket.apply(patientShare);
            BigDecimal paid = allowed.subtract(patientShare);

            adjudicated.add(new ClaimLine(line.lineNumber(), line.cptCode(), line.units(), line.charge(), allowed,
                    paid, deductiblePart, copay, coinsurance));
            totalAllowed = totalAllowed.add(allowed);
            totalPaid = totalPaid.add(paid);
            totalDeductible = totalDeductible.add(deductiblePart);
            totalCopay = totalCopay.add(copay);
            totalCoinsurance = totalCoinsurance.add(coinsurance);
        }
        return new BenefitResult(adjudicated, totalAllowed, totalPaid, totalDeductible, totalCopay, totalCoinsurance);
    }

    /** Copay for visit codes, or null when the service goes through deductible/coinsurance. */
    static BigDecimal copayFor(String cptCode, Plan plan) {
        if (plan.planType() == PlanType.HDHP || cptCode == null || !cptCode.startsWith("992")) {
            return null;
        }
        return cptCode.startsWith("9928") ? plan.erCopay() : plan.pcpCopay();
    }
}
