package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimResponse;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimStatusCode;
import com.solusoft.ai.healthsim.features.pharmacy.model.CurrentMedication;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlert;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurResult;
import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaim;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;
import com.solusoft.ai.healthsim.features.pharmacy.model.Reject;
import com.solusoft.ai.healthsim.features.pharmacy.model.RejectCode;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;
import com.solusoft.ai.healthsim.features.pharmacy.model.TierCostShare;
import com.solusoft.ai.healthsim.features.pharmacy.model.TransactionCode;

import lombok.extern.slf4j.Slf4j;

/**
 * Adjudicates NCPDP billing, reversal and rebill transactions against a formulary.
 * <p>
 * Billing runs eligibility, duplicate, coverage, prior authorization, step therapy, quantity limit,
 * refill-too-soon and DUR checks in that order, then prices the claim and updates the member's
 * deductible and out-of-pocket accumulators. The first failing check rejects the claim.
 */
@Slf4j
public class AdjudicationEngine {

    static final int MAX_DAYS_SUPPLY = 90;
    private static final int STEP_THERAPY_LOOKBACK_DAYS = 365;

    private final Formulary formulary;
    private final DurValidator durValidator;
    private final ClaimHistory claimHistory;
    private final PriorAuthorizationLedger priorAuthLedger;
    private final AdjudicationSettings settings;
    private final AtomicLong authSequence;

    public AdjudicationEngine(Formulary formulary) {
        this(formulary, new DurValidator(formulary), new InMemoryClaimHistory(),
                new InMemoryPriorAuthorizationLedger(), AdjudicationSettings.defaults());
    }

    public AdjudicationEngine(Formulary formulary, DurValidator durValidator, ClaimHistory claimHistory,
            PriorAuthorizationLedger priorAuthLedger, AdjudicationSettings settings) {
        this.formulary = formulary;
        this.durValidator = durValidator;
        this.claimHistory = claimHistory;
        this.priorAuthLedger = priorAuthLedger;
        this.settings = settings;
        // Continue after the highest number on record so a persistent history never sees a repeat
        this.authSequence = new AtomicLong(claimHistory.lastAuthorizationSequence());
    }

    public Formulary formulary() {
        return formulary;
    }

    public ClaimHistory claimHistory() {
        return claimHistory;
    }

    public synchronized ClaimResponse adjudicate(PharmacyClaim claim, RxMember member) {
        if (claim == null || member == null) {
            throw new InvalidRequestException("Claim and member are required");
        }
        TransactionCode code = claim.transactionCode() == null ? TransactionCode.B1 : claim.transactionCode();
        switch (code) {
            case B2:
                return reverse(claim, member);
            case B3:
                return rebill(claim, member);
            case B1:
            default:
                return bill(claim, member, TransactionCode.B1);
        }
    }

    /**
     * Reverses the paid claim matching pharmacy, Rx number, fill number and date of service,
     * returning the amounts it charged to the member's accumulators.
     */
    public synchronized ClaimResponse reverse(PharmacyClaim claim, RxMember member) {
        Optional<PharmacyClaimRecord> original = claim.serviceDate() == null || isBlank(claim.pharmacyNpi())
                || isBlank(claim.prescriptionNumber()) ? Optional.empty()
                : claimHistory.findPaid(claim.pharmacyNpi(), claim.prescriptionNumber(), claim.fillNumber(),
                        claim.serviceDate());
        if (original.isEmpty() || !original.get().memberId().equals(member.getMemberId())) {
            log.info("Reversal rejected: no paid claim for Rx {} fill {} on {}",
                    claim.prescriptionNumber(), claim.fillNumber(), claim.serviceDate());
            return rejected(claim, TransactionCode.B2, member,
                    List.of(Reject.of(RejectCode.REVERSAL_NOT_PROCESSED, "no matching paid claim")), List.of());
        }
        PharmacyClaimRecord paid = original.get();
        if (!claimHistory.markReversed(paid.authorizationNumber())) {
            return rejected(claim, TransactionCode.B2, member,
                    List.of(Reject.of(RejectCode.REVERSAL_NOT_PROCESSED, "claim already reversed")), List.of());
        }
        member.setDeductibleMet(member.getDeductibleMet().subtract(paid.deductibleApplied()).max(BigDecimal.ZERO));
        member.setOopMet(member.getOopMet().subtract(paid.patientPay()).max(BigDecimal.ZERO));
        log.info("Reversed claim {} for member {}", paid.authorizationNumber(), member.getMemberId());

        return ClaimResponse.builder()
                .claimId(claim.claimId())
                .transactionCode(TransactionCode.B2)
                .status(ClaimStatusCode.A)
                .authorizationNumber(paid.authorizationNumber())
                .tier(paid.tier())
                .planPaid(paid.planPaid())
                .patientPay(paid.patientPay())
                .copay(paid.copay())
                .coinsurance(paid.coinsurance())
                .deductibleApplied(paid.deductibleApplied())
                .remainingDeductible(member.getDeductibleRemaining())
                .remainingOop(member.getOopRemaining())
                .message("Reversal accepted")
                .build();
    }

    private ClaimResponse rebill(PharmacyClaim claim, RxMember member) {
        ClaimResponse reversal = reverse(claim, member);
        if (reversal.status() != ClaimStatusCode.A) {
            return reversal.toBuilder().transactionCode(TransactionCode.B3).build();
        }
        return bill(claim, member, TransactionCode.B3);
    }

    private ClaimResponse bill(PharmacyClaim claim, RxMember member, TransactionCode code) {
        // Eligibility
        if (claim.cardholderId() == null || !claim.cardholderId().equals(member.getCardholderId())) {
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.NON_MATCHED_CARDHOLDER)), List.of());
        }
        List<Reject> rejects = new ArrayList<>();
        if (isBlank(claim.pharmacyNpi())) {
            rejects.add(Reject.of(RejectCode.MISSING_INVALID_PHARMACY_NUMBER));
        }
        if (isBlank(claim.prescriptionNumber())) {
            rejects.add(Reject.of(RejectCode.MISSING_INVALID_RX_NUMBER));
        }
        if (claim.groupNumber() == null || !claim.groupNumber().equals(member.getGroupNumber())) {
            rejects.add(Reject.of(RejectCode.MISSING_INVALID_GROUP));
        }
        if (claim.serviceDate() == null || !member.isCoveredOn(claim.serviceDate())) {
            rejects.add(Reject.of(RejectCode.PATIENT_NOT_COVERED));
        }
        if (claim.quantityDispensed() == null || claim.quantityDispensed().signum() <= 0) {
            rejects.add(Reject.of(RejectCode.MISSING_INVALID_QUANTITY));
        }
        if (claim.daysSupply() < 1 || claim.daysSupply() > MAX_DAYS_SUPPLY) {
            rejects.add(Reject.of(RejectCode.MISSING_INVALID_DAYS_SUPPLY));
        }
        if (!rejects.isEmpty()) {
            return rejected(claim, code, member, rejects, List.of());
        }

        Optional<PharmacyClaimRecord> duplicate = claimHistory.findPaid(claim.pharmacyNpi(),
                claim.prescriptionNumber(), claim.fillNumber(), claim.serviceDate());
        if (duplicate.isPresent()) {
            return duplicateOf(claim, code, duplicate.get(), member);
        }

        Optional<FormularyDrug> found = formulary.drug(claim.ndc());
        if (found.isEmpty() || !found.get().covered()) {
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.NOT_COVERED, "NDC " + claim.ndc())),
                    List.of());
        }
        FormularyDrug drug = found.get();

        if (drug.requiresPa()
                && !priorAuthLedger.isValid(claim.priorAuthNumber(), member.getMemberId(), drug, claim.serviceDate())) {
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.PRIOR_AUTH_REQUIRED, drug.name())),
                    List.of());
        }

        List<PharmacyClaimRecord> history = claimHistory.paidClaims(member.getMemberId());

        if (drug.stepTherapy() && !stepTherapyMet(drug, history, claim.serviceDate())
                && !priorAuthLedger.hasActive(member.getMemberId(), drug, claim.serviceDate())) {
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.STEP_THERAPY,
                    "requires prior fill of GPI class " + drug.stepTherapyPrerequisiteGpi())), List.of());
        }

        if (drug.hasQuantityLimit() && exceedsQuantityLimit(drug, claim)) {
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.PLAN_LIMITATIONS_EXCEEDED,
                    "quantity limit " + drug.quantityLimit() + " per " + drug.quantityLimitDays() + " days")),
                    List.of());
        }

        Optional<LocalDate> nextFill = refillTooSoon(drug, claim, history);
        if (nextFill.isPresent()) {
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.REFILL_TOO_SOON,
                    "next fill available " + nextFill.get())), List.of())
                    .toBuilder().nextFillDate(nextFill.get()).build();
        }

        DurResult dur = durValidator.validate(durRequest(claim, member, drug, history));
        boolean overridden = claim.durOverrideCode() != null && !claim.durOverrideCode().isBlank();
        boolean durReject = dur.alerts().stream().anyMatch(a -> a.severity() <= settings.durRejectSeverity());
        if (durReject && !overridden) {
            DurAlert worst = dur.alerts().stream().min(Comparator.comparingInt(DurAlert::severity)).orElseThrow();
            return rejected(claim, code, member, List.of(Reject.of(RejectCode.DUR_REJECT,
                    worst.alertType().description())), dur.alerts());
        }

        return price(claim, member, drug, code, dur.alerts());
    }

    private boolean stepTherapyMet(FormularyDrug drug, List<PharmacyClaimRecord> history, LocalDate serviceDate) {
        LocalDate lookback = serviceDate.minusDays(STEP_THERAPY_LOOKBACK_DAYS);
        return history.stream()
                .filter(r -> r.gpi() != null && r.gpi().startsWith(drug.stepTherapyPrerequisiteGpi()))
                .anyMatch(r -> !r.serviceDate().isAfter(serviceDate) && !r.serviceDate().isBefore(lookback));
    }

    private static boolean exceedsQuantityLimit(FormularyDrug drug, PharmacyClaim claim) {
        // quantity / daysSupply > limit / limitDays, cross-multiplied
        BigDecimal requested = claim.quantityDispensed().multiply(BigDecimal.valueOf(drug.quantityLimitDays()));
        BigDecimal allowed = BigDecimal.valueOf((long) drug.quantityLimit() * claim.daysSupply());
        return requested.compareTo(allowed) > 0;
    }

    private Optional<LocalDate> refillTooSoon(FormularyDrug drug, PharmacyClaim claim,
            List<PharmacyClaimRecord> history) {
        Optional<PharmacyClaimRecord> previous = history.stream()
                .filter(r -> drug.gpi().equals(r.gpi()) || drug.ndc().equals(r.ndc()))
                .filter(r -> !r.serviceDate().isAfter(claim.serviceDate()))
                .max(Comparator.comparing(PharmacyClaimRecord::serviceDate));
        if (previous.isEmpty()) {
            return Optional.empty();
        }
        PharmacyClaimRecord last = previous.get();
        long elapsed = ChronoUnit.DAYS.between(last.serviceDate(), claim.serviceDate());
        long required = (long) Math.ceil(last.daysSupply() * settings.refillThresholdPercent() / 100.0);
        if (elapsed < required) {
            return Optional.of(last.serviceDate().plusDays(required));
        }
        return Optional.empty();
    }

    private DurRequest durRequest(PharmacyClaim claim, RxMember member, FormularyDrug drug,
            List<PharmacyClaimRecord> history) {
        List<CurrentMedication> current = history.stream()
                .filter(r -> r.serviceDate().plusDays(r.daysSupply()).isAfter(claim.serviceDate()))
                .map(r -> new CurrentMedication(r.ndc(), r.gpi(), r.drugName(), r.serviceDate(), r.daysSupply()))
                .toList();
        return DurRequest.builder()
                .ndc(drug.ndc())
                .gpi(drug.gpi())
                .drugName(drug.name())
                .memberId(member.getMemberId())
                .serviceDate(claim.serviceDate())
                .currentMedications(current)
                .patientAge(member.getDemographics().ageOn(claim.serviceDate()))
                .patientGender(member.getDemographics().gender())
                .quantity(claim.quantityDispensed())
                .daysSupply(claim.daysSupply())
                .build();
    }

    private ClaimResponse price(PharmacyClaim claim, RxMember member, FormularyDrug drug, TransactionCode code,
            List<DurAlert> warnings) {
        BigDecimal ingredient = orZero(claim.ingredientCostSubmitted());
        BigDecimal fee = orZero(claim.dispensingFeeSubmitted());
        BigDecimal allowed = ingredient.add(fee);
        if (claim.usualCustomaryCharge() != null) {
            allowed = allowed.min(claim.usualCustomaryCharge());
        }
        if (claim.grossAmountDue() != null) {
            allowed = allowed.min(claim.grossAmountDue());
        }
        allowed = allowed.setScale(2, RoundingMode.HALF_UP);

        TierCostShare tier = formulary.tier(drug.tier());
        BigDecimal deductible = tier.appliesDeductible()
                ? allowed.min(member.getDeductibleRemaining())
                : BigDecimal.ZERO;
        BigDecimal remainder = allowed.subtract(deductible);
        BigDecimal copay = BigDecimal.ZERO;
        BigDecimal coinsurance = BigDecimal.ZERO;
        if (tier.isCoinsurance()) {
            coinsurance = remainder.multiply(BigDecimal.valueOf(tier.coinsurancePercent()))
                    .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
        } else {
            copay = tier.copay().min(remainder);
        }

        // Out-of-pocket cap trims coinsurance, then copay, then deductible
        BigDecimal oopRemaining = member.getOopRemaining();
        BigDecimal excess = deductible.add(copay).add(coinsurance).subtract(oopRemaining);
        if (excess.signum() > 0) {
            BigDecimal cut = excess.min(coinsurance);
            coinsurance = coinsurance.subtract(cut);
            excess = excess.subtract(cut);
            cut = excess.min(copay);
            copay = copay.subtract(cut);
            excess = excess.subtract(cut);
            deductible = deductible.subtract(excess.min(deductible));
        }
        BigDecimal patientPay = deductible.add(copay).add(coinsurance).setScale(2, RoundingMode.HALF_UP);
        BigDecimal planPaid = allowed.subtract(patientPay);

        BigDecimal feePaid = fee.min(allowed);
        BigDecimal ingredientPaid = allowed.subtract(feePaid);
        String authorization = nextAuthorization(claim.serviceDate());

        claimHistory.save(PharmacyClaimRecord.builder()
                .authorizationNumber(authorization)
                .claimId(claim.claimId())
                .memberId(member.getMemberId())
                .pharmacyNpi(claim.pharmacyNpi())
                .rxNumber(claim.prescriptionNumber())
                .fillNumber(claim.fillNumber())
                .ndc(drug.ndc())
                .gpi(drug.gpi())
                .drugName(drug.name())
                .serviceDate(claim.serviceDate())
                .quantity(claim.quantityDispensed())
                .daysSupply(claim.daysSupply())
                .tier(drug.tier())
                .planPaid(planPaid)
                .patientPay(patientPay)
                .deductibleApplied(deductible)
                .copay(copay)
                .coinsurance(coinsurance)
                .status(PharmacyClaimRecord.PAID)
                .createdAt(LocalDateTime.now(settings.clock()))
                .build());
        // Accumulators move only once the claim is on record
        member.setDeductibleMet(member.getDeductibleMet().add(deductible));
        member.setOopMet(member.getOopMet().add(patientPay));
        log.info("Paid claim {} for member {}: {} tier {}, plan {} patient {}",
                authorization, member.getMemberId(), drug.ndc(), drug.tier(), planPaid, patientPay);

        return ClaimResponse.builder()
                .claimId(claim.claimId())
                .transactionCode(code)
                .status(ClaimStatusCode.P)
                .authorizationNumber(authorization)
                .tier(drug.tier())
                .allowedAmount(allowed)
                .ingredientCostPaid(ingredientPaid)
                .dispensingFeePaid(feePaid)
                .planPaid(planPaid)
                .patientPay(patientPay)
                .copay(copay)
                .coinsurance(coinsurance)
                .deductibleApplied(deductible)
                .durAlerts(warnings)
                .remainingDeductible(member.getDeductibleRemaining())
                .remainingOop(member.getOopRemaining())
                .message(warnings.isEmpty() ? "Claim paid" : "Claim paid with DUR warnings")
                .build();
    }

    private ClaimResponse duplicateOf(PharmacyClaim claim, TransactionCode code, PharmacyClaimRecord paid,
            RxMember member) {
        log.info("Duplicate of paid claim {}", paid.authorizationNumber());
        return ClaimResponse.builder()
                .claimId(claim.claimId())
                .transactionCode(code)
                .status(ClaimStatusCode.D)
                .authorizationNumber(paid.authorizationNumber())
                .tier(paid.tier())
                .planPaid(paid.planPaid())
                .patientPay(paid.patientPay())
                .copay(paid.copay())
                .coinsurance(paid.coinsurance())
                .deductibleApplied(paid.deductibleApplied())
                .remainingDeductible(member.getDeductibleRemaining())
                .remainingOop(member.getOopRemaining())
                .message("Duplicate of paid claim")
                .build();
    }

    private ClaimResponse rejected(PharmacyClaim claim, TransactionCode code, RxMember member, List<Reject> rejects,
            List<DurAlert> alerts) {
        log.info("Rejected claim {} for member {}: {}", claim.claimId(), member.getMemberId(),
                rejects.stream().map(Reject::code).toList());
        return ClaimResponse.builder()
                .claimId(claim.claimId())
                .transactionCode(code)
                .status(ClaimStatusCode.R)
                .rejects(rejects)
                .durAlerts(alerts)
                .planPaid(BigDecimal.ZERO)
                .patientPay(BigDecimal.ZERO)
                .remainingDeductible(member.getDeductibleRemaining())
                .remainingOop(member.getOopRemaining())
                .message(rejects.get(0).message())
                .build();
    }

    private String nextAuthorization(LocalDate serviceDate) {
        return AuthorizationNumbers.format("RX", serviceDate, authSequence.incrementAndGet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
