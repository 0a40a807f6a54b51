package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;
import com.solusoft.ai.healthsim.features.pharmacy.model.PaCriteriaGroup;
import com.solusoft.ai.healthsim.features.pharmacy.model.PaQuestion;
import com.solusoft.ai.healthsim.features.pharmacy.model.PaQuestionSet;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthDecision;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthStatus;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthorization;

import lombok.extern.slf4j.Slf4j;

/**
 * Evaluates prior authorization requests against per-group clinical criteria.
 * <p>
 * Exclusions deny outright; otherwise missing evidence pends the request, unmet criteria deny it,
 * and a fully met request is approved for {@value #APPROVAL_DAYS} days and recorded in the ledger.
 */
@Slf4j
public class PriorAuthorizationService {

    public static final int APPROVAL_DAYS = 365;

    static final BigDecimal A1C_THRESHOLD = new BigDecimal("7.0");
    static final int A1C_MAX_AGE_DAYS = 90;
    static final int METFORMIN_MIN_MONTHS = 3;
    static final BigDecimal BMI_OBESE = new BigDecimal("30");
    static final BigDecimal BMI_OVERWEIGHT = new BigDecimal("27");

    private static final List<String> WEIGHT_COMORBIDITIES = List.of("I10", "E78", "E11", "G4733");
    private static final List<String> TNF_INDICATIONS = List.of("M05", "M06", "L40", "K50", "K51", "M45");

    private static final PaQuestion DIAGNOSIS = new PaQuestion("DX",
            "ICD-10 diagnosis codes supporting the request", PaQuestion.Type.CODE_LIST, true);

    private static final Map<PaCriteriaGroup, List<PaQuestion>> QUESTIONS = new EnumMap<>(PaCriteriaGroup.class);

    static {
        QUESTIONS.put(PaCriteriaGroup.GLP1_DIABETES, List.of(DIAGNOSIS,
                new PaQuestion("A1C", "Most recent hemoglobin A1c (%)", PaQuestion.Type.NUMERIC, true),
                new PaQuestion("A1C_DATE", "Date of the A1c result", PaQuestion.Type.DATE, true),
                new PaQuestion("METFORMIN_MONTHS", "Months of metformin therapy tried", PaQuestion.Type.NUMERIC, true)));
        QUESTIONS.put(PaCriteriaGroup.GLP1_WEIGHT, List.of(DIAGNOSIS,
                new PaQuestion("BMI", "Current body mass index (kg/m2)", PaQuestion.Type.NUMERIC, true)));
        QUESTIONS.put(PaCriteriaGroup.TNF_BIOLOGIC, List.of(DIAGNOSIS,
                new PaQuestion("FAILED_CONVENTIONAL",
                        "Has the patient failed at least one conventional systemic therapy?", PaQuestion.Type.BOOLEAN, true),
                new PaQuestion("SPECIALIST",
                        "Is the drug prescribed by or in consultation with a specialist?", PaQuestion.Type.BOOLEAN, true)));
    }

    private final Formulary formulary;
    private final PriorAuthorizationLedger ledger;
    private final Clock clock;
    private final AtomicLong sequence;

    public PriorAuthorizationService(Formulary formulary, PriorAuthorizationLedger ledger, Clock clock) {
        this.formulary = formulary;
        this.ledger = ledger;
        this.clock = clock;
        this.sequence = new AtomicLong(ledger.lastSequence());
    }

    public PriorAuthDecision evaluate(PriorAuthRequest request) {
        if (request.memberId() == null || request.memberId().isBlank()) {
            throw new InvalidRequestException("memberId is required");
        }
        FormularyDrug drug = drug(request.ndc());
        if (!drug.requiresPa()) {
            throw new InvalidRequestException(drug.name() + " does not require prior authorization");
        }
        LocalDate requestDate = request.requestDate() != null ? request.requestDate() : LocalDate.now(clock);
        String requestId = AuthorizationNumbers.format("PAR", requestDate, sequence.incrementAndGet());

        Optional<PaCriteriaGroup> group = PaCriteriaGroup.forGpi(drug.gpi());
        PriorAuthDecision.PriorAuthDecisionBuilder decision = PriorAuthDecision.builder()
                .requestId(requestId)
                .memberId(request.memberId())
                .ndc(drug.ndc())
                .drugName(drug.name())
                .criteriaGroup(group.orElse(null));
        if (group.isEmpty()) {
            log.info("PA {} for {} pended: no automated criteria", requestId, drug.name());
            return decision.status(PriorAuthStatus.PENDED)
                    .metCriteria(List.of()).unmetCriteria(List.of()).exclusions(List.of())
                    .missingInformation(List.of("clinical review"))
                    .message("No automated criteria for " + drug.name() + "; pended for clinical review")
                    .build();
        }

        Evaluation evaluation = new Evaluation(request.diagnosisCodes());
        switch (group.get()) {
            case GLP1_DIABETES:
                evaluateDiabetes(request, requestDate, evaluation);
                break;
            case GLP1_WEIGHT:
                evaluateWeight(request, evaluation);
                break;
            case TNF_BIOLOGIC:
            default:
                evaluateBiologic(request, evaluation);
                break;
        }
        decision.metCriteria(evaluation.met)
                .unmetCriteria(evaluation.unmet)
                .missingInformation(evaluation.missing)
                .exclusions(evaluation.exclusions);

        if (!evaluation.exclusions.isEmpty()) {
            log.info("PA {} denied: exclusions {}", requestId, evaluation.exclusions);
            return decision.status(PriorAuthStatus.DENIED)
                    .message("Denied: " + String.join("; ", evaluation.exclusions)).build();
        }
        if (!evaluation.missing.isEmpty()) {
            log.info("PA {} pended: missing {}", requestId, evaluation.missing);
            return decision.status(PriorAuthStatus.PENDED)
                    .message("Additional information required: " + String.join(", ", evaluation.missing)).build();
        }
        if (!evaluation.unmet.isEmpty()) {
            log.info("PA {} denied: unmet {}", requestId, evaluation.unmet);
            return decision.status(PriorAuthStatus.DENIED)
                    .message("Criteria not met: " + String.join("; ", evaluation.unmet)).build();
        }

        String paNumber = AuthorizationNumbers.format("PA", requestDate, sequence.incrementAndGet());
        LocalDate expiration = requestDate.plusDays(APPROVAL_DAYS);
        ledger.save(PriorAuthorization.builder()
                .paNumber(paNumber)
                .memberId(request.memberId())
                .ndc(drug.ndc())
                .gpi(drug.gpi())
                .drugName(drug.name())
                .status(PriorAuthStatus.APPROVED.name())
                .effectiveDate(requestDate)
                .expirationDate(expiration)
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("PA {} approved as {} for member {}", requestId, paNumber, request.memberId());
        return decision.status(PriorAuthStatus.APPROVED)
                .paNumber(paNumber)
                .effectiveDate(requestDate)
                .expirationDate(expiration)
                .message("Approved through " + expiration)
                .build();
    }

    public PaQuestionSet questionSet(String ndc) {
        FormularyDrug drug = drug(ndc);
        Optional<PaCriteriaGroup> group = PaCriteriaGroup.forGpi(drug.gpi());
        List<PaQuestion> questions = group.map(QUESTIONS::get).orElse(List.of(DIAGNOSIS,
                new PaQuestion("NOTES", "Clinical rationale for the request", PaQuestion.Type.CODE_LIST, true)));
        return new PaQuestionSet(drug.ndc(), drug.name(), group.orElse(null), questions);
    }

    private void evaluateDiabetes(PriorAuthRequest request, LocalDate requestDate, Evaluation evaluation) {
        evaluation.exclude("E10", "Type 1 diabetes");
        evaluation.exclude("K85", "History of pancreatitis");
        evaluation.exclude("C73", "Personal history of medullary thyroid carcinoma");
        if (evaluation.requireDiagnosis()) {
            evaluation.check(evaluation.hasDiagnosis("E11"), "Type 2 diabetes diagnosis");
        }
        if (evaluation.require(request.a1c(), "A1c result")) {
            evaluation.check(request.a1c().compareTo(A1C_THRESHOLD) >= 0, "A1c at least 7.0%");
        }
        if (evaluation.require(request.a1cDate(), "A1c date")) {
            long age = ChronoUnit.DAYS.between(request.a1cDate(), requestDate);
            evaluation.check(age >= 0 && age <= A1C_MAX_AGE_DAYS, "A1c within 90 days");
        }
        if (evaluation.require(request.metforminTrialMonths(), "metformin trial duration")) {
            evaluation.check(request.metforminTrialMonths() >= METFORMIN_MIN_MONTHS, "Metformin trial of at least 3 months");
        }
    }

    private void evaluateWeight(PriorAuthRequest request, Evaluation evaluation) {
        evaluation.exclude("C73", "Personal history of medullary thyroid carcinoma");
        evaluation.exclude("Z331", "Pregnancy");
        evaluation.exclude("O", "Pregnancy");
        if (evaluation.require(request.bmi(), "BMI")) {
            boolean comorbid = WEIGHT_COMORBIDITIES.stream().anyMatch(evaluation::hasDiagnosis);
            boolean met = request.bmi().compareTo(BMI_OBESE) >= 0
                    || (request.bmi().compareTo(BMI_OVERWEIGHT) >= 0 && comorbid);
            evaluation.check(met, "BMI of 30 or more, or 27 or more with a weight-related comorbidity");
        }
    }

    private void evaluateBiologic(PriorAuthRequest request, Evaluation evaluation) {
        evaluation.exclude("A15", "Active tuberculosis");
        if (evaluation.requireDiagnosis()) {
            evaluation.check(TNF_INDICATIONS.stream().anyMatch(evaluation::hasDiagnosis), "Approved indication");
        }
        if (evaluation.require(request.failedConventionalTherapy(), "conventional therapy history")) {
            evaluation.check(request.failedConventionalTherapy(), "Failure of conventional systemic therapy");
        }
        if (evaluation.require(request.specialistConfirmed(), "specialist involvement")) {
            evaluation.check(request.specialistConfirmed(), "Prescribed by or with a specialist");
        }
    }

    private FormularyDrug drug(String ndc) {
        if (ndc == null || ndc.isBlank()) {
            throw new InvalidRequestException("ndc is required");
        }
        return formulary.drug(ndc).orElseThrow(() -> new UnknownReferenceException("NDC", ndc));
    }

    private static final class Evaluation {

        private final List<String> diagnoses = new ArrayList<>();
        private final List<String> met = new ArrayList<>();
        private final List<String> unmet = new ArrayList<>();
        private final List<String> missing = new ArrayList<>();
        private final List<String> exclusions = new ArrayList<>();

        Evaluation(List<String> codes) {
            codes.forEach(code -> diagnoses.add(code.replace(".", "").trim().toUpperCase(Locale.ROOT)));
        }

        boolean hasDiagnosis(String prefix) {
            return diagnoses.stream().anyMatch(code -> code.startsWith(prefix));
        }

        void exclude(String prefix, String reason) {
            if (hasDiagnosis(prefix) && !exclusions.contains(reason)) {
                exclusions.add(reason);
            }
        }

        boolean requireDiagnosis() {
            if (diagnoses.isEmpty()) {
                missing.add("diagnosis codes");
                return false;
            }
            return true;
        }

        boolean require(Object value, String name) {
            if (value == null) {
                missing.add(name);
                return false;
            }
            return true;
        }

        void check(boolean passed, String criterion) {
            (passed ? met : unmet).add(criterion);
        }
    }
}
