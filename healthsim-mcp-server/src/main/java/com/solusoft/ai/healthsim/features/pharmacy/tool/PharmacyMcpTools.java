package com.solusoft.ai.healthsim.features.pharmacy.tool;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.common.tool.McpToolSupport;
import com.solusoft.ai.healthsim.config.HealthSimProperties;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.pharmacy.format.NcpdpScriptFormatter;
import com.solusoft.ai.healthsim.features.pharmacy.format.NcpdpTelecomFormatter;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimResponse;
import com.solusoft.ai.healthsim.features.pharmacy.model.CurrentMedication;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurResult;
import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;
import com.solusoft.ai.healthsim.features.pharmacy.model.PaQuestionSet;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaim;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthDecision;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;
import com.solusoft.ai.healthsim.features.pharmacy.model.TransactionCode;
import com.solusoft.ai.healthsim.features.pharmacy.service.AdjudicationEngine;
import com.solusoft.ai.healthsim.features.pharmacy.service.DurValidator;
import com.solusoft.ai.healthsim.features.pharmacy.service.Formulary;
import com.solusoft.ai.healthsim.features.pharmacy.service.PriorAuthorizationService;
import com.solusoft.ai.healthsim.features.pharmacy.service.RxMemberGenerator;
import com.solusoft.ai.healthsim.features.pharmacy.service.RxMemberRegistry;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class PharmacyMcpTools extends McpToolSupport {

    static final String DEFAULT_NDC = "00093017101";
    private static final String DEFAULT_SIG = "Take 1 tablet by mouth once daily";

    private final AdjudicationEngine engine;
    private final DurValidator durValidator;
    private final PriorAuthorizationService priorAuthService;
    private final RxMemberRegistry registry;
    private final NcpdpTelecomFormatter telecomFormatter;
    private final NcpdpScriptFormatter scriptFormatter;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public PharmacyMcpTools(ObjectMapper objectMapper, HealthSimProperties properties, AdjudicationEngine engine,
                            DurValidator durValidator, PriorAuthorizationService priorAuthService,
                            RxMemberRegistry registry, NcpdpTelecomFormatter telecomFormatter,
                            NcpdpScriptFormatter scriptFormatter, Clock clock) {
        super(objectMapper, properties);
        this.engine = engine;
        this.durValidator = durValidator;
        this.priorAuthService = priorAuthService;
        this.registry = registry;
        this.telecomFormatter = telecomFormatter;
        this.scriptFormatter = scriptFormatter;
        this.clock = clock;
    }

    @McpTool(name = "generate_rx_member",
            description = "Generates pharmacy benefit members with BIN/PCN/group, cardholder id and deductible/out-of-pocket "
                    + "accumulators. Generated members can be used with adjudicate_pharmacy_claim.")
    public String generateRxMember(
            @McpToolParam(description = "Number of members (default 1)", required = false) Integer count,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed,
            @McpToolParam(description = "6 digit BIN", required = false) String bin,
            @McpToolParam(description = "Processor control number", required = false) String pcn,
            @McpToolParam(description = "Group number", required = false) String groupNumber,
            @McpToolParam(description = "M or F", required = false) String gender,
            @McpToolParam(description = "Minimum age in years", required = false) Integer minAge,
            @McpToolParam(description = "Maximum age in years", required = false) Integer maxAge) {
        log.info("[TOOL] Entering generate_rx_member");
        log.debug("Input count: {}, seed: {}, bin: {}, pcn: {}, group: {}", count, seed, bin, pcn, groupNumber);
        try {
            long resolvedSeed = resolveSeed(seed);
            int total = checkCount(count, 1);
            HealthSimProperties.Pharmacy pharmacy = properties.getPharmacy();
            AgeRange ages = minAge == null && maxAge == null ? null : AgeRange.orDefault(minAge, maxAge, AgeRange.of(0, AgeRange.MAX_AGE));
            RxMemberGenerator generator = new RxMemberGenerator(resolvedSeed, clock)
                    .withLimits(pharmacy.getDeductibleLimit(), pharmacy.getOopLimit());

            List<RxMember> members = new ArrayList<>();
            for (int i = 0; i < total; i++) {
                members.add(registry.register(generator.generate(
                        bin == null ? pharmacy.getDefaultBin() : bin.trim(),
                        pcn == null ? pharmacy.getDefaultPcn() : pcn.trim(),
                        groupNumber == null ? pharmacy.getDefaultGroup() : groupNumber.trim(),
                        ages, Gender.parse(gender))));
            }

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("count", members.size());
            result.put("members", members);
            log.info("[TOOL] Exiting generate_rx_member");
            return toJson(result);
        } catch (Exception e) {
            return handleError("generateRxMember", e);
        }
    }

    @McpTool(name = "check_formulary_coverage",
            description = "Looks up an NDC on the formulary: coverage, tier, cost share, prior authorization, step therapy "
                    + "and quantity limits.")
    public String checkFormularyCoverage(
            @McpToolParam(description = "11 digit NDC", required = true) String ndc) {
        log.info("[TOOL] Entering check_formulary_coverage");
        log.debug("Input ndc: {}", ndc);
        try {
            if (ndc == null || ndc.isBlank()) {
                throw new InvalidRequestException("ndc is required");
            }
            Formulary formulary = engine.formulary();
            Map<String, Object> result = success();
            result.put("formulary_id", formulary.formularyId());
            result.put("coverage", formulary.checkCoverage(ndc.trim()));
            log.info("[TOOL] Exiting check_formulary_coverage");
            return toJson(result);
        } catch (Exception e) {
            return handleError("checkFormularyCoverage", e);
        }
    }

    @McpTool(name = "list_formulary", description = "Lists the formulary tiers with their cost share and the drugs on each tier.")
    public String listFormulary(
            @McpToolParam(description = "Only drugs on this tier (1-5)", required = false) Integer tier) {
        log.info("[TOOL] Entering list_formulary");
        try {
            Formulary formulary = engine.formulary();
            List<FormularyDrug> drugs = formulary.drugs().stream()
                    .filter(drug -> tier == null || drug.tier() == tier)
                    .toList();
            Map<String, Object> result = success();
            result.put("formulary_id", formulary.formularyId());
            result.put("name", formulary.name());
            result.put("tiers", formulary.tiers());
            result.put("count", drugs.size());
            result.put("drugs", drugs);
            log.info("[TOOL] Exiting list_formulary");
            return toJson(result);
        } catch (Exception e) {
            return handleError("listFormulary", e);
        }
    }

    @McpTool(name = "screen_dur",
            description = "Runs drug utilization review for a new drug against current medications: drug-drug interactions, "
                    + "therapeutic duplication, high dose, drug-age and drug-gender alerts.")
    public String screenDur(
            @McpToolParam(description = "NDC of the new drug", required = true) String ndc,
            @McpToolParam(description = "GPI of the new drug, needed when the NDC is not on the formulary", required = false) String gpi,
            @McpToolParam(description = "Comma separated NDCs the patient already takes", required = false) String currentMedications,
            @McpToolParam(description = "Patient age in years", required = true) Integer age,
            @McpToolParam(description = "M or F", required = false) String gender,
            @McpToolParam(description = "Quantity dispensed", required = false) Double quantity,
            @McpToolParam(description = "Days supply", required = false) Integer daysSupply) {
        log.info("[TOOL] Entering screen_dur");
        log.debug("Input ndc: {}, currentMedications: {}, age: {}", ndc, currentMedications, age);
        try {
            if (ndc == null || ndc.isBlank()) {
                throw new InvalidRequestException("ndc is required");
            }
            if (age == null || age < 0) {
                throw new InvalidRequestException("age is required and must be >= 0");
            }
            List<CurrentMedication> current = csv(currentMedications).stream()
                    .map(code -> CurrentMedication.of(code, null, null))
                    .toList();
            DurResult dur = durValidator.validate(DurRequest.builder()
                    .ndc(ndc.trim())
                    .gpi(gpi)
                    .serviceDate(LocalDate.now(clock))
                    .currentMedications(current)
                    .patientAge(age)
                    .patientGender(Gender.parse(gender))
                    .quantity(quantity == null ? null : BigDecimal.valueOf(quantity))
                    .daysSupply(daysSupply)
                    .build());

            Map<String, Object> result = success();
            result.put("passed", dur.passed());
            result.put("total_alerts", dur.totalAlerts());
            result.put("alerts", dur.alerts());
            log.info("[TOOL] Exiting screen_dur");
            return toJson(result);
        } catch (Exception e) {
            return handleError("screenDur", e);
        }
    }

    @McpTool(name = "adjudicate_pharmacy_claim",
            description = "Submits an NCPDP B1 (or B3 rebill) claim for a generated rx member and returns the adjudication: "
                    + "paid amounts or reject codes (70, 75, 76, 79, 88, 608 ...), DUR alerts, updated accumulators and the "
                    + "NCPDP D.0 request/response.")
    public String adjudicatePharmacyClaim(
            @McpToolParam(description = "Member id from generate_rx_member", required = true) String memberId,
            @McpToolParam(description = "11 digit NDC", required = true) String ndc,
            @McpToolParam(description = "Quantity dispensed", required = true) Double quantity,
            @McpToolParam(description = "Days supply (1-90)", required = true) Integer daysSupply,
            @McpToolParam(description = "Submitted ingredient cost", required = true) Double ingredientCost,
            @McpToolParam(description = "Submitted dispensing fee (default from configuration)", required = false) Double dispensingFee,
            @McpToolParam(description = "Usual and customary charge", required = false) Double usualAndCustomary,
            @McpToolParam(description = "Prescription number (generated when omitted)", required = false) String rxNumber,
            @McpToolParam(description = "Fill number, 0 for the original fill", required = false) Integer fillNumber,
            @McpToolParam(description = "Date of service yyyy-MM-dd (default today)", required = false) String serviceDate,
            @McpToolParam(description = "Prior authorization number", required = false) String priorAuthNumber,
            @McpToolParam(description = "DUR override (result of service) code, e.g. 1G", required = false) String durOverrideCode,
            @McpToolParam(description = "B1 (default) or B3", required = false) String transactionCode) {
        log.info("[TOOL] Entering adjudicate_pharmacy_claim");
        log.debug("Input memberId: {}, ndc: {}, quantity: {}, daysSupply: {}", memberId, ndc, quantity, daysSupply);
        try {
            TransactionCode code = TransactionCode.parse(transactionCode);
            if (code == TransactionCode.B2) {
                throw new InvalidRequestException("Use reverse_pharmacy_claim for B2 reversals");
            }
            if (ndc == null || ndc.isBlank() || quantity == null || daysSupply == null || ingredientCost == null) {
                throw new InvalidRequestException("ndc, quantity, daysSupply and ingredientCost are required");
            }
            RxMember member = registry.get(memberId);
            BigDecimal ingredient = money(ingredientCost);
            BigDecimal fee = dispensingFee == null ? properties.getPharmacy().getDispensingFee() : money(dispensingFee);
            PharmacyClaim claim = claimFor(member, code)
                    .prescriptionNumber(rxNumber == null || rxNumber.isBlank() ? nextRxNumber() : rxNumber.trim())
                    .fillNumber(fillNumber == null ? 0 : fillNumber)
                    .serviceDate(parseDate("serviceDate", serviceDate, LocalDate.now(clock)))
                    .ndc(ndc.trim())
                    .quantityDispensed(BigDecimal.valueOf(quantity))
                    .daysSupply(daysSupply)
                    .ingredientCostSubmitted(ingredient)
                    .dispensingFeeSubmitted(fee)
                    .usualCustomaryCharge(usualAndCustomary == null ? null : money(usualAndCustomary))
                    .grossAmountDue(ingredient.add(fee))
                    .patientPaidSubmitted(BigDecimal.ZERO)
                    .priorAuthNumber(blankToNull(priorAuthNumber))
                    .durOverrideCode(blankToNull(durOverrideCode))
                    .build();

            ClaimResponse response = engine.adjudicate(claim, member);

            Map<String, Object> result = success();
            result.put("rx_number", claim.prescriptionNumber());
            result.put("service_date", claim.serviceDate());
            result.put("response", response);
            result.put("member", accumulators(member));
            result.put("ncpdp_request", telecomFormatter.request(claim, member));
            result.put("ncpdp_response", telecomFormatter.response(response, claim));
            log.info("[TOOL] Exiting adjudicate_pharmacy_claim");
            return toJson(result);
        } catch (Exception e) {
            return handleError("adjudicatePharmacyClaim", e);
        }
    }

    @McpTool(name = "reverse_pharmacy_claim",
            description = "Submits an NCPDP B2 reversal for a paid claim; restores the member's deductible and out-of-pocket "
                    + "accumulators or rejects with 87.")
    public String reversePharmacyClaim(
            @McpToolParam(description = "Member id from generate_rx_member", required = true) String memberId,
            @McpToolParam(description = "Prescription number of the paid claim", required = true) String rxNumber,
            @McpToolParam(description = "Date of service of the paid claim yyyy-MM-dd", required = true) String serviceDate,
            @McpToolParam(description = "Fill number (default 0)", required = false) Integer fillNumber,
            @McpToolParam(description = "NDC of the paid claim", required = false) String ndc) {
        log.info("[TOOL] Entering reverse_pharmacy_claim");
        log.debug("Input memberId: {}, rxNumber: {}, serviceDate: {}", memberId, rxNumber, serviceDate);
        try {
            if (rxNumber == null || rxNumber.isBlank()) {
                throw new InvalidRequestException("rxNumber is required");
            }
            LocalDate date = parseDate("serviceDate", serviceDate, null);
            if (date == null) {
                throw new InvalidRequestException("serviceDate is required");
            }
            RxMember member = registry.get(memberId);
            PharmacyClaim claim = claimFor(member, TransactionCode.B2)
                    .prescriptionNumber(rxNumber.trim())
                    .fillNumber(fillNumber == null ? 0 : fillNumber)
                    .serviceDate(date)
                    .ndc(ndc == null ? null : ndc.trim())
                    .build();

            ClaimResponse response = engine.reverse(claim, member);

            Map<String, Object> result = success();
            result.put("response", response);
            result.put("member", accumulators(member));
            result.put("ncpdp_request", telecomFormatter.request(claim, member));
            result.put("ncpdp_response", telecomFormatter.response(response, claim));
            log.info("[TOOL] Exiting reverse_pharmacy_claim");
            return toJson(result);
        } catch (Exception e) {
            return handleError("reversePharmacyClaim", e);
        }
    }

    @McpTool(name = "evaluate_prior_authorization",
            description = "Evaluates a prior authorization request against clinical criteria (GLP-1 diabetes, GLP-1 weight "
                    + "management, TNF biologics). Approved requests return a PA number usable on claims for 365 days.")
    public String evaluatePriorAuthorization(
            @McpToolParam(description = "Member id from generate_rx_member", required = true) String memberId,
            @McpToolParam(description = "NDC of the requested drug", required = true) String ndc,
            @McpToolParam(description = "Comma separated ICD-10 codes", required = false) String diagnosisCodes,
            @McpToolParam(description = "Most recent A1c percent", required = false) Double a1c,
            @McpToolParam(description = "Date of the A1c result yyyy-MM-dd", required = false) String a1cDate,
            @McpToolParam(description = "Body mass index", required = false) Double bmi,
            @McpToolParam(description = "Months of metformin therapy tried", required = false) Integer metforminTrialMonths,
            @McpToolParam(description = "Patient failed conventional systemic therapy", required = false) Boolean failedConventionalTherapy,
            @McpToolParam(description = "Prescribed by or with a specialist", required = false) Boolean specialistConfirmed) {
        log.info("[TOOL] Entering evaluate_prior_authorization");
        log.debug("Input memberId: {}, ndc: {}, diagnosisCodes: {}", memberId, ndc, diagnosisCodes);
        try {
            RxMember member = registry.get(memberId);
            PriorAuthDecision decision = priorAuthService.evaluate(PriorAuthRequest.builder()
                    .memberId(member.getMemberId())
                    .ndc(ndc)
                    .requestDate(LocalDate.now(clock))
                    .diagnosisCodes(csv(diagnosisCodes))
                    .a1c(a1c == null ? null : BigDecimal.valueOf(a1c))
                    .a1cDate(parseDate("a1cDate", a1cDate, null))
                    .bmi(bmi == null ? null : BigDecimal.valueOf(bmi))
                    .metforminTrialMonths(metforminTrialMonths)
                    .failedConventionalTherapy(failedConventionalTherapy)
                    .specialistConfirmed(specialistConfirmed)
                    .build());

            Map<String, Object> result = success();
            result.put("decision", decision);
            result.put("ncpdp_pa_response", scriptFormatter.paResponse(decision, member));
            log.info("[TOOL] Exiting evaluate_prior_authorization");
            return toJson(result);
        } catch (Exception e) {
            return handleError("evaluatePriorAuthorization", e);
        }
    }

    @McpTool(name = "get_prior_auth_questions",
            description = "Returns the prior authorization question set for a drug; with a member id also the NCPDP "
                    + "PAInitiationResponse XML.")
    public String getPriorAuthQuestions(
            @McpToolParam(description = "NDC of the requested drug", required = true) String ndc,
            @McpToolParam(description = "Member id from generate_rx_member", required = false) String memberId) {
        log.info("[TOOL] Entering get_prior_auth_questions");
        try {
            PaQuestionSet questions = priorAuthService.questionSet(ndc);
            Map<String, Object> result = success();
            result.put("question_set", questions);
            if (memberId != null && !memberId.isBlank()) {
                String reference = "PAREF" + String.format("%010d", sequence.incrementAndGet());
                result.put("pa_reference_id", reference);
                result.put("ncpdp_pa_initiation_response",
                        scriptFormatter.paInitiationResponse(questions, registry.get(memberId), reference));
            }
            log.info("[TOOL] Exiting get_prior_auth_questions");
            return toJson(result);
        } catch (Exception e) {
            return handleError("getPriorAuthQuestions", e);
        }
    }

    @McpTool(name = "export_ncpdp",
            description = "Renders an NCPDP transaction for a member without adjudicating it: TELECOM_B1 claim request, "
                    + "TELECOM_B2 reversal request or SCRIPT_NEWRX prescription XML.")
    public String exportNcpdp(
            @McpToolParam(description = "TELECOM_B1, TELECOM_B2 or SCRIPT_NEWRX", required = true) String format,
            @McpToolParam(description = "Member id; a member is generated from the seed when omitted", required = false) String memberId,
            @McpToolParam(description = "Random seed for the generated member", required = false) Long seed,
            @McpToolParam(description = "NDC (default metformin 500 MG)", required = false) String ndc,
            @McpToolParam(description = "Quantity (default 30)", required = false) Double quantity,
            @McpToolParam(description = "Days supply (default 30)", required = false) Integer daysSupply) {
        log.info("[TOOL] Entering export_ncpdp");
        log.debug("Input format: {}, memberId: {}, ndc: {}", format, memberId, ndc);
        try {
            String type = format == null ? "" : format.trim().toUpperCase(Locale.ROOT);
            Map<String, Object> result = success();
            RxMember member;
            if (memberId != null && !memberId.isBlank()) {
                member = registry.get(memberId);
            } else {
                long resolvedSeed = resolveSeed(seed);
                HealthSimProperties.Pharmacy pharmacy = properties.getPharmacy();
                member = new RxMemberGenerator(resolvedSeed, clock)
                        .withLimits(pharmacy.getDeductibleLimit(), pharmacy.getOopLimit())
                        .generate(pharmacy.getDefaultBin(), pharmacy.getDefaultPcn(), pharmacy.getDefaultGroup());
                result.put("seed", resolvedSeed);
            }
            String drugNdc = ndc == null || ndc.isBlank() ? DEFAULT_NDC : ndc.trim();
            FormularyDrug drug = engine.formulary().drug(drugNdc)
                    .orElseThrow(() -> new InvalidRequestException("NDC " + drugNdc + " is not on the formulary"));
            BigDecimal ingredient = new BigDecimal("25.00");
            BigDecimal fee = properties.getPharmacy().getDispensingFee();
            PharmacyClaim.PharmacyClaimBuilder claim = claimFor(member, TransactionCode.B1)
                    .prescriptionNumber(nextRxNumber())
                    .serviceDate(LocalDate.now(clock))
                    .ndc(drug.ndc())
                    .quantityDispensed(BigDecimal.valueOf(quantity == null ? 30.0 : quantity))
                    .daysSupply(daysSupply == null ? 30 : daysSupply)
                    .ingredientCostSubmitted(ingredient)
                    .dispensingFeeSubmitted(fee)
                    .grossAmountDue(ingredient.add(fee))
                    .patientPaidSubmitted(BigDecimal.ZERO);

            String content;
            switch (type) {
                case "TELECOM_B1":
                    content = telecomFormatter.request(claim.build(), member);
                    break;
                case "TELECOM_B2":
                    content = telecomFormatter.request(claim.transactionCode(TransactionCode.B2).build(), member);
                    break;
                case "SCRIPT_NEWRX":
                    content = scriptFormatter.newRx(claim.build(), member, drug.name(), DEFAULT_SIG, 3);
                    break;
                default:
                    throw new InvalidRequestException("Unsupported NCPDP format: " + format);
            }

            result.put("format", type);
            result.put("member_id", member.getMemberId());
            result.put("content", content);
            log.info("[TOOL] Exiting export_ncpdp");
            return toJson(result);
        } catch (Exception e) {
            return handleError("exportNcpdp", e);
        }
    }

    private PharmacyClaim.PharmacyClaimBuilder claimFor(RxMember member, TransactionCode code) {
        return PharmacyClaim.builder()
                .claimId("RXC" + String.format("%010d", sequence.incrementAndGet()))
                .transactionCode(code)
                .pharmacyNpi(properties.getPharmacy().getPharmacyNpi())
                .prescriberNpi(properties.getPharmacy().getPharmacyNpi())
                .memberId(member.getMemberId())
                .cardholderId(member.getCardholderId())
                .personCode(member.getPersonCode())
                .bin(member.getBin())
                .pcn(member.getPcn())
                .groupNumber(member.getGroupNumber())
                .dawCode("0");
    }

    private String nextRxNumber() {
        return String.format("%07d", sequence.incrementAndGet() % 10_000_000L);
    }

    private static Map<String, Object> accumulators(RxMember member) {
        Map<String, Object> accumulators = new LinkedHashMap<>();
        accumulators.put("member_id", member.getMemberId());
        accumulators.put("deductible_met", member.getDeductibleMet());
        accumulators.put("deductible_remaining", member.getDeductibleRemaining());
        accumulators.put("oop_met", member.getOopMet());
        accumulators.put("oop_remaining", member.getOopRemaining());
        return accumulators;
    }

    private static BigDecimal money(Double value) {
        if (value < 0) {
            throw new InvalidRequestException("Amounts must be >= 0, was " + value);
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
