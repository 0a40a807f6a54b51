package com.solusoft.ai.healthsim.features.members.tool;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.common.tool.McpToolSupport;
import com.solusoft.ai.healthsim.config.HealthSimProperties;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.members.format.EligibilityFormatter;
import com.solusoft.ai.healthsim.features.members.format.EnrollmentFormatter;
import com.solusoft.ai.healthsim.features.members.format.ProfessionalClaimFormatter;
import com.solusoft.ai.healthsim.features.members.format.RemittanceFormatter;
import com.solusoft.ai.healthsim.features.members.format.ServiceReviewFormatter;
import com.solusoft.ai.healthsim.features.members.format.X12TransactionType;
import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.model.MemberConstraints;
import com.solusoft.ai.healthsim.features.members.model.MemberStatus;
import com.solusoft.ai.healthsim.features.members.model.ProfessionalClaim;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewDecision;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewRequest;
import com.solusoft.ai.healthsim.features.members.service.MemberGenerator;
import com.solusoft.ai.healthsim.features.members.service.PlanCatalog;
import com.solusoft.ai.healthsim.features.members.service.ServiceReviewService;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class MemberMcpTools extends McpToolSupport {

    private static final String DEFAULT_REVIEW_CPT = "73721";
    private static final String DEFAULT_REVIEW_DIAGNOSIS = "M17.11";

    private final EnrollmentFormatter enrollmentFormatter;
    private final ProfessionalClaimFormatter claimFormatter;
    private final RemittanceFormatter remittanceFormatter;
    private final EligibilityFormatter eligibilityFormatter;
    private final ServiceReviewFormatter serviceReviewFormatter;
    private final ServiceReviewService serviceReviewService;
    private final Clock clock;

    public MemberMcpTools(ObjectMapper objectMapper, HealthSimProperties properties,
                          EnrollmentFormatter enrollmentFormatter, ProfessionalClaimFormatter claimFormatter,
                          RemittanceFormatter remittanceFormatter, EligibilityFormatter eligibilityFormatter,
                          ServiceReviewFormatter serviceReviewFormatter, ServiceReviewService serviceReviewService,
                          Clock clock) {
        super(objectMapper, properties);
        this.enrollmentFormatter = enrollmentFormatter;
        this.claimFormatter = claimFormatter;
        this.remittanceFormatter = remittanceFormatter;
        this.eligibilityFormatter = eligibilityFormatter;
        this.serviceReviewFormatter = serviceReviewFormatter;
        this.serviceReviewService = serviceReviewService;
        this.clock = clock;
    }

    @McpTool(name = "generate_members",
            description = "Generates health plan members with plan, coverage dates and deductible/out-of-pocket "
                    + "accumulators. Optionally attaches adjudicated professional claims from the last 12 months.")
    public String generateMembers(
            @McpToolParam(description = "Number of members (default 1)", required = false) Integer count,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed,
            @McpToolParam(description = "Plan code, see list_plans", required = false) String planCode,
            @McpToolParam(description = "active or termed", required = false) String status,
            @McpToolParam(description = "M or F", required = false) String gender,
            @McpToolParam(description = "Minimum age in years", required = false) Integer minAge,
            @McpToolParam(description = "Maximum age in years", required = false) Integer maxAge,
            @McpToolParam(description = "Claims to attach per member (default 0)", required = false) Integer claimsPerMember) {
        log.info("[TOOL] Entering generate_members");
        log.debug("Input count: {}, seed: {}, planCode: {}, status: {}", count, seed, planCode, status);
        try {
            long resolvedSeed = resolveSeed(seed);
            int total = checkCount(count, 1);
            int claims = claimsPerMember == null ? 0 : claimsPerMember;
            if (claims < 0) {
                throw new InvalidRequestException("claimsPerMember must be >= 0");
            }
            AgeRange ages = minAge == null && maxAge == null ? null : AgeRange.orDefault(minAge, maxAge, AgeRange.of(18, 64));
            MemberConstraints constraints = new MemberConstraints(blankToNull(planCode), ages,
                    MemberStatus.parse(status), Gender.parse(gender));

            MemberGenerator generator = new MemberGenerator(resolvedSeed, clock);
            LocalDate today = LocalDate.now(clock);
            List<Member> members = new ArrayList<>();
            for (int i = 0; i < total; i++) {
                Member member = generator.generateMember(constraints);
                if (claims > 0) {
                    LocalDate start = today.minusMonths(12).isBefore(member.coverageStart()) ? member.coverageStart() : today.minusMonths(12);
                    LocalDate end = member.coverageEnd() != null ? member.coverageEnd() : today;
                    if (!start.isAfter(end)) {
                        generator.generateClaims(member, claims, start, end);
                    }
                }
                members.add(member);
            }

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("count", members.size());
            result.put("members", members);
            log.info("[TOOL] Exiting generate_members");
            return toJson(result);
        } catch (Exception e) {
            return handleError("generateMembers", e);
        }
    }

    @McpTool(name = "generate_family",
            description = "Generates a subscriber with optional spouse and children sharing subscriber id, group, plan and coverage.")
    public String generateFamily(
            @McpToolParam(description = "Plan code (default PPO-GOLD)", required = false) String planCode,
            @McpToolParam(description = "Include a spouse (default true)", required = false) Boolean spouse,
            @McpToolParam(description = "Number of children (default 2)", required = false) Integer children,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed) {
        log.info("[TOOL] Entering generate_family");
        try {
            long resolvedSeed = resolveSeed(seed);
            List<Member> family = new MemberGenerator(resolvedSeed, clock).generateFamily(
                    planCode == null || planCode.isBlank() ? "PPO-GOLD" : planCode,
                    spouse == null || spouse,
                    children == null ? 2 : children);

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("subscriber_id", family.get(0).subscriberId());
            result.put("members", family);
            log.info("[TOOL] Exiting generate_family");
            return toJson(result);
        } catch (Exception e) {
            return handleError("generateFamily", e);
        }
    }

    @McpTool(name = "list_plans", description = "Lists the medical plans MemberSim assigns, with deductibles, out-of-pocket maximums and copays.")
    public String listPlans() {
        log.info("[TOOL] Entering list_plans");
        try {
            Map<String, Object> result = success();
            result.put("plans", PlanCatalog.all());
            log.info("[TOOL] Exiting list_plans");
            return toJson(result);
        } catch (Exception e) {
            return handleError("listPlans", e);
        }
    }

    @McpTool(name = "export_x12",
            description = "Generates members and renders an X12 005010 transaction: 834 enrollment, 837P claims, "
                    + "835 remittance, 270/271 eligibility or 278 services review.")
    public String exportX12(
            @McpToolParam(description = "834, 837P, 835, 270, 271 or 278", required = true) String transactionType,
            @McpToolParam(description = "Number of members (default 3; 270/271/278 use one)", required = false) Integer count,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed,
            @McpToolParam(description = "Plan code", required = false) String planCode,
            @McpToolParam(description = "Maximum claims per member for 837P/835 (default 3)", required = false) Integer claimsPerMember,
            @McpToolParam(description = "271 only: include benefit detail (default true)", required = false) Boolean includeBenefits) {
        log.info("[TOOL] Entering export_x12");
        log.debug("Input transactionType: {}, count: {}, seed: {}", transactionType, count, seed);
        try {
            X12TransactionType type = X12TransactionType.parse(transactionType);
            long resolvedSeed = resolveSeed(seed);
            int total = checkCount(count, 3);
            String plan = blankToNull(planCode);
            MemberGenerator generator = new MemberGenerator(resolvedSeed, clock);

            String edi;
            switch (type) {
                case ENROLLMENT_834: {
                    List<Member> members = new ArrayList<>();
                    for (int i = 0; i < total; i++) {
                        members.add(generator.generateMember(MemberConstraints.plan(plan)));
                    }
                    edi = enrollmentFormatter.generate834(members);
                    break;
                }
                case PROFESSIONAL_CLAIM_837P:
                    edi = claimFormatter.generate837p(claims(generator, plan, total, claimsPerMember));
                    break;
                case REMITTANCE_835:
                    edi = remittanceFormatter.generate835(claims(generator, plan, total, claimsPerMember));
                    break;
                case ELIGIBILITY_INQUIRY_270:
                    edi = eligibilityFormatter.generate270(generator.generateMember(MemberConstraints.plan(plan)));
                    break;
                case ELIGIBILITY_RESPONSE_271:
                    edi = eligibilityFormatter.generate271(generator.generateMember(MemberConstraints.plan(plan)),
                            includeBenefits == null || includeBenefits);
                    break;
                case SERVICES_REVIEW_278: {
                    Member member = generator.generateMember(new MemberConstraints(plan, null, MemberStatus.ACTIVE, null));
                    ServiceReviewRequest request = new ServiceReviewRequest(member, "1234567893", DEFAULT_REVIEW_CPT,
                            List.of(DEFAULT_REVIEW_DIAGNOSIS), LocalDate.now(clock).plusDays(14), 1);
                    edi = serviceReviewFormatter.generate278Request(request);
                    break;
                }
                default:
                    throw new InvalidRequestException("Unsupported transaction type: " + transactionType);
            }

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("transaction_type", type.transactionSetId());
            result.put("segment_count", edi.chars().filter(c -> c == '~').count());
            result.put("edi", edi);
            log.info("[TOOL] Exiting export_x12");
            return toJson(result);
        } catch (Exception e) {
            return handleError("exportX12", e);
        }
    }

    @McpTool(name = "review_service_request",
            description = "Runs utilization review for a planned service and returns the decision with the X12 278 "
                    + "request and response. Imaging, joint surgery, endoscopy and sleep studies need a supporting diagnosis.")
    public String reviewServiceRequest(
            @McpToolParam(description = "CPT/HCPCS code of the requested service", required = true) String cptCode,
            @McpToolParam(description = "Comma separated ICD-10 codes", required = false) String diagnosisCodes,
            @McpToolParam(description = "Planned service date (yyyy-MM-dd, default today)", required = false) String serviceDate,
            @McpToolParam(description = "Units (default 1)", required = false) Integer units,
            @McpToolParam(description = "Plan code of the generated member", required = false) String planCode,
            @McpToolParam(description = "Random seed for the generated member", required = false) Long seed) {
        log.info("[TOOL] Entering review_service_request");
        log.debug("Input cptCode: {}, diagnosisCodes: {}", cptCode, diagnosisCodes);
        try {
            long resolvedSeed = resolveSeed(seed);
            Member member = new MemberGenerator(resolvedSeed, clock)
                    .generateMember(new MemberConstraints(blankToNull(planCode), null, MemberStatus.ACTIVE, null));
            List<String> diagnoses = csv(diagnosisCodes);
            LocalDate date = parseDate("serviceDate", serviceDate, LocalDate.now(clock));
            ServiceReviewRequest request = new ServiceReviewRequest(member, "1234567893", cptCode, diagnoses, date,
                    units == null ? 1 : units);
            ServiceReviewDecision decision = serviceReviewService.review(request);

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("review_id", decision.reviewId());
            result.put("member_id", member.memberId());
            result.put("action", decision.action());
            result.put("hcr_code", decision.action().hcrCode());
            result.put("review_required", decision.reviewRequired());
            result.put("certification_number", decision.certificationNumber());
            result.put("effective_from", decision.effectiveFrom());
            result.put("effective_to", decision.effectiveTo());
            result.put("reason_code", decision.reasonCode());
            result.put("message", decision.message());
            result.put("x12_278_request", serviceReviewFormatter.generate278Request(request));
            result.put("x12_278_response", serviceReviewFormatter.generate278Response(decision));
            log.info("[TOOL] Exiting review_service_request");
            return toJson(result);
        } catch (Exception e) {
            return handleError("reviewServiceRequest", e);
        }
    }

    private static List<ProfessionalClaim> claims(MemberGenerator generator, String planCode, int members, Integer perMember) {
        int max = perMember == null ? 3 : perMember;
        if (max < 1) {
            throw new InvalidRequestException("claimsPerMember must be >= 1");
        }
        List<ProfessionalClaim> claims = new ArrayList<>();
        for (Member member : generator.generatePopulation(planCode, members, true, 1, max)) {
            claims.addAll(member.claims());
        }
        return claims;
    }
}
