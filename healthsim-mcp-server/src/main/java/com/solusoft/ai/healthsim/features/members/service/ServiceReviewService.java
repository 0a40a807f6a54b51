package com.solusoft.ai.healthsim.features.members.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.members.model.ReviewAction;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewDecision;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewRequest;

import lombok.extern.slf4j.Slf4j;

/**
 * Utilization review behind the 278 transaction.
 * Services off the review list are certified outright; listed services need a supporting diagnosis.
 */
@Slf4j
public class ServiceReviewService {

    static final int CERTIFICATION_DAYS = 90;

    // CPT -> ICD-10 prefixes (no dots) that support medical necessity
    private static final Map<String, List<String>> REVIEW_LIST = Map.of(
            "70551", List.of("G43", "G40", "R51", "G35"),
            "72148", List.of("M54", "M51", "M48"),
            "73721", List.of("M17", "M23", "S83"),
            "27447", List.of("M17"),
            "29881", List.of("M23", "S83"),
            "43239", List.of("K21", "K92", "R13"),
            "95810", List.of("G47"),
            "E0601", List.of("G473"));

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public ServiceReviewService(Clock clock) {
        this.clock = clock;
    }

    public ServiceReviewDecision review(ServiceReviewRequest request) {
        if (request.cptCode() == null || request.cptCode().isBlank()) {
            throw new InvalidRequestException("A procedure code is required for service review");
        }
        if (request.member() == null) {
            throw new InvalidRequestException("A member is required for service review");
        }
        String cpt = request.cptCode().trim().toUpperCase(Locale.ROOT);
        LocalDate serviceDate = request.serviceDate() != null ? request.serviceDate() : LocalDate.now(clock);
        String reviewId = String.format("UM%s%06d", LocalDate.now(clock).toString().replace("-", ""), sequence.incrementAndGet());

        if (!request.member().isCoveredOn(serviceDate)) {
            log.info("Review {}: member {} not covered on {}", reviewId, request.member().memberId(), serviceDate);
            return new ServiceReviewDecision(reviewId, request, ReviewAction.NOT_CERTIFIED, false, null, null, null,
                    "E8", "Member not eligible on the requested service date", List.of());
        }

        List<String> supporting = REVIEW_LIST.get(cpt);
        if (supporting == null) {
            return certified(reviewId, request, serviceDate, false, List.of(),
                    "Service does not require review; certified");
        }
        boolean supported = request.diagnosisCodes() != null && request.diagnosisCodes().stream()
                .map(ServiceReviewService::normalize)
                .anyMatch(dx -> supporting.stream().anyMatch(dx::startsWith));
        if (supported) {
            return certified(reviewId, request, serviceDate, true, supporting,
                    "Diagnosis supports medical necessity; certified");
        }
        log.info("Review {}: {} not certified, no supporting diagnosis in {}", reviewId, cpt, request.diagnosisCodes());
        return new ServiceReviewDecision(reviewId, request, ReviewAction.NOT_CERTIFIED, true, null, null, null,
                "35", "Submitted diagnoses do not support medical necessity for " + cpt, supporting);
    }

    public boolean requiresReview(String cptCode) {
        return cptCode != null && REVIEW_LIST.containsKey(cptCode.trim().toUpperCase(Locale.ROOT));
    }

    private ServiceReviewDecision certified(String reviewId, ServiceReviewRequest request, LocalDate serviceDate,
                                            boolean reviewed, List<String> supporting, String message) {
        String certification = "CERT" + reviewId.substring(2);
        return new ServiceReviewDecision(reviewId, request, ReviewAction.CERTIFIED, reviewed, certification,
                serviceDate, serviceDate.plusDays(CERTIFICATION_DAYS), null, message, supporting);
    }

    static String normalize(String diagnosisCode) {
        return diagnosisCode == null ? "" : diagnosisCode.replace(".", "").trim().toUpperCase(Locale.ROOT);
    }
}
