package com.solusoft.ai.healthsim.features.members.format;

import static com.solusoft.ai.healthsim.features.members.format.X12Writer.composite;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.date;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.segment;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.features.members.model.ReviewAction;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewDecision;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewRequest;

/**
 * 278 health care services review, request and response.
 */
public class ServiceReviewFormatter extends X12Formatter {

    public ServiceReviewFormatter(X12Writer writer, String payerName, String payerId) {
        super(writer, payerName, payerId);
    }

    public String generate278Request(ServiceReviewRequest request) {
        List<String> body = new ArrayList<>();
        addHeader(body, "13", request);
        addPatientEvent(body, request);
        addService(body, request);
        return writer.write(X12TransactionType.SERVICES_REVIEW_278, body);
    }

    public String generate278Response(ServiceReviewDecision decision) {
        ServiceReviewRequest request = decision.request();
        List<String> body = new ArrayList<>();
        addHeader(body, "11", request);
        addPatientEvent(body, request);
        if (decision.action() == ReviewAction.CERTIFIED) {
            body.add(segment("HCR", decision.action().hcrCode(), decision.certificationNumber()));
            body.add(segment("REF", "BB", decision.certificationNumber()));
            body.add(segment("DTP", "AAH", "RD8",
                    date(decision.effectiveFrom()) + "-" + date(decision.effectiveTo())));
        } else {
            body.add(segment("HCR", decision.action().hcrCode(), decision.reviewId(), decision.reasonCode()));
        }
        addService(body, request);
        return writer.write(X12TransactionType.SERVICES_REVIEW_278, body);
    }

    private void addHeader(List<String> body, String purpose, ServiceReviewRequest request) {
        body.add(segment("BHT", "0007", purpose, referenceId("UMR"), date(writer.now().toLocalDate()),
                writer.now().format(DateTimeFormatter.ofPattern("HHmm"))));
        body.add(segment("HL", "1", "", "20", "1"));
        body.add(segment("NM1", "X3", "2", payerName, "", "", "", "", "PI", payerId));
        body.add(segment("HL", "2", "1", "21", "1"));
        body.add(segment("NM1", "1P", "2", "HEALTHSIM REQUESTING PROVIDER", "", "", "", "", "XX", request.providerNpi()));
        body.add(segment("HL", "3", "2", "22", "1"));
        body.add(personName("IL", request.member().demographics(), "MI", request.member().memberId()));
        body.add(demographics(request.member().demographics()));
    }

    private void addPatientEvent(List<String> body, ServiceReviewRequest request) {
        body.add(segment("HL", "4", "3", "EV", "1"));
        // UM01 HS health services review, UM02 I initial, UM03 1 medical care
        body.add(segment("UM", "HS", "I", "1"));
        if (request.serviceDate() != null) {
            body.add(segment("DTP", "472", "D8", date(request.serviceDate())));
        }
        if (request.diagnosisCodes() != null && !request.diagnosisCodes().isEmpty()) {
            body.add(ProfessionalClaimFormatter.diagnoses(request.diagnosisCodes()));
        }
    }

    private void addService(List<String> body, ServiceReviewRequest request) {
        body.add(segment("HL", "5", "4", "SS", "0"));
        body.add(segment("SV1", composite("HC", request.cptCode()), "", "UN", String.valueOf(Math.max(1, request.units()))));
    }
}
