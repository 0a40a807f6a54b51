package com.solusoft.ai.healthsim.features.members.format;

import static com.solusoft.ai.healthsim.features.members.format.X12Writer.amount;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.composite;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.date;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.segment;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.upper;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.features.members.model.ClaimLine;
import com.solusoft.ai.healthsim.features.members.model.ClaimStatus;
import com.solusoft.ai.healthsim.features.members.model.ProfessionalClaim;
import com.solusoft.ai.healthsim.features.members.model.Provider;

/**
 * 835 payment/remittance advice. Pending claims are skipped; BPR02 is the sum of the claims' paid amounts.
 */
public class RemittanceFormatter extends X12Formatter {

    public RemittanceFormatter(X12Writer writer, String payerName, String payerId) {
        super(writer, payerName, payerId);
    }

    public String generate835(List<ProfessionalClaim> claims) {
        List<ProfessionalClaim> adjudicated = claims.stream().filter(c -> c.status() != ClaimStatus.PENDING).toList();
        BigDecimal totalPaid = adjudicated.stream().map(ProfessionalClaim::totalPaid).reduce(BigDecimal.ZERO, BigDecimal::add);
        LocalDate paymentDate = writer.now().toLocalDate();
        String checkNumber = referenceId("EFT");

        List<String> body = new ArrayList<>();
        body.add(segment("BPR", "I", amount(totalPaid), "C", "ACH", "CCP", "01", "999999999", "DA", "123456789",
                "1" + payerId, "", "01", "888888888", "DA", "987654321", date(paymentDate)));
        body.add(segment("TRN", "1", checkNumber, "1" + payerId));
        body.add(segment("DTM", "405", date(paymentDate)));
        body.add(segment("N1", "PR", payerName));
        body.add(segment("N1", "PE", payeeName(adjudicated), "XX", payeeNpi(adjudicated)));

        int lx = 0;
        for (ProfessionalClaim claim : adjudicated) {
            body.add(segment("LX", String.valueOf(++lx)));
            boolean denied = claim.status() == ClaimStatus.DENIED;
            // CLP02: 1 processed as primary, 4 denied
            body.add(segment("CLP", claim.claimId(), denied ? "4" : "1", amount(claim.totalCharge()),
                    amount(claim.totalPaid()), amount(claim.patientResponsibility()), "12", claim.claimId(), "11", "1"));
            if (denied) {
                body.add(segment("CAS", "CO", claim.denialReasonCode(), amount(claim.totalCharge())));
            }
            body.add(segment("NM1", "QC", "1", upper(claim.patient().lastName()), upper(claim.patient().firstName()),
                    "", "", "", "MI", claim.memberId()));
            body.add(segment("DTM", "232", date(claim.serviceDate())));

            for (ClaimLine line : claim.lines()) {
                body.add(segment("SVC", composite("HC", line.cptCode()), amount(line.charge()), amount(line.paid()),
                        "", String.valueOf(line.units())));
                body.add(segment("DTM", "472", date(claim.serviceDate())));
                if (!denied) {
                    addAdjustments(body, line);
                    body.add(segment("AMT", "B6", amount(line.allowed())));
                }
            }
        }
        return writer.write(X12TransactionType.REMITTANCE_835, body);
    }

    private static void addAdjustments(List<String> body, ClaimLine line) {
        BigDecimal contractual = line.charge().subtract(line.allowed());
        if (contractual.signum() > 0) {
            body.add(segment("CAS", "CO", "45", amount(contractual)));
        }
        if (line.deductible().signum() > 0) {
            body.add(segment("CAS", "PR", "1", amount(line.deductible())));
        }
        if (line.coinsurance().signum() > 0) {
            body.add(segment("CAS", "PR", "2", amount(line.coinsurance())));
        }
        if (line.copay().signum() > 0) {
            body.add(segment("CAS", "PR", "3", amount(line.copay())));
        }
    }

    private static String payeeName(List<ProfessionalClaim> claims) {
        return claims.isEmpty() ? "HEALTHSIM PROVIDER GROUP" : upper(claims.get(0).provider().name());
    }

    private static String payeeNpi(List<ProfessionalClaim> claims) {
        if (claims.isEmpty()) {
            return "";
        }
        Provider provider = claims.get(0).provider();
        return provider.npi();
    }
}
