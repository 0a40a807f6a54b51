package com.solusoft.ai.healthsim.features.members.format;

import static com.solusoft.ai.healthsim.features.members.format.X12Writer.amount;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.composite;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.date;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.segment;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.upper;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.features.members.model.ClaimLine;
import com.solusoft.ai.healthsim.features.members.model.ProfessionalClaim;
import com.solusoft.ai.healthsim.features.members.model.Relationship;

/**
 * 837P professional claims. Each claim gets its own billing provider (HL 20) and subscriber (HL 22)
 * loop; claims for dependents add a patient loop (HL 23) under the subscriber.
 */
public class ProfessionalClaimFormatter extends X12Formatter {

    public ProfessionalClaimFormatter(X12Writer writer, String payerName, String payerId) {
        super(writer, payerName, payerId);
    }

    public String generate837p(List<ProfessionalClaim> claims) {
        List<String> body = new ArrayList<>();
        body.add(segment("BHT", "0019", "00", referenceId("BAT"), date(writer.now().toLocalDate()),
                writer.now().format(DateTimeFormatter.ofPattern("HHmm")), "CH"));
        body.add(segment("NM1", "41", "2", "HEALTHSIM SUBMITTER", "", "", "", "", "46", "HEALTHSIM"));
        body.add(segment("PER", "IC", "EDI DEPARTMENT", "TE", "8005550100"));
        body.add(segment("NM1", "40", "2", payerName, "", "", "", "", "46", payerId));

        int hl = 0;
        for (ProfessionalClaim claim : claims) {
            int billingHl = ++hl;
            body.add(segment("HL", String.valueOf(billingHl), "", "20", "1"));
            body.add(segment("NM1", "85", "2", upper(claim.provider().name()), "", "", "", "", "XX", claim.provider().npi()));
            addAddress(body, claim.provider().address());
            body.add(segment("REF", "EI", claim.provider().taxId()));

            boolean dependent = claim.relationship() != Relationship.SELF;
            int subscriberHl = ++hl;
            body.add(segment("HL", String.valueOf(subscriberHl), String.valueOf(billingHl), "22", dependent ? "1" : "0"));
            body.add(segment("SBR", "P", dependent ? "" : Relationship.SELF.x12Code(), claim.groupId(),
                    "", "", "", "", "", "CI"));
            if (dependent) {
                // subscriber details beyond the id are not carried on a dependent's claim
                body.add(segment("NM1", "IL", "1", upper(claim.patient().lastName()), "", "", "", "", "MI", claim.subscriberId()));
            } else {
                body.add(personName("IL", claim.patient(), "MI", claim.subscriberId()));
                addAddress(body, claim.patient().address());
                body.add(demographics(claim.patient()));
            }
            body.add(segment("NM1", "PR", "2", payerName, "", "", "", "", "PI", payerId));

            if (dependent) {
                body.add(segment("HL", String.valueOf(++hl), String.valueOf(subscriberHl), "23", "0"));
                body.add(segment("PAT", claim.relationship().x12Code()));
                body.add(personName("QC", claim.patient(), "", ""));
                addAddress(body, claim.patient().address());
                body.add(demographics(claim.patient()));
            }

            body.add(segment("CLM", claim.claimId(), amount(claim.totalCharge()), "", "",
                    composite("11", "B", "1"), "Y", "A", "Y", "Y"));
            body.add(diagnoses(claim.diagnosisCodes()));
            for (ClaimLine line : claim.lines()) {
                body.add(segment("LX", String.valueOf(line.lineNumber())));
                body.add(segment("SV1", composite("HC", line.cptCode()), amount(line.charge()), "UN",
                        String.valueOf(line.units()), "", "", "1"));
                body.add(segment("DTP", "472", "D8", date(claim.serviceDate())));
            }
        }
        return writer.write(X12TransactionType.PROFESSIONAL_CLAIM_837P, body);
    }

    static String diagnoses(List<String> codes) {
        String[] elements = new String[codes.size()];
        for (int i = 0; i < codes.size(); i++) {
            // first code is the principal diagnosis (ABK), the rest are other diagnoses (ABF)
            elements[i] = composite(i == 0 ? "ABK" : "ABF", codes.get(i).replace(".", ""));
        }
        return segment("HI", elements);
    }
}
