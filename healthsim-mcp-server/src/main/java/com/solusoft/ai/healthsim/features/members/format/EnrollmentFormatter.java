package com.solusoft.ai.healthsim.features.members.format;

import static com.solusoft.ai.healthsim.features.members.format.X12Writer.date;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.segment;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.model.MemberStatus;
import com.solusoft.ai.healthsim.features.members.model.Plan;
import com.solusoft.ai.healthsim.features.members.service.PlanCatalog;

/**
 * 834 benefit enrollment and maintenance.
 */
public class EnrollmentFormatter extends X12Formatter {

    public EnrollmentFormatter(X12Writer writer, String payerName, String payerId) {
        super(writer, payerName, payerId);
    }

    public String generate834(List<Member> members) {
        List<String> body = new ArrayList<>();
        String reference = referenceId("ENR");
        body.add(segment("BGN", "00", reference, date(writer.now().toLocalDate()),
                writer.now().format(DateTimeFormatter.ofPattern("HHmm")), "", "", "", "2"));
        String groupId = members.isEmpty() ? "" : members.get(0).groupId();
        body.add(segment("REF", "38", groupId));
        body.add(segment("DTP", "007", "D8", date(writer.now().toLocalDate())));
        body.add(segment("N1", "P5", "HEALTHSIM EMPLOYER GROUP", "FI", "999999999"));
        body.add(segment("N1", "IN", payerName, "FI", payerId));

        for (Member member : members) {
            boolean termed = member.status() == MemberStatus.TERMED;
            Plan plan = PlanCatalog.get(member.planCode());
            // INS03: 021 addition, 024 cancellation/termination; INS08: FT full time, TE terminated
            body.add(segment("INS", member.isSubscriber() ? "Y" : "N", member.relationship().x12Code(),
                    termed ? "024" : "021", termed ? "07" : "28", "A", "", "", termed ? "TE" : "FT"));
            body.add(segment("REF", "0F", member.subscriberId()));
            body.add(segment("REF", "1L", member.groupId()));
            body.add(segment("REF", "23", member.memberId()));
            body.add(segment("DTP", "356", "D8", date(member.coverageStart())));
            if (termed) {
                body.add(segment("DTP", "357", "D8", date(member.coverageEnd())));
            }
            body.add(personName("IL", member.demographics(), "34", member.memberId()));
            body.add(segment("PER", "IP", "", "HP", member.demographics().phone().replaceAll("\\D", "")));
            addAddress(body, member.demographics().address());
            body.add(demographics(member.demographics()));
            body.add(segment("HD", termed ? "024" : "021", "", "HLT", plan.code(), "IND"));
            body.add(segment("DTP", "348", "D8", date(member.coverageStart())));
            if (termed) {
                body.add(segment("DTP", "349", "D8", date(member.coverageEnd())));
            }
        }
        return writer.write(X12TransactionType.ENROLLMENT_834, body);
    }
}
