package com.solusoft.ai.healthsim.features.members.format;

import static com.solusoft.ai.healthsim.features.members.format.X12Writer.amount;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.date;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.segment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.features.members.model.Accumulator;
import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.model.Plan;
import com.solusoft.ai.healthsim.features.members.service.PlanCatalog;

/**
 * 270 eligibility inquiry and 271 eligibility response.
 */
public class EligibilityFormatter extends X12Formatter {

    private static final String PROVIDER_NAME = "HEALTHSIM CLINIC";
    private static final String PROVIDER_NPI = "1234567893";

    public EligibilityFormatter(X12Writer writer, String payerName, String payerId) {
        super(writer, payerName, payerId);
    }

    public String generate270(Member member) {
        List<String> body = header("13", member);
        body.add(segment("DTP", "291", "D8", date(writer.now().toLocalDate())));
        body.add(segment("EQ", "30"));
        return writer.write(X12TransactionType.ELIGIBILITY_INQUIRY_270, body);
    }

    public String generate271(Member member, boolean includeBenefits) {
        LocalDate asOf = writer.now().toLocalDate();
        Plan plan = PlanCatalog.get(member.planCode());
        List<String> body = header("11", member);
        body.add(segment("DTP", "346", "D8", date(member.coverageStart())));
        if (member.coverageEnd() != null) {
            body.add(segment("DTP", "347", "D8", date(member.coverageEnd())));
        }

        if (!member.isCoveredOn(asOf)) {
            // EB01 6: inactive
            body.add(segment("EB", "6", "IND", "30", "", plan.name()));
            return writer.write(X12TransactionType.ELIGIBILITY_RESPONSE_271, body);
        }
        body.add(segment("EB", "1", "IND", "30", plan.planType().name().equals("HMO") ? "HM" : "PR", plan.name()));
        if (includeBenefits) {
            Accumulator deductible = member.deductible();
            Accumulator oop = member.outOfPocket();
            // EB06 23 calendar year, 29 remaining
            body.add(segment("EB", "C", "IND", "30", "", "", "23", amount(deductible.getLimit())));
            body.add(segment("EB", "C", "IND", "30", "", "", "29", amount(deductible.remaining())));
            body.add(segment("EB", "G", "IND", "30", "", "", "23", amount(oop.getLimit())));
            body.add(segment("EB", "G", "IND", "30", "", "", "29", amount(oop.remaining())));
            body.add(segment("EB", "B", "IND", "98", "", "", "27", amount(plan.pcpCopay())));
            body.add(segment("EB", "B", "IND", "AF", "", "", "27", amount(plan.specialistCopay())));
            body.add(segment("EB", "B", "IND", "86", "", "", "27", amount(plan.erCopay())));
            body.add(segment("EB", "A", "IND", "30", "", "", "", "",
                    BigDecimal.valueOf(plan.coinsurancePercent()).divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP).toPlainString()));
        }
        return writer.write(X12TransactionType.ELIGIBILITY_RESPONSE_271, body);
    }

    private List<String> header(String purpose, Member member) {
        List<String> body = new ArrayList<>();
        body.add(segment("BHT", "0022", purpose, referenceId("ELG"), date(writer.now().toLocalDate()),
                writer.now().format(DateTimeFormatter.ofPattern("HHmm"))));
        body.add(segment("HL", "1", "", "20", "1"));
        body.add(segment("NM1", "PR", "2", payerName, "", "", "", "", "PI", payerId));
        body.add(segment("HL", "2", "1", "21", "1"));
        body.add(segment("NM1", "1P", "2", PROVIDER_NAME, "", "", "", "", "XX", PROVIDER_NPI));
        body.add(segment("HL", "3", "2", "22", "0"));
        body.add(segment("TRN", "1", member.memberId(), "9HEALTHSIM"));
        body.add(personName("IL", member.demographics(), "MI", member.memberId()));
        body.add(segment("REF", "6P", member.groupId()));
        body.add(demographics(member.demographics()));
        return body;
    }
}
