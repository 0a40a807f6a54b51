package com.solusoft.ai.healthsim.features.pharmacy.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimResponse;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimStatusCode;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlert;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaim;
import com.solusoft.ai.healthsim.features.pharmacy.model.Reject;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;
import com.solusoft.ai.healthsim.features.pharmacy.model.TransactionCode;

/**
 * Writes NCPDP Telecommunication Standard D.0 claim requests and responses.
 * <p>
 * A request starts with the 56 character transaction header, a response with the 31 character
 * response header. Each segment opens with the segment separator and the {@code AM} segment id;
 * each field is the field separator, a two character field id and the value. The group separator
 * divides transmission-level segments from the transaction.
 */
public class NcpdpTelecomFormatter {

    public static final char SEGMENT_SEPARATOR = '\u001E';
    public static final char FIELD_SEPARATOR = '\u001C';
    public static final char GROUP_SEPARATOR = '\u001D';

    public static final String VERSION = "D0";
    public static final int REQUEST_HEADER_LENGTH = 56;
    public static final int RESPONSE_HEADER_LENGTH = 31;

    private static final String NPI_QUALIFIER = "01";
    private static final String NDC_QUALIFIER = "03";
    private static final DateTimeFormatter CCYYMMDD = DateTimeFormatter.BASIC_ISO_DATE;
    private static final char[] POSITIVE = {'{', 'A', 'B', 'C', 'D', 'E', 'F', 'G', 'H', 'I'};
    private static final char[] NEGATIVE = {'}', 'J', 'K', 'L', 'M', 'N', 'O', 'P', 'Q', 'R'};

    private final String softwareVendorId;

    public NcpdpTelecomFormatter() {
        this("HEALTHSIM1");
    }

    public NcpdpTelecomFormatter(String softwareVendorId) {
        this.softwareVendorId = softwareVendorId;
    }

    public String request(PharmacyClaim claim, RxMember member) {
        TransactionCode code = claim.transactionCode() == null ? TransactionCode.B1 : claim.transactionCode();
        StringBuilder out = new StringBuilder(requestHeader(claim, code));

        out.append(segment("04",
                "C2", claim.cardholderId(),
                "C1", claim.groupNumber(),
                "C3", claim.personCode() != null ? claim.personCode() : member.getPersonCode(),
                "C6", "1"));
        if (code != TransactionCode.B2) {
            out.append(segment("01",
                    "C4", CCYYMMDD.format(member.getDemographics().dateOfBirth()),
                    "C5", member.getDemographics().gender().ncpdpCode(),
                    "CA", member.getDemographics().firstName(),
                    "CB", member.getDemographics().lastName()));
        }
        out.append(GROUP_SEPARATOR);

        if (code == TransactionCode.B2) {
            out.append(segment("07",
                    "EM", "1",
                    "D2", claim.prescriptionNumber(),
                    "E1", NDC_QUALIFIER,
                    "D7", claim.ndc(),
                    "D3", String.valueOf(claim.fillNumber())));
            return out.toString();
        }

        out.append(segment("07",
                "EM", "1",
                "D2", claim.prescriptionNumber(),
                "E1", NDC_QUALIFIER,
                "D7", claim.ndc(),
                "E7", quantity(claim.quantityDispensed()),
                "D3", String.valueOf(claim.fillNumber()),
                "D5", String.valueOf(claim.daysSupply()),
                "D8", claim.dawCode() != null ? claim.dawCode() : "0",
                "EU", claim.priorAuthNumber() != null ? "1" : null,
                "EV", claim.priorAuthNumber()));
        if (claim.prescriberNpi() != null) {
            out.append(segment("03", "EZ", NPI_QUALIFIER, "DB", claim.prescriberNpi()));
        }
        if (claim.durOverrideCode() != null && !claim.durOverrideCode().isBlank()) {
            out.append(segment("08", "7E", "1", "E5", "M0", "E6", claim.durOverrideCode()));
        }
        out.append(segment("11",
                "D9", overpunch(claim.ingredientCostSubmitted()),
                "DC", overpunch(claim.dispensingFeeSubmitted()),
                "DX", overpunch(claim.patientPaidSubmitted()),
                "DQ", overpunch(claim.usualCustomaryCharge()),
                "DU", overpunch(claim.grossAmountDue())));
        return out.toString();
    }

    public String response(ClaimResponse response, PharmacyClaim claim) {
        TransactionCode code = response.transactionCode() == null ? TransactionCode.B1 : response.transactionCode();
        StringBuilder out = new StringBuilder(responseHeader(claim, code));

        if (response.message() != null) {
            out.append(segment("20", "F4", response.message()));
        }
        out.append(GROUP_SEPARATOR);

        List<String> status = new ArrayList<>(List.of("AN", response.status().name()));
        if (response.authorizationNumber() != null) {
            status.add("F3");
            status.add(response.authorizationNumber());
        }
        if (!response.rejects().isEmpty()) {
            status.add("FA");
            status.add(String.valueOf(response.rejects().size()));
            for (Reject reject : response.rejects()) {
                status.add("FB");
                status.add(reject.code());
            }
        }
        out.append(segment("21", status.toArray(new String[0])));
        out.append(segment("22", "EM", "1", "D2", claim.prescriptionNumber()));

        if (response.status() == ClaimStatusCode.P || response.status() == ClaimStatusCode.D) {
            out.append(segment("23",
                    "F5", overpunch(response.patientPay()),
                    "F6", overpunch(response.ingredientCostPaid()),
                    "F7", overpunch(response.dispensingFeePaid()),
                    "F9", overpunch(response.planPaid()),
                    "FI", overpunch(response.copay()),
                    "4U", overpunch(response.coinsurance()),
                    "FH", overpunch(response.deductibleApplied()),
                    "FJ", overpunch(response.remainingDeductible())));
        }
        int counter = 1;
        for (DurAlert alert : response.durAlerts()) {
            out.append(segment("24",
                    "J6", String.valueOf(counter++),
                    "E4", alert.alertType().reasonForServiceCode(),
                    "FS", String.valueOf(alert.severity()),
                    "FY", truncate(alert.message(), 30)));
        }
        return out.toString();
    }

    String requestHeader(PharmacyClaim claim, TransactionCode code) {
        return fixed(claim.bin(), 6)
                + VERSION
                + code.name()
                + fixed(claim.pcn(), 10)
                + "1"
                + NPI_QUALIFIER
                + fixed(claim.pharmacyNpi(), 15)
                + date(claim.serviceDate())
                + fixed(softwareVendorId, 10);
    }

    String responseHeader(PharmacyClaim claim, TransactionCode code) {
        return VERSION
                + code.name()
                + "1"
                + "A"
                + NPI_QUALIFIER
                + fixed(claim.pharmacyNpi(), 15)
                + date(claim.serviceDate());
    }

    /**
     * Signed overpunch with two implied decimals. The last digit of the cents value carries the sign:
     * '{' and A-I for positive 0-9, '}' and J-R for negative. 8.00 is written as 80{ and -1.25 as 12N.
     */
    public static String overpunch(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        BigDecimal cents = amount.setScale(2, RoundingMode.HALF_UP).movePointRight(2);
        String digits = cents.abs().toBigInteger().toString();
        int last = digits.charAt(digits.length() - 1) - '0';
        char punch = cents.signum() < 0 ? NEGATIVE[last] : POSITIVE[last];
        return digits.substring(0, digits.length() - 1) + punch;
    }

    /** Quantity with three implied decimals. */
    public static String quantity(BigDecimal quantity) {
        if (quantity == null) {
            return null;
        }
        return quantity.setScale(3, RoundingMode.HALF_UP).movePointRight(3).toBigInteger().toString();
    }

    /** Builds a segment from field id / value pairs; null values are left out. */
    static String segment(String segmentId, String... fields) {
        StringBuilder sb = new StringBuilder()
                .append(SEGMENT_SEPARATOR).append(FIELD_SEPARATOR).append("AM").append(segmentId);
        for (int i = 0; i + 1 < fields.length; i += 2) {
            if (fields[i + 1] != null) {
                sb.append(FIELD_SEPARATOR).append(fields[i]).append(clean(fields[i + 1]));
            }
        }
        return sb.toString();
    }

    private static String clean(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c != SEGMENT_SEPARATOR && c != FIELD_SEPARATOR && c != GROUP_SEPARATOR) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String fixed(String value, int length) {
        String text = value == null ? "" : value;
        if (text.length() >= length) {
            return text.substring(0, length);
        }
        return text + " ".repeat(length - text.length());
    }

    private static String truncate(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }

    private static String date(LocalDate date) {
        return date == null ? " ".repeat(8) : CCYYMMDD.format(date);
    }
}
