package com.solusoft.ai.healthsim.features.members.format;

import static com.solusoft.ai.healthsim.features.members.format.X12Writer.date;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.segment;
import static com.solusoft.ai.healthsim.features.members.format.X12Writer.upper;

import java.time.format.DateTimeFormatter;
import java.util.List;

import com.solusoft.ai.healthsim.common.model.Address;
import com.solusoft.ai.healthsim.common.model.Demographics;

/**
 * Common ground for the transaction formatters: the envelope writer and the payer identity.
 */
public abstract class X12Formatter {

    private static final DateTimeFormatter REFERENCE_TIME = DateTimeFormatter.ofPattern("yyMMddHHmmss");

    protected final X12Writer writer;
    protected final String payerName;
    protected final String payerId;

    protected X12Formatter(X12Writer writer, String payerName, String payerId) {
        this.writer = writer;
        this.payerName = payerName;
        this.payerId = payerId;
    }

    protected static String personName(String entity, Demographics person, String idQualifier, String id) {
        return segment("NM1", entity, "1", upper(person.lastName()), upper(person.firstName()),
                person.middleName() == null ? "" : upper(person.middleName().substring(0, 1)), "", "", idQualifier, id);
    }

    protected static void addAddress(List<String> segments, Address address) {
        segments.add(segment("N3", upper(address.line1())));
        segments.add(segment("N4", upper(address.city()), address.state(), address.postalCode()));
    }

    protected static String demographics(Demographics person) {
        return segment("DMG", "D8", date(person.dateOfBirth()), person.gender().name());
    }

    protected String referenceId(String prefix) {
        return prefix + writer.now().format(REFERENCE_TIME);
    }
}
