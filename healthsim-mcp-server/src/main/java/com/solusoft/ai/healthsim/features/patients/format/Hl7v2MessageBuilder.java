package com.solusoft.ai.healthsim.features.patients.format;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.common.model.Address;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.patients.model.Diagnosis;
import com.solusoft.ai.healthsim.features.patients.model.Encounter;
import com.solusoft.ai.healthsim.features.patients.model.Observation;
import com.solusoft.ai.healthsim.features.patients.model.Patient;

/**
 * Builds HL7 v2.5.1 ADT^A01, ORM^O01 and ORU^R01 messages for PatientSim patients.
 * Segments are separated by carriage returns; MSH-10 is unique per builder instance.
 */
public class Hl7v2MessageBuilder {

    public static final String SEGMENT_SEPARATOR = "\r";
    private static final String ENCODING_CHARACTERS = "^~\\&";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final String sendingApplication;
    private final String sendingFacility;
    private final String receivingApplication;
    private final String receivingFacility;
    private final String processingId;
    private final Clock clock;
    private final AtomicLong controlSequence = new AtomicLong();

    public Hl7v2MessageBuilder() {
        this("HEALTHSIM", "HEALTHSIM_FAC", "RECEIVER", "RECEIVER_FAC", "T", Clock.systemDefaultZone());
    }

    public Hl7v2MessageBuilder(String sendingApplication, String sendingFacility, String receivingApplication,
                               String receivingFacility, String processingId, Clock clock) {
        this.sendingApplication = sendingApplication;
        this.sendingFacility = sendingFacility;
        this.receivingApplication = receivingApplication;
        this.receivingFacility = receivingFacility;
        this.processingId = processingId;
        this.clock = clock;
    }

    /** Admit/visit notification. */
    public String adtA01(Patient patient, Encounter encounter) {
        List<String> segments = new ArrayList<>();
        String now = LocalDateTime.now(clock).format(TIMESTAMP);
        segments.add(msh("ADT^A01^ADT_A01", now));
        segments.add(segment("EVN", "A01", now));
        segments.add(pid(patient));
        segments.add(pv1(encounter));
        int setId = 1;
        for (Diagnosis diagnosis : patient.diagnoses()) {
            segments.add(segment("DG1", String.valueOf(setId++), "",
                    component(diagnosis.code(), diagnosis.description(), "I10"),
                    "", date(diagnosis.onsetDate()), "F"));
        }
        return join(segments);
    }

    /** General order for a lab test. */
    public String ormO01(Patient patient, Observation order) {
        String now = LocalDateTime.now(clock).format(TIMESTAMP);
        String placerOrder = "ORD" + String.format("%08d", controlSequence.get() + 1);
        List<String> segments = new ArrayList<>();
        segments.add(msh("ORM^O01^ORM_O01", now));
        segments.add(pid(patient));
        if (!patient.encounters().isEmpty()) {
            segments.add(pv1(patient.encounters().get(patient.encounters().size() - 1)));
        }
        segments.add(segment("ORC", "NW", placerOrder, "", "", "SC", "", "", "", now));
        segments.add(segment("OBR", "1", placerOrder, "",
                component(order.loincCode(), order.display(), "LN"), "", "", date(order.effectiveDate())));
        return join(segments);
    }

    /** Unsolicited observation results. */
    public String oruR01(Patient patient, List<Observation> observations) {
        if (observations.isEmpty()) {
            throw new InvalidRequestException("ORU^R01 requires at least one observation");
        }
        String now = LocalDateTime.now(clock).format(TIMESTAMP);
        List<String> segments = new ArrayList<>();
        segments.add(msh("ORU^R01^ORU_R01", now));
        segments.add(pid(patient));
        Observation first = observations.get(0);
        String[] obr = fields(25);
        obr[0] = "1";
        obr[2] = "FIL" + patient.mrn().substring(3);
        obr[3] = component(first.category().code().toUpperCase(), first.category().display(), "HL70074");
        obr[6] = date(first.effectiveDate());
        obr[24] = "F";
        segments.add(segment("OBR", obr));
        int setId = 1;
        for (Observation observation : observations) {
            segments.add(segment("OBX",
                    String.valueOf(setId++),
                    "NM",
                    component(observation.loincCode(), observation.display(), "LN"),
                    "",
                    observation.value().toPlainString(),
                    escape(observation.unit()),
                    observation.referenceLow().toPlainString() + "-" + observation.referenceHigh().toPlainString(),
                    observation.interpretation(),
                    "", "",
                    "F",
                    "", "",
                    date(observation.effectiveDate())));
        }
        return join(segments);
    }

    /**
     * Escapes HL7 delimiters inside field content. The escape character itself goes first.
     */
    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\':
                    sb.append("\\E\\");
                    break;
                case '|':
                    sb.append("\\F\\");
                    break;
                case '^':
                    sb.append("\\S\\");
                    break;
                case '&':
                    sb.append("\\T\\");
                    break;
                case '~':
                    sb.append("\\R\\");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    private String msh(String messageType, String timestamp) {
        String controlId = "HS" + String.format("%010d", controlSequence.incrementAndGet());
        return "MSH|" + ENCODING_CHARACTERS + "|" + String.join("|",
                sendingApplication, sendingFacility, receivingApplication, receivingFacility,
                timestamp, "", messageType, controlId, processingId, "2.5.1");
    }

    private String pid(Patient patient) {
        Demographics person = patient.demographics();
        Address address = person.address();
        String identifiers = component(patient.mrn(), "", "", "HEALTHSIM", "MR")
                + "~" + component(patient.patientId(), "", "", "HEALTHSIM", "PI");
        return "PID|" + String.join("|",
                "1",
                "",
                identifiers,
                "",
                component(person.lastName(), person.firstName(), person.middleName()),
                "",
                date(person.dateOfBirth()),
                person.gender().name(),
                "",
                "",
                component(address.line1(), "", address.city(), address.state(), address.postalCode(), "USA"),
                "",
                escape(person.phone()));
    }

    private String pv1(Encounter encounter) {
        String[] pv1 = fields(45);
        pv1[0] = "1";
        pv1[1] = encounter.type().patientClass();
        pv1[2] = component(encounter.facility());
        pv1[6] = component(encounter.attendingNpi(), "", "", "", "", "", "", "", "NPI");
        pv1[18] = encounter.encounterId();
        pv1[43] = date(encounter.admitDate());
        pv1[44] = date(encounter.dischargeDate());
        return segment("PV1", pv1);
    }

    private static String[] fields(int count) {
        String[] fields = new String[count];
        Arrays.fill(fields, "");
        return fields;
    }

    private static String segment(String id, String... fields) {
        return id + "|" + String.join("|", fields);
    }

    private static String component(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('^');
            }
            sb.append(escape(parts[i]));
        }
        return sb.toString().replaceAll("\\^+$", "");
    }

    private static String date(LocalDate date) {
        return date == null ? "" : date.format(DATE);
    }

    private static String join(List<String> segments) {
        return String.join(SEGMENT_SEPARATOR, segments) + SEGMENT_SEPARATOR;
    }
}
