package com.solusoft.ai.healthsim.features.pharmacy.format;

import java.io.StringWriter;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.exception.FormatExportException;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.MedicationPrescribed;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.NewRx;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.PaInitiationResponse;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.PaQuestionElement;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.PaResponse;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.ScriptBody;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.ScriptHeader;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.ScriptMessage;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.ScriptPatient;
import com.solusoft.ai.healthsim.features.pharmacy.format.script.ScriptPrescriber;
import com.solusoft.ai.healthsim.features.pharmacy.model.PaQuestion;
import com.solusoft.ai.healthsim.features.pharmacy.model.PaQuestionSet;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaim;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthDecision;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Marshaller;

/**
 * Writes NCPDP SCRIPT NewRx messages and the payer side of electronic prior authorization
 * (PAInitiationResponse with its question set, PAResponse with the decision).
 */
public class NcpdpScriptFormatter {

    public static final String SCRIPT_VERSION = "2017071";

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final JAXBContext context;
    private final Clock clock;
    private final String payerId;
    private final AtomicLong messageIds = new AtomicLong();

    public NcpdpScriptFormatter(String payerId, Clock clock) {
        this.payerId = payerId;
        this.clock = clock;
        try {
            this.context = JAXBContext.newInstance(ScriptMessage.class);
        } catch (JAXBException e) {
            throw new IllegalStateException("Cannot initialise SCRIPT bindings", e);
        }
    }

    public String newRx(PharmacyClaim claim, RxMember member, String drugName, String sig, int refills) {
        MedicationPrescribed medication = new MedicationPrescribed();
        medication.setDrugDescription(drugName);
        medication.setProductCode(claim.ndc());
        medication.setProductCodeQualifier("ND");
        medication.setQuantity(claim.quantityDispensed().stripTrailingZeros().toPlainString());
        medication.setDaysSupply(claim.daysSupply());
        medication.setWrittenDate(ISO_DATE.format(claim.serviceDate()));
        medication.setSubstitutions(claim.dawCode() != null ? claim.dawCode() : "0");
        medication.setNumberOfRefills(refills);
        medication.setSig(sig);

        ScriptBody body = new ScriptBody();
        body.setNewRx(new NewRx(patient(member), new ScriptPrescriber(claim.prescriberNpi(), null), medication));
        return marshal(message(claim.prescriberNpi(), claim.pharmacyNpi(), null, body), "NewRx");
    }

    public String paInitiationResponse(PaQuestionSet questionSet, RxMember member, String paReferenceId) {
        PaInitiationResponse initiation = new PaInitiationResponse();
        initiation.setPaReferenceId(paReferenceId);
        initiation.setPatient(patient(member));
        initiation.setDrugDescription(questionSet.drugName());
        initiation.setProductCode(questionSet.ndc());
        initiation.setCriteriaGroup(questionSet.criteriaGroup() == null ? null : questionSet.criteriaGroup().name());
        for (PaQuestion question : questionSet.questions()) {
            initiation.getQuestions().add(new PaQuestionElement(question.questionId(), question.text(),
                    question.type().name(), question.required()));
        }
        ScriptBody body = new ScriptBody();
        body.setPaInitiationResponse(initiation);
        return marshal(message(payerId, "PRESCRIBER", paReferenceId, body), "PAInitiationResponse");
    }

    public String paResponse(PriorAuthDecision decision, RxMember member) {
        PaResponse response = new PaResponse();
        response.setPaReferenceId(decision.requestId());
        response.setPatient(patient(member));
        response.setProductCode(decision.ndc());
        String status = decision.status().name();
        response.setStatus(status.charAt(0) + status.substring(1).toLowerCase(Locale.ROOT));
        response.setAuthorizationNumber(decision.paNumber());
        if (decision.effectiveDate() != null) {
            response.setEffectiveDate(ISO_DATE.format(decision.effectiveDate()));
            response.setExpirationDate(ISO_DATE.format(decision.expirationDate()));
        }
        if (decision.exclusions() != null) {
            response.getReasons().addAll(decision.exclusions());
        }
        if (decision.unmetCriteria() != null) {
            response.getReasons().addAll(decision.unmetCriteria());
        }
        if (decision.missingInformation() != null) {
            decision.missingInformation().forEach(item -> response.getReasons().add("Missing: " + item));
        }
        response.setNote(decision.message());
        ScriptBody body = new ScriptBody();
        body.setPaResponse(response);
        return marshal(message(payerId, "PRESCRIBER", decision.requestId(), body), "PAResponse");
    }

    private ScriptMessage message(String from, String to, String relatesTo, ScriptBody body) {
        String messageId = "MSG" + String.format("%010d", messageIds.incrementAndGet());
        ScriptHeader header = new ScriptHeader(to, from, messageId, relatesTo,
                OffsetDateTime.now(clock).withNano(0).toString());
        return new ScriptMessage(SCRIPT_VERSION, header, body);
    }

    private static ScriptPatient patient(RxMember member) {
        return new ScriptPatient(member.getMemberId(),
                member.getDemographics().lastName(),
                member.getDemographics().firstName(),
                member.getDemographics().gender().name(),
                ISO_DATE.format(member.getDemographics().dateOfBirth()));
    }

    private String marshal(ScriptMessage message, String transaction) {
        try {
            Marshaller marshaller = context.createMarshaller();
            marshaller.setProperty(Marshaller.JAXB_FORMATTED_OUTPUT, Boolean.TRUE);
            marshaller.setProperty(Marshaller.JAXB_ENCODING, "UTF-8");
            StringWriter writer = new StringWriter();
            marshaller.marshal(message, writer);
            return writer.toString();
        } catch (JAXBException e) {
            throw new FormatExportException("NCPDP SCRIPT " + transaction, e);
        }
    }
}
