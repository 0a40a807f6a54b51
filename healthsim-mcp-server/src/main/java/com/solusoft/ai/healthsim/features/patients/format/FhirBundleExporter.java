package com.solusoft.ai.healthsim.features.patients.format;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.ContactPoint;
import org.hl7.fhir.r4.model.DateTimeType;
import org.hl7.fhir.r4.model.DateType;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Enumerations;
import org.hl7.fhir.r4.model.HumanName;
import org.hl7.fhir.r4.model.Identifier;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.Observation;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.Resource;

import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.exception.FormatExportException;
import com.solusoft.ai.healthsim.features.patients.model.Diagnosis;
import com.solusoft.ai.healthsim.features.patients.model.EncounterType;
import com.solusoft.ai.healthsim.features.patients.model.Medication;

import ca.uhn.fhir.context.FhirContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders PatientSim patients as FHIR R4 bundles.
 * <p>
 * Resource ids are name-based UUIDs derived from the patient data, so exporting the same patient twice
 * yields the same bundle. References point at the {@code urn:uuid:} fullUrl of the target entry.
 */
@Slf4j
public class FhirBundleExporter {

    public static final String ICD10_SYSTEM = "http://hl7.org/fhir/sid/icd-10-cm";
    public static final String LOINC_SYSTEM = "http://loinc.org";
    public static final String RXNORM_SYSTEM = "http://www.nlm.nih.gov/research/umls/rxnorm";
    public static final String UCUM_SYSTEM = "http://unitsofmeasure.org";
    public static final String NPI_SYSTEM = "http://hl7.org/fhir/sid/us-npi";
    public static final String MRN_SYSTEM = "https://healthsim.dev/fhir/identifier/mrn";
    public static final String PATIENT_ID_SYSTEM = "https://healthsim.dev/fhir/identifier/patient";

    private static final String V2_0203 = "http://terminology.hl7.org/CodeSystem/v2-0203";
    private static final String ACT_CODE = "http://terminology.hl7.org/CodeSystem/v3-ActCode";
    private static final String CONDITION_CLINICAL = "http://terminology.hl7.org/CodeSystem/condition-clinical";
    private static final String CONDITION_VERIFICATION = "http://terminology.hl7.org/CodeSystem/condition-ver-status";
    private static final String CONDITION_CATEGORY = "http://terminology.hl7.org/CodeSystem/condition-category";
    private static final String OBSERVATION_CATEGORY = "http://terminology.hl7.org/CodeSystem/observation-category";
    private static final String INTERPRETATION = "http://terminology.hl7.org/CodeSystem/v3-ObservationInterpretation";

    private final FhirContext fhirContext;

    public FhirBundleExporter(FhirContext fhirContext) {
        this.fhirContext = fhirContext;
    }

    public Bundle toBundle(com.solusoft.ai.healthsim.features.patients.model.Patient patient) {
        return toBundle(List.of(patient), Bundle.BundleType.COLLECTION);
    }

    public Bundle toBundle(List<com.solusoft.ai.healthsim.features.patients.model.Patient> patients) {
        return toBundle(patients, Bundle.BundleType.COLLECTION);
    }

    public Bundle toBundle(List<com.solusoft.ai.healthsim.features.patients.model.Patient> patients,
                           Bundle.BundleType type) {
        if (type != Bundle.BundleType.COLLECTION && type != Bundle.BundleType.TRANSACTION) {
            throw new IllegalArgumentException("Only collection and transaction bundles are supported, got " + type);
        }
        Bundle bundle = new Bundle();
        bundle.setType(type);
        StringBuilder seed = new StringBuilder();
        for (com.solusoft.ai.healthsim.features.patients.model.Patient patient : patients) {
            seed.append(patient.patientId());
        }
        bundle.setId(uuid("Bundle", seed.toString()));

        for (com.solusoft.ai.healthsim.features.patients.model.Patient source : patients) {
            Patient fhirPatient = patient(source);
            add(bundle, fhirPatient);
            Reference subject = new Reference(fullUrl(fhirPatient)).setDisplay(source.fullName());

            int index = 0;
            for (Diagnosis diagnosis : source.diagnoses()) {
                add(bundle, condition(source.patientId() + "/" + index++, diagnosis, subject));
            }
            for (com.solusoft.ai.healthsim.features.patients.model.Encounter encounter : source.encounters()) {
                add(bundle, encounter(encounter, subject));
            }
            index = 0;
            for (Medication medication : source.medications()) {
                add(bundle, medicationRequest(source.patientId() + "/" + index++, medication, subject));
            }
            index = 0;
            for (com.solusoft.ai.healthsim.features.patients.model.Observation observation : source.observations()) {
                add(bundle, observation(source.patientId() + "/" + index++, observation, subject));
            }
        }
        bundle.setTotal(bundle.getEntry().size());
        log.debug("Built {} bundle with {} entries for {} patients", type.toCode(), bundle.getTotal(), patients.size());
        return bundle;
    }

    public String toJson(Bundle bundle) {
        try {
            return fhirContext.newJsonParser().setPrettyPrint(true).encodeResourceToString(bundle);
        } catch (RuntimeException e) {
            throw new FormatExportException("FHIR JSON", e);
        }
    }

    private void add(Bundle bundle, Resource resource) {
        Bundle.BundleEntryComponent entry = bundle.addEntry()
                .setFullUrl(fullUrl(resource))
                .setResource(resource);
        if (bundle.getType() == Bundle.BundleType.TRANSACTION) {
            entry.getRequest()
                    .setMethod(Bundle.HTTPVerb.POST)
                    .setUrl(resource.getResourceType().name());
        }
    }

    private Patient patient(com.solusoft.ai.healthsim.features.patients.model.Patient source) {
        Demographics person = source.demographics();
        Patient patient = new Patient();
        patient.setId(uuid("Patient", source.patientId()));
        patient.addIdentifier()
                .setUse(Identifier.IdentifierUse.USUAL)
                .setType(new CodeableConcept().addCoding(new Coding(V2_0203, "MR", "Medical record number")))
                .setSystem(MRN_SYSTEM)
                .setValue(source.mrn());
        patient.addIdentifier()
                .setSystem(PATIENT_ID_SYSTEM)
                .setValue(source.patientId());
        HumanName name = patient.addName()
                .setUse(HumanName.NameUse.OFFICIAL)
                .setFamily(person.lastName())
                .addGiven(person.firstName());
        if (person.middleName() != null) {
            name.addGiven(person.middleName());
        }
        patient.setGender(person.gender() == Gender.M
                ? Enumerations.AdministrativeGender.MALE
                : Enumerations.AdministrativeGender.FEMALE);
        patient.setBirthDateElement(new DateType(person.dateOfBirth().toString()));
        patient.addAddress()
                .addLine(person.address().line1())
                .setCity(person.address().city())
                .setState(person.address().state())
                .setPostalCode(person.address().postalCode())
                .setCountry("US");
        patient.addTelecom()
                .setSystem(ContactPoint.ContactPointSystem.PHONE)
                .setUse(ContactPoint.ContactPointUse.HOME)
                .setValue(person.phone());
        return patient;
    }

    private Condition condition(String key, Diagnosis diagnosis, Reference subject) {
        Condition condition = new Condition();
        condition.setId(uuid("Condition", key));
        condition.setClinicalStatus(new CodeableConcept().addCoding(new Coding(CONDITION_CLINICAL, "active", "Active")));
        condition.setVerificationStatus(
                new CodeableConcept().addCoding(new Coding(CONDITION_VERIFICATION, "confirmed", "Confirmed")));
        condition.addCategory(new CodeableConcept()
                .addCoding(new Coding(CONDITION_CATEGORY, "problem-list-item", "Problem List Item")));
        condition.setCode(new CodeableConcept()
                .addCoding(new Coding(ICD10_SYSTEM, diagnosis.code(), diagnosis.description()))
                .setText(diagnosis.description()));
        condition.setSubject(subject);
        condition.setOnset(new DateTimeType(diagnosis.onsetDate().toString()));
        return condition;
    }

    private Encounter encounter(com.solusoft.ai.healthsim.features.patients.model.Encounter source, Reference subject) {
        Encounter encounter = new Encounter();
        encounter.setId(uuid("Encounter", source.encounterId()));
        encounter.addIdentifier().setValue(source.encounterId());
        encounter.setStatus(Encounter.EncounterStatus.FINISHED);
        EncounterType type = source.type();
        encounter.setClass_(new Coding(ACT_CODE, type.actCode(), type.actDisplay()));
        encounter.addType(new CodeableConcept().setText(type.name().toLowerCase()));
        encounter.setSubject(subject);
        encounter.setPeriod(new Period()
                .setStartElement(new DateTimeType(source.admitDate().toString()))
                .setEndElement(new DateTimeType(source.dischargeDate().toString())));
        encounter.addReasonCode(new CodeableConcept().addCoding(new Coding().setSystem(ICD10_SYSTEM).setCode(source.reasonCode())));
        encounter.addParticipant().setIndividual(new Reference()
                .setIdentifier(new Identifier().setSystem(NPI_SYSTEM).setValue(source.attendingNpi())));
        encounter.setServiceProvider(new Reference().setDisplay(source.facility()));
        return encounter;
    }

    private MedicationRequest medicationRequest(String key, Medication medication, Reference subject) {
        MedicationRequest request = new MedicationRequest();
        request.setId(uuid("MedicationRequest", key));
        request.setStatus(MedicationRequest.MedicationRequestStatus.ACTIVE);
        request.setIntent(MedicationRequest.MedicationRequestIntent.ORDER);
        request.setMedication(new CodeableConcept()
                .addCoding(new Coding(RXNORM_SYSTEM, medication.rxNormCode(), medication.name() + " " + medication.dose()))
                .setText(medication.name() + " " + medication.dose()));
        request.setSubject(subject);
        request.setAuthoredOnElement(new DateTimeType(medication.startDate().toString()));
        request.addDosageInstruction().setText(
                medication.dose() + " " + medication.route() + " " + medication.frequency());
        return request;
    }

    private Observation observation(String key, com.solusoft.ai.healthsim.features.patients.model.Observation source,
                                    Reference subject) {
        Observation observation = new Observation();
        observation.setId(uuid("Observation", key));
        observation.setStatus(Observation.ObservationStatus.FINAL);
        observation.addCategory(new CodeableConcept().addCoding(
                new Coding(OBSERVATION_CATEGORY, source.category().code(), source.category().display())));
        observation.setCode(new CodeableConcept()
                .addCoding(new Coding(LOINC_SYSTEM, source.loincCode(), source.display()))
                .setText(source.display()));
        observation.setSubject(subject);
        observation.setEffective(new DateTimeType(source.effectiveDate().toString()));
        observation.setValue(quantity(source.value(), source.unit()));
        observation.addReferenceRange()
                .setLow(quantity(source.referenceLow(), source.unit()))
                .setHigh(quantity(source.referenceHigh(), source.unit()));
        observation.addInterpretation(new CodeableConcept()
                .addCoding(new Coding(INTERPRETATION, source.interpretation(), interpretationDisplay(source.interpretation()))));
        return observation;
    }

    private static Quantity quantity(java.math.BigDecimal value, String unit) {
        return new Quantity()
                .setValue(value)
                .setUnit(unit)
                .setSystem(UCUM_SYSTEM)
                .setCode(unit);
    }

    private static String interpretationDisplay(String code) {
        switch (code) {
            case "L":
                return "Low";
            case "H":
                return "High";
            default:
                return "Normal";
        }
    }

    private static String fullUrl(Resource resource) {
        return "urn:uuid:" + resource.getIdElement().getIdPart();
    }

    private static String uuid(String resourceType, String key) {
        return UUID.nameUUIDFromBytes((resourceType + "/" + key).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
