package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import java.util.ArrayList;
import java.util.List;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payer reply to a PA initiation request carrying the question set the prescriber must answer.
 */
@Data
@NoArgsConstructor
@XmlAccessorType(XmlAccessType.FIELD)
public class PaInitiationResponse {

    @XmlElement(name = "PAReferenceID")
    private String paReferenceId;

    @XmlElement(name = "Patient")
    private ScriptPatient patient;

    @XmlElement(name = "DrugDescription")
    private String drugDescription;

    @XmlElement(name = "ProductCode")
    private String productCode;

    @XmlElement(name = "CriteriaGroup")
    private String criteriaGroup;

    @XmlElementWrapper(name = "QuestionSet")
    @XmlElement(name = "Question")
    private List<PaQuestionElement> questions = new ArrayList<>();
}
