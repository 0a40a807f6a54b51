package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import java.util.ArrayList;
import java.util.List;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@XmlAccessorType(XmlAccessType.FIELD)
public class PaResponse {

    @XmlElement(name = "PAReferenceID")
    private String paReferenceId;

    @XmlElement(name = "Patient")
    private ScriptPatient patient;

    @XmlElement(name = "ProductCode")
    private String productCode;

    /** Approved, Denied or Pended. */
    @XmlElement(name = "Status")
    private String status;

    @XmlElement(name = "AuthorizationNumber")
    private String authorizationNumber;

    @XmlElement(name = "EffectiveDate")
    private String effectiveDate;

    @XmlElement(name = "ExpirationDate")
    private String expirationDate;

    @XmlElementWrapper(name = "Reasons")
    @XmlElement(name = "Reason")
    private List<String> reasons = new ArrayList<>();

    @XmlElement(name = "Note")
    private String note;
}
