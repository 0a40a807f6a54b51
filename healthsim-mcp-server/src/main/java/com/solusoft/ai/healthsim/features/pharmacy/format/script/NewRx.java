package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlElement;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@XmlAccessorType(XmlAccessType.FIELD)
public class NewRx {

    @XmlElement(name = "Patient")
    private ScriptPatient patient;

    @XmlElement(name = "Prescriber")
    private ScriptPrescriber prescriber;

    @XmlElement(name = "MedicationPrescribed")
    private MedicationPrescribed medicationPrescribed;
}
