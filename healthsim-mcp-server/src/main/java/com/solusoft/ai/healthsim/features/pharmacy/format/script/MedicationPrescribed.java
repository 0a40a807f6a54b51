package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlElement;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@XmlAccessorType(XmlAccessType.FIELD)
public class MedicationPrescribed {

    @XmlElement(name = "DrugDescription")
    private String drugDescription;

    @XmlElement(name = "ProductCode")
    private String productCode;

    /** ND for NDC. */
    @XmlElement(name = "ProductCodeQualifier")
    private String productCodeQualifier;

    @XmlElement(name = "Quantity")
    private String quantity;

    @XmlElement(name = "DaysSupply")
    private Integer daysSupply;

    @XmlElement(name = "WrittenDate")
    private String writtenDate;

    @XmlElement(name = "Substitutions")
    private String substitutions;

    @XmlElement(name = "NumberOfRefills")
    private Integer numberOfRefills;

    @XmlElement(name = "Sig")
    private String sig;
}
