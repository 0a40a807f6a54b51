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
public class ScriptPatient {

    @XmlElement(name = "MemberID")
    private String memberId;

    @XmlElement(name = "LastName")
    private String lastName;

    @XmlElement(name = "FirstName")
    private String firstName;

    @XmlElement(name = "Gender")
    private String gender;

    @XmlElement(name = "DateOfBirth")
    private String dateOfBirth;
}
