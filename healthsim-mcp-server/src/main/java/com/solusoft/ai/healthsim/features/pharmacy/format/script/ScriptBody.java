package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlElement;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exactly one of the transactions is set.
 */
@Data
@NoArgsConstructor
@XmlAccessorType(XmlAccessType.FIELD)
public class ScriptBody {

    @XmlElement(name = "NewRx")
    private NewRx newRx;

    @XmlElement(name = "PAInitiationResponse")
    private PaInitiationResponse paInitiationResponse;

    @XmlElement(name = "PAResponse")
    private PaResponse paResponse;
}
