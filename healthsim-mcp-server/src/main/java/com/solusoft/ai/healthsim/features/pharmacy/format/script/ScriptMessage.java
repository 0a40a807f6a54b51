package com.solusoft.ai.healthsim.features.pharmacy.format.script;

import jakarta.xml.bind.annotation.XmlAccessType;
import jakarta.xml.bind.annotation.XmlAccessorType;
import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlRootElement;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@XmlRootElement(name = "Message")
@XmlAccessorType(XmlAccessType.FIELD)
public class ScriptMessage {

    @XmlAttribute(name = "version")
    private String version;

    @XmlElement(name = "Header")
    private ScriptHeader header;

    @XmlElement(name = "Body")
    private ScriptBody body;
}
