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
public class ScriptHeader {

    @XmlElement(name = "To")
    private String to;

    @XmlElement(name = "From")
    private String from;

    @XmlElement(name = "MessageID")
    private String messageId;

    @XmlElement(name = "RelatesToMessageID")
    private String relatesToMessageId;

    @XmlElement(name = "SentTime")
    private String sentTime;
}
