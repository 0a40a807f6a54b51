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
public class PaQuestionElement {

    @XmlElement(name = "QuestionID")
    private String questionId;

    @XmlElement(name = "QuestionText")
    private String questionText;

    @XmlElement(name = "QuestionType")
    private String questionType;

    @XmlElement(name = "Required")
    private boolean required;
}
