package com.solusoft.ai.healthsim.features.pharmacy.model;

public record PaQuestion(String questionId, String text, Type type, boolean required) {

    public enum Type {
        BOOLEAN, NUMERIC, DATE, CODE_LIST
    }
}
