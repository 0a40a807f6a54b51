package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Authorization style identifiers: a prefix, the date as yyyyMMdd and a 9 digit sequence.
 */
final class AuthorizationNumbers {

    static final int SEQUENCE_DIGITS = 9;
    static final long MAX_SEQUENCE = 999_999_999L;

    private AuthorizationNumbers() {
    }

    static String format(String prefix, LocalDate date, long sequence) {
        if (sequence < 1 || sequence > MAX_SEQUENCE) {
            throw new IllegalStateException("Authorization sequence out of range: " + sequence);
        }
        return prefix + DateTimeFormatter.BASIC_ISO_DATE.format(date) + String.format("%09d", sequence);
    }

    /** Trailing sequence of a stored number, or 0 when it does not end in 9 digits. */
    static long sequenceOf(String number) {
        if (number == null || number.length() < SEQUENCE_DIGITS) {
            return 0;
        }
        String tail = number.substring(number.length() - SEQUENCE_DIGITS);
        for (int i = 0; i < tail.length(); i++) {
            if (!Character.isDigit(tail.charAt(i))) {
                return 0;
            }
        }
        return Long.parseLong(tail);
    }
}
