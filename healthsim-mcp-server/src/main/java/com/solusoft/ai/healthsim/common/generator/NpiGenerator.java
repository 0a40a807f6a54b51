package com.solusoft.ai.healthsim.common.generator;

/**
 * National Provider Identifiers with a valid Luhn check digit (computed over the 80840 prefix).
 */
public class NpiGenerator {

    private static final String CARD_ISSUER_PREFIX = "80840";

    private final GenerationContext context;

    public NpiGenerator(GenerationContext context) {
        this.context = context;
    }

    public String generate() {
        String base = (1 + context.nextInt(2)) + context.digits(8);
        return base + checkDigit(base);
    }

    public static boolean isValid(String npi) {
        if (npi == null || !npi.matches("\\d{10}")) {
            return false;
        }
        return checkDigit(npi.substring(0, 9)) == npi.charAt(9) - '0';
    }

    static int checkDigit(String nineDigits) {
        String payload = CARD_ISSUER_PREFIX + nineDigits;
        int sum = 0;
        boolean doubleIt = true;
        for (int i = payload.length() - 1; i >= 0; i--) {
            int digit = payload.charAt(i) - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return (10 - sum % 10) % 10;
    }
}
