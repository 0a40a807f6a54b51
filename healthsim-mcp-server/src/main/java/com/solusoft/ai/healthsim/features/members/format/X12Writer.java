package com.solusoft.ai.healthsim.features.members.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * X12 005010 interchange envelope (ISA/GS/ST ... SE/GE/IEA) and segment helpers.
 * <p>
 * Control numbers increase for every transaction written by the same instance.
 */
public class X12Writer {

    public static final char ELEMENT_SEPARATOR = '*';
    public static final char SEGMENT_TERMINATOR = '~';
    public static final char REPETITION_SEPARATOR = '^';
    public static final char COMPONENT_SEPARATOR = ':';

    private static final DateTimeFormatter YYMMDD = DateTimeFormatter.ofPattern("yyMMdd");
    private static final DateTimeFormatter CCYYMMDD = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter HHMM = DateTimeFormatter.ofPattern("HHmm");

    private final String senderId;
    private final String receiverId;
    private final String usageIndicator;
    private final Clock clock;
    private final AtomicInteger controlNumber = new AtomicInteger();

    public X12Writer(String senderId, String receiverId, String usageIndicator, Clock clock) {
        this.senderId = senderId;
        this.receiverId = receiverId;
        this.usageIndicator = usageIndicator;
        this.clock = clock;
    }

    /**
     * Wraps the transaction body (segments between ST and SE) in a full interchange.
     */
    public String write(X12TransactionType type, List<String> body) {
        int control = controlNumber.incrementAndGet();
        LocalDateTime now = LocalDateTime.now(clock);
        String stControl = String.format("%04d", control);

        List<String> segments = new ArrayList<>();
        segments.add(isa(control, now));
        segments.add(segment("GS", type.functionalId(), senderId, receiverId, now.format(CCYYMMDD),
                now.format(HHMM), String.valueOf(control), "X", type.implementationReference()));
        segments.add(segment("ST", type.transactionSetId(), stControl, type.implementationReference()));
        segments.addAll(body);
        // ST through SE inclusive
        segments.add(segment("SE", String.valueOf(body.size() + 2), stControl));
        segments.add(segment("GE", "1", String.valueOf(control)));
        segments.add(segment("IEA", "1", String.format("%09d", control)));

        StringBuilder out = new StringBuilder();
        for (String s : segments) {
            out.append(s).append(SEGMENT_TERMINATOR).append('\n');
        }
        return out.toString();
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private String isa(int control, LocalDateTime now) {
        return "ISA*00*" + pad("", 10) + "*00*" + pad("", 10)
                + "*ZZ*" + pad(senderId, 15) + "*ZZ*" + pad(receiverId, 15)
                + "*" + now.format(YYMMDD) + "*" + now.format(HHMM)
                + "*" + REPETITION_SEPARATOR + "*00501*" + String.format("%09d", control)
                + "*0*" + usageIndicator + "*" + COMPONENT_SEPARATOR;
    }

    /**
     * Joins elements with '*', dropping trailing empty elements. Null elements become empty.
     */
    public static String segment(String id, String... elements) {
        int last = elements.length - 1;
        while (last >= 0 && (elements[last] == null || elements[last].isEmpty())) {
            last--;
        }
        StringBuilder sb = new StringBuilder(id);
        for (int i = 0; i <= last; i++) {
            sb.append(ELEMENT_SEPARATOR).append(clean(elements[i]));
        }
        return sb.toString();
    }

    public static String composite(String... components) {
        return String.join(String.valueOf(COMPONENT_SEPARATOR), components);
    }

    public static String date(LocalDate date) {
        return date.format(CCYYMMDD);
    }

    public static String amount(BigDecimal value) {
        BigDecimal scaled = value.setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return scaled.scale() < 0 ? scaled.setScale(0).toPlainString() : scaled.toPlainString();
    }

    public static String upper(String value) {
        return value == null ? "" : value.toUpperCase();
    }

    private static String clean(String value) {
        if (value == null) {
            return "";
        }
        // delimiters may not appear inside element data
        return value.replace(ELEMENT_SEPARATOR, ' ')
                .replace(SEGMENT_TERMINATOR, ' ')
                .replace(REPETITION_SEPARATOR, ' ');
    }

    private static String pad(String value, int width) {
        String v = value.length() > width ? value.substring(0, width) : value;
        return String.format("%-" + width + "s", v);
    }
}
