package com.whereq.dispatch.trigger;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser of the duration strings found in trigger arguments: compound unit
 * strings such as {@code 250ms} or {@code 1h30m}, or ISO-8601 such as
 * {@code PT1H30M}
 */
public final class Durations {

    private static final Pattern WHOLE = Pattern.compile("([+-]?)((?:(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:ns|us|µs|μs|ms|s|m|h))+)");
    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|μs|ms|s|m|h)");

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "μs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L);

    private Durations() {
    }

    /**
     * @throws IllegalArgumentException if the text is not a duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty duration");
        }
        String value = text.trim();
        if ("0".equals(value)) {
            return Duration.ZERO;
        }
        Matcher whole = WHOLE.matcher(value);
        if (whole.matches()) {
            BigDecimal nanos = BigDecimal.ZERO;
            Matcher part = PART.matcher(whole.group(2));
            while (part.find()) {
                BigDecimal amount = new BigDecimal(part.group(1).endsWith(".") ? part.group(1) + "0" : part.group(1));
                nanos = nanos.add(amount.multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(part.group(2)))));
            }
            Duration duration = Duration.ofNanos(nanos.longValue());
            return "-".equals(whole.group(1)) ? duration.negated() : duration;
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: " + text, e);
        }
    }
}
