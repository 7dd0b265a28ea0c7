package io.certmanifest.manifest;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration strings of the form {@code 8760h}, {@code 1h30m}, {@code 90s} or {@code 1.5h}:
 * a sequence of decimal numbers each followed by one of the units
 * {@code h}, {@code m}, {@code s}, {@code ms}, {@code us}, {@code µs} and {@code ns}.
 */
public final class DurationParser {

    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    private DurationParser() {
        // Utility class
    }

    /**
     * Parse a duration string.
     *
     * @param text duration such as {@code 8760h}
     * @return the parsed duration
     * @throws IllegalArgumentException if the text is not a valid duration or exceeds about 2562047h
     */
    public static Duration parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty duration");
        }
        String value = text.trim();
        if ("0".equals(value)) {
            return Duration.ZERO;
        }

        Matcher matcher = COMPONENT.matcher(value);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;
        while (position < value.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)))));
            position = matcher.end();
        }
        BigInteger whole = nanos.toBigInteger();
        if (whole.bitLength() >= Long.SIZE) {
            throw new IllegalArgumentException("Invalid duration: " + text + " is out of range");
        }
        return Duration.ofNanos(whole.longValue());
    }
}
