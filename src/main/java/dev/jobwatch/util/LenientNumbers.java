package dev.jobwatch.util;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort integer parsing for loosely typed request values.
 * Reads the leading integer of a string and ignores whatever follows it.
 */
public final class LenientNumbers {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private LenientNumbers() {
    }

    /**
     * Parse the integer at the start of the text, e.g. {@code " 2 hours"} gives 2.
     *
     * @return the value, or empty when the text has no leading integer or it overflows a long
     */
    public static OptionalLong leadingInteger(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        Matcher matcher = LEADING_INTEGER.matcher(text);
        if (!matcher.find()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Parse a positive int, falling back when the text is absent, non-numeric or not positive.
     */
    public static int positiveIntOrDefault(String text, int fallback) {
        OptionalLong parsed = leadingInteger(text);
        if (parsed.isEmpty() || parsed.getAsLong() < 1 || parsed.getAsLong() > Integer.MAX_VALUE) {
            return fallback;
        }
        return (int) parsed.getAsLong();
    }
}
