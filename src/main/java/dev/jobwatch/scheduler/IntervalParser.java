package dev.jobwatch.scheduler;

import dev.jobwatch.util.LenientNumbers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Parses intervals such as {@code "2 hours"}, {@code "1day"} or {@code "3 weeks"}.
 * The text must start with an integer and contain one of the unit markers below,
 * which are checked in declaration order and matched case-sensitively.
 */
public final class IntervalParser {

    private static final Map<String, Duration> UNITS = new LinkedHashMap<>();

    static {
        UNITS.put("min", Duration.ofMinutes(1));
        UNITS.put("hour", Duration.ofHours(1));
        UNITS.put("day", Duration.ofDays(1));
        UNITS.put("week", Duration.ofDays(7));
    }

    private IntervalParser() {
    }

    /**
     * @return the positive period described by the text
     * @throws InvalidIntervalException when there is no leading integer, no known unit,
     *                                  or the amount is not positive
     */
    public static Duration parse(String text) {
        OptionalLong amount = LenientNumbers.leadingInteger(text);
        if (amount.isEmpty() || amount.getAsLong() <= 0) {
            throw new InvalidIntervalException(text);
        }
        for (Map.Entry<String, Duration> unit : UNITS.entrySet()) {
            if (text.contains(unit.getKey())) {
                try {
                    Duration period = unit.getValue().multipliedBy(amount.getAsLong());
                    period.toMillis(); // must fit a millisecond timer
                    return period;
                } catch (ArithmeticException e) {
                    throw new InvalidIntervalException(text);
                }
            }
        }
        throw new InvalidIntervalException(text);
    }
}
