package dev.jobwatch.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Ordered, case-insensitive keywords combined with OR.
 */
public record KeywordSet(List<String> values) {

    public KeywordSet {
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Build a set from caller input, dropping null and blank entries.
     * Kept entries are used verbatim, surrounding spaces included.
     */
    public static KeywordSet of(Collection<String> raw) {
        if (raw == null) {
            return new KeywordSet(List.of());
        }
        return new KeywordSet(raw.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .toList());
    }

    public static KeywordSet of(String... keywords) {
        return keywords == null ? of((Collection<String>) null) : of(Arrays.asList(keywords));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * True when any keyword occurs in the text, ignoring case.
     */
    public boolean matchesAny(String text) {
        if (text == null || values.isEmpty()) {
            return false;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        return values.stream().anyMatch(keyword -> haystack.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    @Override
    public String toString() {
        return String.join(", ", values);
    }
}
