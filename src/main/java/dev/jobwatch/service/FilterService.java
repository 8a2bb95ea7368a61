package dev.jobwatch.service;

import dev.jobwatch.model.JobListing;
import dev.jobwatch.model.KeywordSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Keeps listings that match a keyword and have not closed yet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilterService {

    private static final DateTimeFormatter CLOSING_DATE_FORMAT = DateTimeFormatter.ofPattern("d-M-uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Clock clock;

    /**
     * Apply the keyword and closing-date predicates, preserving input order.
     */
    public List<JobListing> filter(List<JobListing> listings, KeywordSet keywords) {
        LocalDate today = LocalDate.now(clock);
        List<JobListing> matches = listings.stream()
                .filter(listing -> matchesKeywords(listing, keywords))
                .filter(listing -> !isExpired(listing, today))
                .toList();

        log.info("Found {} matches (after date filter).", matches.size());
        return matches;
    }

    /**
     * Case-insensitive OR match against post name and department.
     */
    public boolean matchesKeywords(JobListing listing, KeywordSet keywords) {
        if (listing == null || keywords == null) {
            return false;
        }
        String text = nullToEmpty(listing.getPostName()) + " " + nullToEmpty(listing.getDepartment());
        return keywords.matchesAny(text);
    }

    /**
     * A listing is expired only when its closing date parses and lies before today.
     * Unknown dates are never treated as expired.
     */
    public boolean isExpired(JobListing listing, LocalDate today) {
        return parseClosingDate(listing.getClosingDate())
                .map(closing -> closing.isBefore(today))
                .orElse(false);
    }

    public Optional<LocalDate> parseClosingDate(String closingDate) {
        if (closingDate == null || closingDate.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(closingDate.strip(), CLOSING_DATE_FORMAT));
        } catch (DateTimeParseException e) {
            log.debug("Keeping listing with unparsable closing date '{}'", closingDate);
            return Optional.empty();
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
