package dev.jobwatch.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordSetTest {

    @Test
    void shouldDropNullAndBlankEntriesAndKeepOrder() {
        KeywordSet keywords = KeywordSet.of(Arrays.asList("Engineer", null, "", "   ", "Clerk"));

        assertThat(keywords.values()).containsExactly("Engineer", "Clerk");
        assertThat(keywords).hasToString("Engineer, Clerk");
    }

    @Test
    void shouldKeepSurroundingSpacesOfKeywords() {
        KeywordSet keywords = KeywordSet.of(List.of(" IT "));

        assertThat(keywords.values()).containsExactly(" IT ");
        assertThat(keywords.matchesAny("Digital Officer Health")).isFalse();
        assertThat(keywords.matchesAny("Assistant IT Manager")).isTrue();
    }

    @Test
    void shouldDropNullEntriesFromVarargs() {
        KeywordSet keywords = KeywordSet.of("Clerk", null, "Lecturer");

        assertThat(keywords.values()).containsExactly("Clerk", "Lecturer");
        assertThat(KeywordSet.of((String[]) null).isEmpty()).isTrue();
    }

    @Test
    void shouldBeEmptyForMissingInput() {
        assertThat(KeywordSet.of((List<String>) null).isEmpty()).isTrue();
        assertThat(KeywordSet.of(List.of("  ")).isEmpty()).isTrue();
    }

    @Test
    void shouldMatchAnyKeywordIgnoringCase() {
        KeywordSet keywords = KeywordSet.of("engineer", "CLERK");

        assertThat(keywords.matchesAny("Senior Clerk Board of Revenue")).isTrue();
        assertThat(keywords.matchesAny("Assistant Civil ENGINEERING")).isTrue();
        assertThat(keywords.matchesAny("Lecturer Physics")).isFalse();
        assertThat(keywords.matchesAny(null)).isFalse();
    }

    @Test
    void emptySetShouldMatchNothing() {
        assertThat(KeywordSet.of(List.of()).matchesAny("anything at all")).isFalse();
    }
}
