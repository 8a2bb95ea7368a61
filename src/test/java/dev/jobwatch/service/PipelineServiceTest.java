package dev.jobwatch.service;

import dev.jobwatch.config.BrowserConfig;
import dev.jobwatch.config.SourceConfig;
import dev.jobwatch.driver.PageDriver;
import dev.jobwatch.driver.PageDriverFactory;
import dev.jobwatch.metrics.PipelineMetrics;
import dev.jobwatch.model.JobListing;
import dev.jobwatch.model.KeywordSet;
import dev.jobwatch.model.ScheduleSpec;
import dev.jobwatch.notify.Notifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    private static final String TABLE = "table.dataTable";
    private static final String PAGE_SIZE = "select[name*=\"_length\"]";

    @Mock
    private PageDriverFactory pageDriverFactory;

    @Mock
    private PageDriver pageDriver;

    @Mock
    private Notifier notifier;

    @Mock
    private PipelineMetrics metrics;

    private PipelineService pipelineService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(LocalDate.of(2024, 6, 15).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

        SourceConfig sourceConfig = new SourceConfig();
        sourceConfig.setUrl("http://localhost/planner/showdata.aspx");
        BrowserConfig browserConfig = new BrowserConfig();
        browserConfig.setSettleDelay(Duration.ZERO);

        pipelineService = new PipelineService(pageDriverFactory, new ExtractionService(),
                new FilterService(clock), notifier, sourceConfig, browserConfig, metrics);
    }

    private static String fixture() throws IOException {
        try (InputStream in = PipelineServiceTest.class.getResourceAsStream("/fixtures/planner-table.html")) {
            return new String(Objects.requireNonNull(in).readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void givenTable() throws IOException {
        when(pageDriverFactory.open()).thenReturn(pageDriver);
        when(pageDriver.evaluate(anyString(), eq(TABLE))).thenReturn(fixture());
    }

    private ScheduleSpec spec(String... keywords) {
        return new ScheduleSpec(KeywordSet.of(keywords), "+15550001111", "1 min");
    }

    @Nested
    @DisplayName("Finding matches")
    class FindMatchesTests {

        @Test
        @DisplayName("Should drive the page in order and close the session")
        void shouldDriveThePageAndClose() throws IOException {
            givenTable();

            StepVerifier.create(pipelineService.findMatches(KeywordSet.of("Assistant")))
                    .assertNext(matches -> assertThat(matches)
                            .extracting(JobListing::getPostName)
                            .containsExactly("Assistant Director"))
                    .verifyComplete();

            InOrder inOrder = inOrder(pageDriver);
            inOrder.verify(pageDriver).navigate("http://localhost/planner/showdata.aspx");
            inOrder.verify(pageDriver).waitForElement(TABLE);
            inOrder.verify(pageDriver).waitForElement(PAGE_SIZE);
            inOrder.verify(pageDriver).selectOption(PAGE_SIZE, "100");
            inOrder.verify(pageDriver).evaluate(anyString(), eq(TABLE));
            inOrder.verify(pageDriver).close();
            verify(metrics).recordListingsExtracted(3);
            verify(metrics).recordListingsMatched(1);
        }

        @Test
        @DisplayName("Should drop expired listings and keep undated ones")
        void shouldApplyClosingDateRule() throws IOException {
            givenTable();

            StepVerifier.create(pipelineService.findMatches(KeywordSet.of("clerk", "lecturer", "assistant")))
                    .assertNext(matches -> assertThat(matches)
                            .extracting(JobListing::getSerialNumber)
                            .containsExactly("1", "4"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should close the session when navigation fails")
        void shouldCloseSessionWhenNavigationFails() {
            when(pageDriverFactory.open()).thenReturn(pageDriver);
            doThrow(new PageFetchException("Timed out loading page")).when(pageDriver).navigate(anyString());

            StepVerifier.create(pipelineService.findMatches(KeywordSet.of("Assistant")))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(PageFetchException.class)
                            .hasMessage("Timed out loading page"))
                    .verify();

            verify(pageDriver).close();
            verify(pageDriver, never()).evaluate(anyString(), any());
            verify(metrics).recordFetchFailure();
        }

        @Test
        @DisplayName("Should wrap unexpected errors and still close the session")
        void shouldWrapUnexpectedErrors() {
            when(pageDriverFactory.open()).thenReturn(pageDriver);
            when(pageDriver.evaluate(anyString(), eq(TABLE))).thenThrow(new IllegalStateException("boom"));

            StepVerifier.create(pipelineService.findMatches(KeywordSet.of("Assistant")))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(PageFetchException.class)
                            .hasMessage("boom")
                            .hasCauseInstanceOf(IllegalStateException.class))
                    .verify();

            verify(pageDriver).close();
        }

        @Test
        @DisplayName("Should fail without closing when no session could be opened")
        void shouldFailWhenSessionCannotOpen() {
            when(pageDriverFactory.open()).thenThrow(new PageFetchException("Failed to start browser session"));

            StepVerifier.create(pipelineService.findMatches(KeywordSet.of("Assistant")))
                    .expectError(PageFetchException.class)
                    .verify();

            verifyNoInteractions(pageDriver);
        }

        @Test
        @DisplayName("Should return no listings when the table is missing")
        void shouldReturnEmptyWhenTableMissing() {
            when(pageDriverFactory.open()).thenReturn(pageDriver);
            when(pageDriver.evaluate(anyString(), eq(TABLE))).thenReturn("");

            StepVerifier.create(pipelineService.findMatches(KeywordSet.of("Assistant")))
                    .assertNext(matches -> assertThat(matches).isEmpty())
                    .verifyComplete();

            verify(pageDriver).close();
        }
    }

    @Nested
    @DisplayName("Scheduled runs")
    class RunAndNotifyTests {

        @Test
        @DisplayName("Should deliver the full match list once")
        void shouldDeliverMatchesOnce() throws IOException {
            givenTable();
            when(notifier.deliver(eq("+15550001111"), anyList())).thenReturn(Mono.just(true));

            StepVerifier.create(pipelineService.runAndNotify(spec("assistant", "lecturer")))
                    .assertNext(matches -> assertThat(matches).hasSize(2))
                    .verifyComplete();

            verify(notifier, times(1)).deliver(eq("+15550001111"),
                    argThat(list -> list.size() == 2 && list.get(0).getSerialNumber().equals("1")));
            verify(metrics).recordNotification(true);
            verify(metrics).recordRun(PipelineMetrics.TRIGGER_SCHEDULE);
        }

        @Test
        @DisplayName("Should not notify when nothing matches")
        void shouldNotNotifyWithoutMatches() throws IOException {
            givenTable();

            StepVerifier.create(pipelineService.runAndNotify(spec("Surgeon")))
                    .assertNext(matches -> assertThat(matches).isEmpty())
                    .verifyComplete();

            verify(notifier, never()).deliver(anyString(), anyList());
        }

        @Test
        @DisplayName("Should swallow fetch errors so the schedule keeps going")
        void shouldSwallowFetchErrors() {
            when(pageDriverFactory.open()).thenReturn(pageDriver);
            doThrow(new PageFetchException("selector not found")).when(pageDriver).waitForElement(TABLE);

            StepVerifier.create(pipelineService.runAndNotify(spec("Assistant")))
                    .assertNext(matches -> assertThat(matches).isEmpty())
                    .verifyComplete();

            verify(pageDriver).close();
            verify(notifier, never()).deliver(anyString(), anyList());
        }

        @Test
        @DisplayName("Should count a failed delivery without failing the run")
        void shouldCountFailedDelivery() throws IOException {
            givenTable();
            when(notifier.deliver(anyString(), anyList())).thenReturn(Mono.just(false));
            when(notifier.getChannel()).thenReturn("email");

            StepVerifier.create(pipelineService.runAndNotify(spec("Assistant")))
                    .assertNext(matches -> assertThat(matches).hasSize(1))
                    .verifyComplete();

            verify(metrics).recordNotification(false);
        }
    }
}
