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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * The fetch, extract, filter and notify pipeline shared by search and the scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineService {

    static final String TABLE_HTML_SCRIPT =
            "var table = document.querySelector(arguments[0]); return table ? table.outerHTML : '';";

    private final PageDriverFactory pageDriverFactory;
    private final ExtractionService extractionService;
    private final FilterService filterService;
    private final Notifier notifier;
    private final SourceConfig sourceConfig;
    private final BrowserConfig browserConfig;
    private final PipelineMetrics metrics;

    /**
     * Fetch the source table once and return the listings that match.
     * Fetch failures surface as {@link PageFetchException}.
     */
    public Mono<List<JobListing>> findMatches(KeywordSet keywords) {
        return fetchListings()
                .map(listings -> {
                    List<JobListing> matches = filterService.filter(listings, keywords);
                    metrics.recordListingsMatched(matches.size());
                    return matches;
                });
    }

    /**
     * One scheduled run: find matches and hand them to the notifier when there are any.
     * Errors are logged and end the run with an empty result so the schedule keeps going.
     */
    public Mono<List<JobListing>> runAndNotify(ScheduleSpec spec) {
        log.info("[Scheduler] Running task for keywords: {}", spec.keywords());
        metrics.recordRun(PipelineMetrics.TRIGGER_SCHEDULE);

        return findMatches(spec.keywords())
                .flatMap(matches -> {
                    if (matches.isEmpty()) {
                        log.info("[Scheduler] No matching jobs found.");
                        return Mono.just(matches);
                    }
                    return notifier.deliver(spec.recipient(), matches)
                            .defaultIfEmpty(false)
                            .doOnNext(delivered -> {
                                metrics.recordNotification(delivered);
                                if (!Boolean.TRUE.equals(delivered)) {
                                    log.warn("[Scheduler] {} notifier reported a failed delivery to {}",
                                            notifier.getChannel(), spec.recipient());
                                }
                            })
                            .thenReturn(matches);
                })
                .onErrorResume(e -> {
                    log.error("[Scheduler] Error: {}", e.getMessage(), e);
                    return Mono.just(List.of());
                });
    }

    /**
     * Open a fresh browser session, read the table and close the session on every exit path.
     */
    public Mono<List<JobListing>> fetchListings() {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return Mono.using(
                            pageDriverFactory::open,
                            driver -> Mono.fromCallable(() -> scrape(driver)),
                            PageDriver::close)
                    .doOnTerminate(() -> metrics.recordFetchLatency(System.currentTimeMillis() - start));
        })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(listings -> metrics.recordListingsExtracted(listings.size()))
                .doOnError(e -> metrics.recordFetchFailure())
                .onErrorMap(e -> !(e instanceof PageFetchException),
                        e -> new PageFetchException(e.getMessage(), e));
    }

    private List<JobListing> scrape(PageDriver driver) {
        log.info("Navigating to {}...", sourceConfig.getUrl());
        driver.navigate(sourceConfig.getUrl());

        log.info("Waiting for table...");
        driver.waitForElement(sourceConfig.getTableSelector());

        log.info("Changing entries to {}...", sourceConfig.getPageSize());
        driver.waitForElement(sourceConfig.getPageSizeSelector());
        driver.selectOption(sourceConfig.getPageSizeSelector(), sourceConfig.getPageSize());
        driver.pause(browserConfig.getSettleDelay());

        log.info("Scraping data...");
        Object tableHtml = driver.evaluate(TABLE_HTML_SCRIPT, sourceConfig.getTableSelector());
        String html = tableHtml == null ? "" : tableHtml.toString();
        return extractionService.extract(extractionService.parseRows(html, sourceConfig.getUrl()));
    }
}
