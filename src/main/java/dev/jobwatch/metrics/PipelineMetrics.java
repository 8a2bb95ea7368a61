package dev.jobwatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for pipeline runs and the recurring watch.
 */
@Component
public class PipelineMetrics {

    public static final String TRIGGER_SEARCH = "search";
    public static final String TRIGGER_SCHEDULE = "schedule";

    private static final String TAG_TRIGGER = "trigger";
    private final MeterRegistry registry;

    // Counters
    private final Counter listingsExtractedCounter;
    private final Counter listingsMatchedCounter;
    private final Counter notificationsSentCounter;
    private final Counter notificationsFailedCounter;
    private final Counter fetchFailuresCounter;
    private final Counter ticksSkippedCounter;

    private final Timer fetchTimer;

    // Gauges
    private final AtomicInteger lastRunListings = new AtomicInteger(0);
    private final AtomicInteger lastRunMatches = new AtomicInteger(0);
    private final AtomicInteger scheduleActive = new AtomicInteger(0);

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.listingsExtractedCounter = Counter.builder("job_watch_listings_extracted_total")
                .description("Listings extracted from the source table")
                .register(registry);

        this.listingsMatchedCounter = Counter.builder("job_watch_listings_matched_total")
                .description("Listings that passed the keyword and closing-date filter")
                .register(registry);

        this.notificationsSentCounter = Counter.builder("job_watch_notifications_sent_total")
                .description("Notifications delivered")
                .register(registry);

        this.notificationsFailedCounter = Counter.builder("job_watch_notifications_failed_total")
                .description("Notifications the sink reported as failed")
                .register(registry);

        this.fetchFailuresCounter = Counter.builder("job_watch_fetch_failures_total")
                .description("Pipeline runs that could not fetch the source table")
                .register(registry);

        this.ticksSkippedCounter = Counter.builder("job_watch_ticks_skipped_total")
                .description("Scheduled ticks skipped because the previous run was still in flight")
                .register(registry);

        this.fetchTimer = Timer.builder("job_watch_fetch_duration")
                .description("Time to open a session and read the source table")
                .register(registry);

        Gauge.builder("job_watch_last_run_listings", lastRunListings, AtomicInteger::get)
                .description("Listings extracted in the last run")
                .register(registry);

        Gauge.builder("job_watch_last_run_matches", lastRunMatches, AtomicInteger::get)
                .description("Matches found in the last run")
                .register(registry);

        Gauge.builder("job_watch_schedule_active", scheduleActive, AtomicInteger::get)
                .description("1 while a recurring watch is installed")
                .register(registry);
    }

    /**
     * Record a pipeline run started by a search or a scheduled tick.
     */
    public void recordRun(String trigger) {
        Counter.builder("job_watch_runs_total")
                .description("Pipeline runs by trigger")
                .tag(TAG_TRIGGER, trigger)
                .register(registry)
                .increment();
    }

    public void recordListingsExtracted(int count) {
        listingsExtractedCounter.increment(count);
        lastRunListings.set(count);
    }

    public void recordListingsMatched(int count) {
        listingsMatchedCounter.increment(count);
        lastRunMatches.set(count);
    }

    public void recordNotification(boolean delivered) {
        if (delivered) {
            notificationsSentCounter.increment();
        } else {
            notificationsFailedCounter.increment();
        }
    }

    public void recordFetchFailure() {
        fetchFailuresCounter.increment();
    }

    public void recordFetchLatency(long latencyMs) {
        fetchTimer.record(Duration.ofMillis(latencyMs));
    }

    public void recordTickSkipped() {
        ticksSkippedCounter.increment();
    }

    public void setScheduleActive(boolean active) {
        scheduleActive.set(active ? 1 : 0);
    }

    public Timer getFetchTimer() {
        return fetchTimer;
    }
}
