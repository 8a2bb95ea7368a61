package dev.jobwatch.scheduler;

import dev.jobwatch.config.SchedulerConfig;
import dev.jobwatch.metrics.PipelineMetrics;
import dev.jobwatch.model.ScheduleSpec;
import dev.jobwatch.model.ScheduleStatus;
import dev.jobwatch.service.PipelineService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the single recurring watch. At most one schedule is installed at a time;
 * starting a new one cancels the previous timer first.
 * <p>
 * Cancelling only stops future ticks. A run already in flight finishes on its own.
 */
@Slf4j
@Component
public class JobScheduler {

    private final TaskScheduler taskScheduler;
    private final PipelineService pipelineService;
    private final SchedulerConfig schedulerConfig;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final Object lifecycleLock = new Object();

    // guarded by lifecycleLock
    private ActiveSchedule active;

    public JobScheduler(
            @Qualifier("jobWatchTaskScheduler") TaskScheduler taskScheduler,
            PipelineService pipelineService,
            SchedulerConfig schedulerConfig,
            PipelineMetrics metrics,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.pipelineService = pipelineService;
        this.schedulerConfig = schedulerConfig;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Install the schedule, run the pipeline once right away and then every interval.
     *
     * @throws InvalidIntervalException when the interval does not parse; the current schedule is kept
     * @throws org.springframework.core.task.TaskRejectedException when the timer cannot be installed;
     *                                                             the previous schedule is gone and nothing runs
     */
    public void start(ScheduleSpec spec) {
        Duration period = IntervalParser.parse(spec.interval());

        synchronized (lifecycleLock) {
            if (active != null) {
                active.future().cancel(false);
                log.info("[Scheduler] Replacing schedule for keywords: {}", active.spec().keywords());
                active = null;
                metrics.setScheduleActive(false);
            }

            AtomicBoolean busy = new AtomicBoolean(false);
            Runnable tick = () -> trigger(spec, busy);

            // the slot stays idle if the timer cannot be installed
            Instant now = clock.instant();
            ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(tick, now.plus(period), period);
            active = new ActiveSchedule(spec, period, future, now);
            metrics.setScheduleActive(true);

            log.info("[Scheduler] Started. Interval: {} ({}ms). Phone: {}",
                    spec.interval(), period.toMillis(), spec.recipient());
            tick.run();
        }
    }

    /**
     * Cancel the installed schedule.
     *
     * @return true if a schedule was cancelled, false if there was none
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (active == null) {
                return false;
            }
            active.future().cancel(false);
            active = null;
            metrics.setScheduleActive(false);
            log.info("[Scheduler] Stopped.");
            return true;
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return active != null;
        }
    }

    public ScheduleStatus status() {
        synchronized (lifecycleLock) {
            if (active == null) {
                return ScheduleStatus.idle();
            }
            ScheduleSpec spec = active.spec();
            return new ScheduleStatus(
                    true,
                    spec.keywords().values(),
                    spec.interval(),
                    active.period().toMillis(),
                    spec.recipient(),
                    active.startedAt());
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    private void trigger(ScheduleSpec spec, AtomicBoolean busy) {
        boolean guarded = schedulerConfig.getOverlapPolicy() == OverlapPolicy.SKIP_IF_BUSY;
        if (guarded && !busy.compareAndSet(false, true)) {
            log.warn("[Scheduler] Previous run still in progress, skipping this tick");
            metrics.recordTickSkipped();
            return;
        }

        pipelineService.runAndNotify(spec)
                .doFinally(signal -> {
                    if (guarded) {
                        busy.set(false);
                    }
                })
                .subscribe(
                        matches -> log.debug("[Scheduler] Run finished with {} matches", matches.size()),
                        e -> log.error("[Scheduler] Run failed: {}", e.getMessage(), e));
    }

    private record ActiveSchedule(ScheduleSpec spec, Duration period, ScheduledFuture<?> future, Instant startedAt) {
    }
}
