package dev.jobwatch.model;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of the scheduler slot.
 */
public record ScheduleStatus(
        boolean active,
        List<String> keywords,
        String interval,
        Long intervalMillis,
        String recipient,
        Instant startedAt) {

    public static ScheduleStatus idle() {
        return new ScheduleStatus(false, List.of(), null, null, null, null);
    }
}
