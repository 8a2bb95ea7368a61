package dev.jobwatch.scheduler;

/**
 * What a tick does when the previous run of the same schedule has not finished.
 */
public enum OverlapPolicy {
    /** Start another run next to the one in flight. */
    ALLOW,
    /** Skip the tick and wait for the next one. */
    SKIP_IF_BUSY
}
