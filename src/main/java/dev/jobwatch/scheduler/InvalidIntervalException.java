package dev.jobwatch.scheduler;

import dev.jobwatch.service.ValidationException;

public class InvalidIntervalException extends ValidationException {

    private final String interval;

    public InvalidIntervalException(String interval) {
        super("Invalid interval format");
        this.interval = interval;
    }

    public String getInterval() {
        return interval;
    }
}
