package dev.jobwatch.service;

/**
 * The browser session could not produce the listing table.
 */
public class PageFetchException extends RuntimeException {

    public PageFetchException(String message) {
        super(message);
    }

    public PageFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
