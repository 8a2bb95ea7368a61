package dev.jobwatch.service;

/**
 * Caller input that cannot be acted on. Nothing has been changed when this is thrown.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
