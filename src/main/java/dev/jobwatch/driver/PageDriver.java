package dev.jobwatch.driver;

import java.time.Duration;

/**
 * One isolated browser session. Every step is bounded and fails with
 * {@link dev.jobwatch.service.PageFetchException} instead of waiting forever.
 * Sessions are never shared between pipeline runs and must always be closed.
 */
public interface PageDriver extends AutoCloseable {

    /**
     * Load the page and wait for it to finish loading.
     */
    void navigate(String url);

    /**
     * Wait until an element matching the CSS selector is present in the DOM.
     */
    void waitForElement(String cssSelector);

    /**
     * Pick the option with the given value in the select element matching the selector.
     */
    void selectOption(String cssSelector, String value);

    /**
     * Run a script in the page and return its result.
     */
    Object evaluate(String script, Object... args);

    /**
     * Give the page time to re-render after an interaction.
     */
    void pause(Duration duration);

    @Override
    void close();
}
