package dev.jobwatch.driver;

/**
 * Opens fresh {@link PageDriver} sessions.
 */
public interface PageDriverFactory {

    PageDriver open();
}
