package dev.jobwatch.driver.impl;

import dev.jobwatch.driver.PageDriver;
import dev.jobwatch.service.PageFetchException;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;

/**
 * {@link PageDriver} backed by a Selenium {@link WebDriver}.
 */
@Slf4j
public class SeleniumPageDriver implements PageDriver {

    private final WebDriver driver;
    private final Duration elementTimeout;

    public SeleniumPageDriver(WebDriver driver, Duration elementTimeout) {
        this.driver = driver;
        this.elementTimeout = elementTimeout;
    }

    @Override
    public void navigate(String url) {
        log.debug("Navigating to {}", url);
        try {
            driver.get(url);
        } catch (TimeoutException e) {
            throw new PageFetchException("Timed out loading " + url, e);
        } catch (WebDriverException e) {
            throw new PageFetchException("Navigation to " + url + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public void waitForElement(String cssSelector) {
        log.debug("Waiting up to {} for '{}'", elementTimeout, cssSelector);
        try {
            new WebDriverWait(driver, elementTimeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
        } catch (TimeoutException e) {
            throw new PageFetchException("Timed out after " + elementTimeout + " waiting for '" + cssSelector + "'", e);
        } catch (WebDriverException e) {
            throw new PageFetchException("Waiting for '" + cssSelector + "' failed: " + firstLine(e), e);
        }
    }

    @Override
    public void selectOption(String cssSelector, String value) {
        try {
            new Select(driver.findElement(By.cssSelector(cssSelector))).selectByValue(value);
        } catch (WebDriverException | UnsupportedOperationException e) {
            throw new PageFetchException("Could not select '" + value + "' in '" + cssSelector + "'", e);
        }
    }

    @Override
    public Object evaluate(String script, Object... args) {
        if (!(driver instanceof JavascriptExecutor executor)) {
            throw new PageFetchException("Browser session cannot execute scripts");
        }
        try {
            return executor.executeScript(script, args);
        } catch (WebDriverException e) {
            throw new PageFetchException("In-page evaluation failed: " + firstLine(e), e);
        }
    }

    @Override
    public void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException("Interrupted while waiting for the page to settle", e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
            log.debug("Browser session closed");
        } catch (WebDriverException e) {
            log.warn("Error closing browser session: {}", e.getMessage());
        }
    }

    // Selenium messages carry several lines of build and driver info
    private static String firstLine(WebDriverException e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
