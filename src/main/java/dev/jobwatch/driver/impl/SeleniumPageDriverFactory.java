package dev.jobwatch.driver.impl;

import dev.jobwatch.config.BrowserConfig;
import dev.jobwatch.driver.PageDriver;
import dev.jobwatch.driver.PageDriverFactory;
import dev.jobwatch.service.PageFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts a headless Chrome per session. The driver binary is resolved by Selenium Manager.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeleniumPageDriverFactory implements PageDriverFactory {

    private final BrowserConfig browserConfig;

    @Override
    public PageDriver open() {
        log.debug("Starting Chrome session (headless={})", browserConfig.isHeadless());
        WebDriver driver;
        try {
            driver = new ChromeDriver(buildOptions());
        } catch (WebDriverException e) {
            throw new PageFetchException("Failed to start browser session: " + e.getMessage(), e);
        }

        try {
            driver.manage().timeouts().pageLoadTimeout(browserConfig.getNavigationTimeout());
            driver.manage().timeouts().scriptTimeout(browserConfig.getScriptTimeout());
        } catch (WebDriverException e) {
            driver.quit();
            throw new PageFetchException("Failed to configure browser session: " + e.getMessage(), e);
        }
        return new SeleniumPageDriver(driver, browserConfig.getElementTimeout());
    }

    ChromeOptions buildOptions() {
        ChromeOptions options = new ChromeOptions();
        if (browserConfig.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(browserConfig.getArguments());
        options.addArguments("--disable-dev-shm-usage", "--disable-gpu", "--window-size=1920,1080");
        options.setExperimentalOption("excludeSwitches", List.of("enable-automation"));
        options.setPageLoadStrategy(PageLoadStrategy.NORMAL);
        return options;
    }
}
