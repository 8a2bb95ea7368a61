package dev.jobwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Headless browser settings and the per-step bounds applied to every session.
 * Loaded from application.yml under 'browser' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "browser")
public class BrowserConfig {

    private boolean headless = true;
    private List<String> arguments = new ArrayList<>(List.of("--no-sandbox", "--disable-setuid-sandbox"));
    private Duration navigationTimeout = Duration.ofSeconds(60);
    private Duration elementTimeout = Duration.ofSeconds(30);
    private Duration scriptTimeout = Duration.ofSeconds(30);
    private Duration settleDelay = Duration.ofSeconds(3);
}
