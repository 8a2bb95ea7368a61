package dev.jobwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pagination defaults for on-demand search.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "search")
public class SearchConfig {

    private int defaultPage = 1;
    private int defaultLimit = 15;
}
