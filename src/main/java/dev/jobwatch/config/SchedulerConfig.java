package dev.jobwatch.config;

import dev.jobwatch.scheduler.OverlapPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Recurring watch settings.
 * Loaded from application.yml under 'scheduler' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerConfig {

    private OverlapPolicy overlapPolicy = OverlapPolicy.ALLOW;
    private int poolSize = 1;
    private String threadNamePrefix = "job-watch-";
}
