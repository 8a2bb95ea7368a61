package dev.jobwatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Time and timer beans shared by the filter and the scheduler.
 */
@Slf4j
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ThreadPoolTaskScheduler jobWatchTaskScheduler(SchedulerConfig schedulerConfig) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerConfig.getPoolSize());
        scheduler.setThreadNamePrefix(schedulerConfig.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        log.info("Configured task scheduler (pool size {}, overlap policy {})",
                schedulerConfig.getPoolSize(), schedulerConfig.getOverlapPolicy());
        return scheduler;
    }
}
