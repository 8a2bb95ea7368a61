package dev.jobwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobWatchApplication.class, args);
    }
}
