package dev.jobwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Where the listing table lives and how to find it on the page.
 * Loaded from application.yml under 'source' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "source")
public class SourceConfig {

    private String url = "https://ppsc.gop.pk/planner/showdata.aspx";
    private String tableSelector = "table.dataTable";
    private String pageSizeSelector = "select[name*=\"_length\"]";
    private String pageSize = "100";
}
