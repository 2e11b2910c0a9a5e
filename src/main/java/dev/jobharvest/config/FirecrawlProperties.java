package dev.jobharvest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for the page-fetch service client.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "firecrawl")
public class FirecrawlProperties {

    private String apiKey;
    private String baseUrl = "https://api.firecrawl.dev";
    private int timeoutSeconds = 30;
    private Long maxAgeMs;
    private Boolean onlyMainContent;
    private Integer waitMs;
    private long rateLimitDelayMs = 1000;
    private long rateLimitCooldownMs = 5000;
    private long serverErrorCooldownMs = 10000;
}
