package dev.jobharvest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for the extraction oracle (LLM chat completions).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "oracle")
public class OracleProperties {

    private String provider = "openrouter";
    private int maxRetries = 4;
    private double temperature = 0.2;
    private int maxTokens = 2000;
    private int timeoutSeconds = 60;
    private long rateLimitDelayMs = 500;
    private long rateLimitCooldownMs = 10000;
    private long backoffStepMs = 750;
    private String modelJobLinks;
    private String modelJobFields;
    private Provider openrouter = new Provider();
    private Provider groq = new Provider();

    @Data
    public static class Provider {
        private String apiKey;
        private String baseUrl;
        private String model;
        private String siteUrl;
        private String siteTitle;
    }
}
