package dev.jobharvest.config;

import dev.jobharvest.http.RateGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * One rate gate per external-service client. Every worker calling a client
 * queues on that client's gate.
 */
@Configuration
public class RateGateConfig {

    @Bean
    public RateGate pageFetchRateGate(FirecrawlProperties properties) {
        return new RateGate("firecrawl", Duration.ofMillis(properties.getRateLimitDelayMs()));
    }

    @Bean
    public RateGate oracleRateGate(OracleProperties properties) {
        return new RateGate("oracle", Duration.ofMillis(properties.getRateLimitDelayMs()));
    }
}
