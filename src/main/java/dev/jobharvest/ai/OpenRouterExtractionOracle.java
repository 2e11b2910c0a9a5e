package dev.jobharvest.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.config.OracleProperties;
import dev.jobharvest.http.RateGate;
import dev.jobharvest.metrics.HarvestMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Extraction oracle backed by OpenRouter, which fronts many models behind an
 * OpenAI-compatible API.
 */
@Service
@ConditionalOnProperty(name = "oracle.provider", havingValue = "openrouter", matchIfMissing = true)
public class OpenRouterExtractionOracle extends AbstractChatCompletionOracle {

    public OpenRouterExtractionOracle(
            WebClient.Builder webClientBuilder,
            OracleProperties properties,
            @Qualifier("oracleRateGate") RateGate rateGate,
            StructuredOutputValidator validator,
            HarvestMetrics metrics,
            ObjectMapper objectMapper) {
        super(webClientBuilder, properties, properties.getOpenrouter(), rateGate, validator, metrics, objectMapper);
    }

    @Override
    public String getName() {
        return "openrouter";
    }

    @Override
    protected String getDefaultBaseUrl() {
        return "https://openrouter.ai/api/v1";
    }

    @Override
    protected String getFallbackModel() {
        return "openai/gpt-4o-mini";
    }

    @Override
    protected void customizeHeaders(WebClient.Builder builder) {
        // optional attribution headers
        if (provider.getSiteUrl() != null && !provider.getSiteUrl().isBlank()) {
            builder.defaultHeader("HTTP-Referer", provider.getSiteUrl());
        }
        if (provider.getSiteTitle() != null && !provider.getSiteTitle().isBlank()) {
            builder.defaultHeader("X-Title", provider.getSiteTitle());
        }
    }
}
