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
 * Extraction oracle backed by Groq's OpenAI-compatible API.
 */
@Service
@ConditionalOnProperty(name = "oracle.provider", havingValue = "groq")
public class GroqExtractionOracle extends AbstractChatCompletionOracle {

    public GroqExtractionOracle(
            WebClient.Builder webClientBuilder,
            OracleProperties properties,
            @Qualifier("oracleRateGate") RateGate rateGate,
            StructuredOutputValidator validator,
            HarvestMetrics metrics,
            ObjectMapper objectMapper) {
        super(webClientBuilder, properties, properties.getGroq(), rateGate, validator, metrics, objectMapper);
    }

    @Override
    public String getName() {
        return "groq";
    }

    @Override
    protected String getDefaultBaseUrl() {
        return "https://api.groq.com/openai/v1";
    }

    @Override
    protected String getFallbackModel() {
        return "llama-3.3-70b-versatile";
    }
}
