package dev.jobharvest.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.config.OracleProperties;
import dev.jobharvest.error.ExtractionException;
import dev.jobharvest.http.RateGate;
import dev.jobharvest.metrics.HarvestMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ExtractionOracle over an OpenAI-compatible {@code /chat/completions} endpoint.
 * Each attempt requests a JSON object, extracts the JSON text from the answer,
 * parses it and validates it against the request schema. Failed attempts are
 * retried through {@link Retry} with a linear backoff; retries carry a tightened prompt.
 */
@Slf4j
public abstract class AbstractChatCompletionOracle implements ExtractionOracle {

    static final String CHAT_PATH = "/chat/completions";
    static final String JSON_ONLY_DIRECTIVE = "Return ONLY a valid JSON object that conforms to the schema. "
            + "Do not include markdown, code fences, or any explanation.";
    private static final int SNIPPET_LENGTH = 280;

    protected final OracleProperties properties;
    protected final OracleProperties.Provider provider;
    private final WebClient webClient;
    private final RateGate rateGate;
    private final StructuredOutputValidator validator;
    private final HarvestMetrics metrics;
    private final ObjectMapper objectMapper;

    protected AbstractChatCompletionOracle(
            WebClient.Builder webClientBuilder,
            OracleProperties properties,
            OracleProperties.Provider provider,
            RateGate rateGate,
            StructuredOutputValidator validator,
            HarvestMetrics metrics,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.provider = provider;
        this.rateGate = rateGate;
        this.validator = validator;
        this.metrics = metrics;
        this.objectMapper = objectMapper;

        String baseUrl = provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()
                ? provider.getBaseUrl()
                : getDefaultBaseUrl();
        WebClient.Builder builder = webClientBuilder
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json");

        String apiKey = provider.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("{} API key is missing! Structured extraction will fail.", getName());
        } else {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
            log.info("{} extraction oracle enabled with model: {}", getName(), getDefaultModel());
        }
        customizeHeaders(builder);
        this.webClient = builder.build();
    }

    protected abstract String getDefaultBaseUrl();

    protected abstract String getFallbackModel();

    /**
     * Hook for provider-specific headers.
     */
    protected void customizeHeaders(WebClient.Builder builder) {
    }

    public String getDefaultModel() {
        return provider.getModel() != null && !provider.getModel().isBlank()
                ? provider.getModel()
                : getFallbackModel();
    }

    @Override
    public JsonNode completeJson(OracleRequest request) {
        int retries = Math.max(request.maxRetries() != null ? request.maxRetries() : properties.getMaxRetries(), 0);
        int attempts = retries + 1;
        String model = request.model() != null && !request.model().isBlank() ? request.model() : getDefaultModel();
        AtomicInteger attempt = new AtomicInteger();
        AtomicReference<String> lastRaw = new AtomicReference<>("");

        return Mono.defer(() -> {
                    int current = attempt.incrementAndGet();
                    metrics.recordOracleAttempt();
                    String userPrompt = current == 1
                            ? request.userPrompt()
                            : request.userPrompt() + "\n\n" + JSON_ONLY_DIRECTIVE;
                    return chat(model, request.systemPrompt(), userPrompt)
                            .doOnNext(lastRaw::set)
                            .map(content -> validated(request.schema(), parse(content)))
                            .doOnError(AttemptFailedException.class, e -> {
                                metrics.recordOracleFailure();
                                log.warn("{} attempt {}/{} failed: {}", getName(), current, attempts, e.getMessage());
                            });
                })
                .retryWhen(Retry.max(retries)
                        .filter(AttemptFailedException.class::isInstance)
                        .doBeforeRetryAsync(signal -> Mono.delay(
                                Duration.ofMillis(properties.getBackoffStepMs() * (signal.totalRetries() + 1))).then())
                        .onRetryExhaustedThrow((spec, signal) -> new ExtractionException(getName()
                                + " failed to produce valid JSON after " + attempts + " attempts: "
                                + signal.failure().getMessage() + ". Raw output: \"" + snippet(lastRaw.get()) + "\"")))
                .block();
    }

    private JsonNode validated(JsonNode schema, JsonNode parsed) {
        List<String> violations = validator.validate(schema, parsed);
        if (!violations.isEmpty()) {
            throw new AttemptFailedException("Schema validation failed: " + String.join("; ", violations));
        }
        return parsed;
    }

    private JsonNode parse(String content) {
        String text = JsonTextExtractor.extract(content);
        if (text.isEmpty()) {
            throw new AttemptFailedException("JSON parsing failed: empty response");
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new AttemptFailedException("JSON parsing failed: " + e.getOriginalMessage());
        }
    }

    /**
     * One chat call. A 429 is retried once after the rate-limit cooldown; any other
     * non-2xx answer is final.
     */
    private Mono<String> chat(String model, String systemPrompt, String userPrompt) {
        ChatRequest body = new ChatRequest(
                model,
                List.of(new Message("system", systemPrompt), new Message("user", userPrompt)),
                properties.getTemperature(),
                properties.getMaxTokens(),
                new ResponseFormat("json_object"));
        return Mono.defer(() -> send(body))
                .retryWhen(Retry.fixedDelay(1, Duration.ofMillis(properties.getRateLimitCooldownMs()))
                        .filter(AbstractChatCompletionOracle::isRateLimited)
                        .doBeforeRetry(signal -> log.warn("{} rate limited - retrying once in {}ms",
                                getName(), properties.getRateLimitCooldownMs()))
                        .onRetryExhaustedThrow((spec, signal) ->
                                new AttemptFailedException(getName() + " still rate limited after cooldown")))
                .onErrorMap(WebClientResponseException.class, this::rejected)
                .map(this::extractContent)
                .switchIfEmpty(Mono.error(() -> new AttemptFailedException(getName() + " returned no choices")));
    }

    private Mono<ChatResponse> send(ChatRequest body) {
        rateGate.acquire();
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(CHAT_PATH)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .onErrorMap(TimeoutException.class, e -> new AttemptFailedException(
                        getName() + " timed out after " + properties.getTimeoutSeconds() + "s"))
                .onErrorMap(WebClientRequestException.class, e -> new AttemptFailedException(
                        getName() + " request failed: " + e.getMessage()))
                .doOnTerminate(() -> metrics.recordCallLatency(getName(), System.currentTimeMillis() - start));
    }

    private static boolean isRateLimited(Throwable e) {
        return e instanceof WebClientResponseException
                && ((WebClientResponseException) e).getStatusCode().value() == 429;
    }

    private String extractContent(ChatResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new AttemptFailedException(getName() + " returned no choices");
        }
        String content = response.choices().get(0).message().content();
        return content == null ? "" : content;
    }

    private ExtractionException rejected(WebClientResponseException e) {
        return new ExtractionException(getName() + " request failed with HTTP " + e.getStatusCode().value()
                + ". Details: " + e.getResponseBodyAsString(), e);
    }

    static String snippet(String raw) {
        String s = raw == null ? "" : raw;
        if (s.length() > SNIPPET_LENGTH) {
            s = s.substring(0, SNIPPET_LENGTH);
        }
        return s.replace("\n", "\\n");
    }

    /**
     * One attempt that produced no usable object.
     */
    private static final class AttemptFailedException extends RuntimeException {
        AttemptFailedException(String message) {
            super(message);
        }
    }

    // OpenAI compatible DTOs
    record ChatRequest(
            String model,
            List<Message> messages,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens,
            @JsonProperty("response_format") ResponseFormat responseFormat) {
    }

    record ResponseFormat(String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
        }
    }
}
