package dev.jobharvest.ats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.JobFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

@Slf4j
public abstract class AbstractAtsParser implements AtsParser {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);
    private static final int SNIPPET_LENGTH = 200;

    protected final WebClient webClient;
    protected final HarvestMetrics metrics;
    protected final ObjectMapper objectMapper;

    protected AbstractAtsParser(WebClient.Builder webClientBuilder, HarvestMetrics metrics, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent",
                        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36")
                .defaultHeader("Accept", "application/json, text/plain, */*")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Blocking GET of a JSON document.
     *
     * @throws FetchException on transport errors, non-2xx responses or a malformed body
     */
    @SuppressWarnings("null")
    protected JsonNode fetchJson(String url) {
        long start = System.currentTimeMillis();
        String raw;
        try {
            raw = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(TIMEOUT)
                    .onErrorMap(TimeoutException.class, e -> new FetchException(
                            "Timed out after " + TIMEOUT.toSeconds() + "s fetching " + url, e))
                    .doOnTerminate(() -> metrics.recordCallLatency(getName(), System.currentTimeMillis() - start))
                    .block();
        } catch (WebClientException e) {
            throw new FetchException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            throw new FetchException("Empty response from " + url);
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            String snippet = raw.length() > SNIPPET_LENGTH ? raw.substring(0, SNIPPET_LENGTH) : raw;
            throw new FetchException("Invalid JSON from " + url + ": " + e.getOriginalMessage()
                    + "; snippet=" + snippet, e);
        }
    }

    /**
     * Returns the object under {@code field}, failing when the payload lacks it.
     */
    protected JsonNode requireObject(JsonNode payload, String field, String what) {
        JsonNode value = payload == null ? null : payload.get(field);
        if (value == null || !value.isObject()) {
            throw new FetchException(what + " missing '" + field + "'");
        }
        return value;
    }

    /**
     * Trimmed text of a string field, or "" when the field is absent or not a string.
     */
    protected static String cleanText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual()) {
            return "";
        }
        return value.asText().strip();
    }

    /**
     * First non-blank value, trimmed; "" when there is none.
     */
    protected static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.strip();
            }
        }
        return "";
    }

    /**
     * Numeric value of a number or a thousands-separated string; null when absent or unparseable.
     */
    protected static Double coerceNumber(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            String cleaned = value.asText().strip().replace(",", "");
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException e) {
                log.debug("Unparseable number '{}'", value.asText());
                return null;
            }
        }
        return null;
    }

    /**
     * Company name from a board slug (e.g. "acme-labs" -> "Acme labs").
     */
    protected static String formatCompanyName(String slug) {
        if (slug == null || slug.isBlank()) {
            return "";
        }
        String spaced = slug.replace("-", " ");
        if (spaced.length() < 2) {
            return spaced.toUpperCase();
        }
        return spaced.substring(0, 1).toUpperCase() + spaced.substring(1);
    }

    /**
     * Text the remote-work fallback scans when the payload carries no remote flag.
     */
    protected static String searchableMarkup(JobFields fields) {
        return firstNonEmpty(fields.getLocation()) + "\n" + firstNonEmpty(fields.getDescriptionHtml());
    }
}
