package dev.jobharvest.fetch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.config.FirecrawlProperties;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.http.RateGate;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.Anchor;
import dev.jobharvest.model.PageContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * PageFetcher backed by the Firecrawl v2 scrape API.
 */
@Slf4j
@Service
public class FirecrawlPageFetcher implements PageFetcher {

    private static final String SCRAPE_PATH = "/v2/scrape";
    private static final String SERVICE = "firecrawl";
    private static final int SNIPPET_LENGTH = 500;

    private final WebClient webClient;
    private final FirecrawlProperties properties;
    private final RateGate rateGate;
    private final HarvestMetrics metrics;
    private final ObjectMapper objectMapper;

    public FirecrawlPageFetcher(
            WebClient.Builder webClientBuilder,
            FirecrawlProperties properties,
            @Qualifier("pageFetchRateGate") RateGate rateGate,
            HarvestMetrics metrics,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.rateGate = rateGate;
        this.metrics = metrics;
        this.objectMapper = objectMapper;

        WebClient.Builder builder = webClientBuilder
                .baseUrl(Objects.requireNonNull(properties.getBaseUrl()))
                .codecs(config -> config.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .defaultHeader("User-Agent", "job-harvest/1.0")
                .defaultHeader("Content-Type", "application/json");

        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Firecrawl API key is missing! Page fetches will be rejected.");
        } else {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }
        this.webClient = builder.build();
    }

    @Override
    public PageContent fetch(String url) {
        ScrapeRequest request = buildRequest(url);
        JsonNode body = Mono.defer(() -> scrape(request, url))
                .retryWhen(cooldownRetry(url))
                .onErrorMap(WebClientResponseException.class, e -> new FetchException(describe(url, e), e))
                .onErrorMap(WebClientRequestException.class, e -> new FetchException(
                        "Firecrawl request failed for " + url + ": " + e.getMessage(), e))
                .defaultIfEmpty("")
                .map(raw -> parseBody(raw, url))
                .block();
        return toPageContent(url, body);
    }

    ScrapeRequest buildRequest(String url) {
        List<Map<String, Object>> actions = null;
        Integer waitMs = properties.getWaitMs();
        if (waitMs != null && waitMs > 0) {
            actions = List.of(Map.of("type", "wait", "milliseconds", waitMs));
        }
        return new ScrapeRequest(
                url,
                List.of("html", "links"),
                properties.getMaxAgeMs(),
                properties.getOnlyMainContent(),
                actions);
    }

    /**
     * One retry for 429 and 5xx answers, after the cooldown configured for that status.
     */
    private Retry cooldownRetry(String url) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            Duration cooldown = signal.totalRetries() == 0 ? cooldownFor(failure) : null;
            if (cooldown == null) {
                return Mono.<Long>error(failure);
            }
            log.warn("Firecrawl returned {} for {} - retrying once in {}ms",
                    ((WebClientResponseException) failure).getStatusCode().value(), url, cooldown.toMillis());
            return Mono.delay(cooldown);
        }));
    }

    Duration cooldownFor(Throwable failure) {
        if (!(failure instanceof WebClientResponseException)) {
            return null;
        }
        HttpStatusCode status = ((WebClientResponseException) failure).getStatusCode();
        if (status.value() == 429) {
            return Duration.ofMillis(properties.getRateLimitCooldownMs());
        }
        if (status.is5xxServerError()) {
            return Duration.ofMillis(properties.getServerErrorCooldownMs());
        }
        return null;
    }

    private Mono<String> scrape(ScrapeRequest request, String url) {
        rateGate.acquire();
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(SCRAPE_PATH)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .onErrorMap(TimeoutException.class, e -> new FetchException(
                        "Firecrawl timed out after " + properties.getTimeoutSeconds() + "s for " + url, e))
                .doOnTerminate(() -> metrics.recordCallLatency(SERVICE, System.currentTimeMillis() - start));
    }

    private JsonNode parseBody(String raw, String url) {
        if (raw == null || raw.isBlank()) {
            throw new FetchException("Empty Firecrawl response for " + url);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new FetchException("Failed to parse Firecrawl JSON response for " + url
                    + ". Raw response start: " + snippet(raw), e);
        }
        if (node == null || !node.isObject()) {
            throw new FetchException("Unexpected response type from Firecrawl for " + url + ": "
                    + (node == null ? "null" : node.getNodeType()));
        }
        return node;
    }

    PageContent toPageContent(String url, JsonNode body) {
        if (!body.path("success").asBoolean(true)) {
            String error = firstText(body, "error", "message");
            throw new FetchException("Firecrawl error: " + (error != null ? error : "Firecrawl returned success=false"));
        }
        JsonNode data = body.path("data").isObject() ? body.path("data") : body;
        String html = data.path("html").asText("");
        List<Anchor> anchors = normalizeLinks(data.path("links"));
        JsonNode metadata = data.path("metadata");
        String canonical = firstText(metadata, "sourceURL", "canonical");
        return new PageContent(url, html, anchors, canonical);
    }

    /**
     * Links arrive as href strings or as objects with href/url/link and text/label/title.
     */
    static List<Anchor> normalizeLinks(JsonNode links) {
        List<Anchor> anchors = new ArrayList<>();
        if (links == null || links.isMissingNode() || links.isNull()) {
            return anchors;
        }
        if (links.isTextual()) {
            if (!links.asText().isBlank()) {
                anchors.add(new Anchor(links.asText(), ""));
            }
            return anchors;
        }
        for (JsonNode item : links) {
            if (item.isTextual()) {
                if (!item.asText().isBlank()) {
                    anchors.add(new Anchor(item.asText(), ""));
                }
            } else if (item.isObject()) {
                String href = firstText(item, "href", "url", "link");
                String text = firstText(item, "text", "label", "title");
                if (href != null) {
                    anchors.add(new Anchor(href, text));
                }
            }
        }
        return anchors;
    }

    private static String firstText(JsonNode node, String... fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String describe(String url, WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        return "Firecrawl request failed for " + url + ": HTTP " + e.getStatusCode().value()
                + (body.isBlank() ? "" : " - " + snippet(body));
    }

    private static String snippet(String raw) {
        return raw.length() > SNIPPET_LENGTH ? raw.substring(0, SNIPPET_LENGTH) : raw;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ScrapeRequest(
            String url,
            List<String> formats,
            Long maxAge,
            Boolean onlyMainContent,
            List<Map<String, Object>> actions) {
    }
}
