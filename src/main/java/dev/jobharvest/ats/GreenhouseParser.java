package dev.jobharvest.ats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.error.ExtractionException;
import dev.jobharvest.error.FetchException;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.ExtractedJob;
import dev.jobharvest.model.JobFields;
import dev.jobharvest.util.BoundedMemo;
import dev.jobharvest.util.UrlUtils;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Greenhouse job boards ({@code https://boards.greenhouse.io/{board}/jobs/{id}}).
 */
@Component
public class GreenhouseParser extends AbstractAtsParser {

    private static final Set<String> HOSTS = Set.of("boards.greenhouse.io", "job-boards.greenhouse.io");
    private static final Pattern JOB_PATH = Pattern.compile("^/([^/]+)/jobs/(\\d+)/?$");
    private static final String API_URL = "https://boards-api.greenhouse.io";

    private final BoundedMemo<String, JsonNode> jobDetails = new BoundedMemo<>(256);
    private final BoundedMemo<String, JsonNode> boards = new BoundedMemo<>(64);

    public GreenhouseParser(WebClient.Builder webClientBuilder, HarvestMetrics metrics, ObjectMapper objectMapper) {
        super(webClientBuilder, metrics, objectMapper);
    }

    @Override
    public String getName() {
        return "greenhouse";
    }

    protected String getApiUrl() {
        return API_URL;
    }

    @Override
    public boolean canHandle(String url) {
        return match(url) != null;
    }

    @Override
    public ExtractedJob parse(String url) {
        JobRef ref = match(url);
        if (ref == null) {
            throw new ExtractionException("Not a Greenhouse job URL: " + url);
        }
        JsonNode detail = jobDetails.get(ref.board() + "|" + ref.jobId(), key -> {
            JsonNode payload = fetchJson(getApiUrl() + "/v1/boards/" + ref.board() + "/jobs/" + ref.jobId()
                    + "?pay_transparency=true");
            if (payload == null || !payload.hasNonNull("title")) {
                throw new FetchException("Greenhouse job detail missing 'title'");
            }
            return payload;
        });
        JsonNode board = boards.get(ref.board(), slug -> fetchJson(getApiUrl() + "/v1/boards/" + slug));

        JobFields fields = mapFields(detail, board, ref.board());
        String absoluteUrl = cleanText(detail, "absolute_url");
        return new ExtractedJob(fields, absoluteUrl.isEmpty() ? url : absoluteUrl,
                searchableMarkup(fields), getName());
    }

    record JobRef(String board, String jobId) {
    }

    static JobRef match(String url) {
        URI uri = UrlUtils.safeUri(url);
        if (uri == null || uri.getHost() == null || !HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT))) {
            return null;
        }
        Matcher matcher = JOB_PATH.matcher(uri.getRawPath() == null ? "" : uri.getRawPath());
        return matcher.matches() ? new JobRef(matcher.group(1), matcher.group(2)) : null;
    }

    static JobFields mapFields(JsonNode detail, JsonNode board, String boardSlug) {
        String content = cleanText(detail, "content");
        JsonNode payRange = detail.path("pay_input_ranges").path(0);
        return JobFields.builder()
                .title(cleanText(detail, "title"))
                .companyName(firstNonEmpty(cleanText(board, "name"), formatCompanyName(boardSlug)))
                .location(cleanText(detail.path("location"), "name"))
                .remoteOk(null)
                .descriptionHtml(content.isEmpty() ? "" : Parser.unescapeEntities(content, false))
                .minSalary(fromCents(payRange.get("min_cents")))
                .maxSalary(fromCents(payRange.get("max_cents")))
                .applicationLink(cleanText(detail, "absolute_url"))
                .build();
    }

    private static Double fromCents(JsonNode cents) {
        Double value = coerceNumber(cents);
        return value == null ? null : value / 100d;
    }
}
