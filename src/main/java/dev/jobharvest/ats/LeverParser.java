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
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Lever postings ({@code https://jobs.lever.co/{company}/{uuid}}).
 */
@Component
public class LeverParser extends AbstractAtsParser {

    private static final String HOST = "jobs.lever.co";
    private static final Pattern JOB_PATH = Pattern.compile("^/([^/]+)/([0-9a-fA-F-]{36})(?:/apply)?/?$");
    private static final String API_URL = "https://api.lever.co";

    private final BoundedMemo<String, JsonNode> postings = new BoundedMemo<>(256);

    public LeverParser(WebClient.Builder webClientBuilder, HarvestMetrics metrics, ObjectMapper objectMapper) {
        super(webClientBuilder, metrics, objectMapper);
    }

    @Override
    public String getName() {
        return "lever";
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
            throw new ExtractionException("Not a Lever job URL: " + url);
        }
        JsonNode posting = postings.get(ref.company() + "|" + ref.postingId(), key -> {
            JsonNode payload = fetchJson(getApiUrl() + "/v0/postings/" + ref.company() + "/" + ref.postingId()
                    + "?mode=json");
            if (payload == null || !payload.hasNonNull("text")) {
                throw new FetchException("Lever posting missing 'text'");
            }
            return payload;
        });

        JobFields fields = mapFields(posting, ref.company());
        String hostedUrl = cleanText(posting, "hostedUrl");
        return new ExtractedJob(fields, hostedUrl.isEmpty() ? url : hostedUrl,
                searchableMarkup(fields), getName());
    }

    record JobRef(String company, String postingId) {
    }

    static JobRef match(String url) {
        URI uri = UrlUtils.safeUri(url);
        if (uri == null || uri.getHost() == null || !HOST.equals(uri.getHost().toLowerCase(Locale.ROOT))) {
            return null;
        }
        Matcher matcher = JOB_PATH.matcher(uri.getRawPath() == null ? "" : uri.getRawPath());
        return matcher.matches() ? new JobRef(matcher.group(1), matcher.group(2)) : null;
    }

    static JobFields mapFields(JsonNode posting, String companySlug) {
        JsonNode categories = posting.path("categories");
        JsonNode salary = posting.path("salaryRange");
        String hostedUrl = cleanText(posting, "hostedUrl");
        return JobFields.builder()
                .title(cleanText(posting, "text"))
                .companyName(formatCompanyName(companySlug))
                .location(cleanText(categories, "location"))
                .remoteOk(mapWorkplaceType(cleanText(posting, "workplaceType")))
                .jobType(cleanText(categories, "commitment"))
                .descriptionHtml(composeDescription(posting))
                .minSalary(coerceNumber(salary.get("min")))
                .maxSalary(coerceNumber(salary.get("max")))
                .applicationLink(firstNonEmpty(cleanText(posting, "applyUrl"), hostedUrl))
                .build();
    }

    static Boolean mapWorkplaceType(String workplaceType) {
        switch (workplaceType.toLowerCase(Locale.ROOT)) {
            case "remote":
            case "hybrid":
                return true;
            case "onsite":
            case "on-site":
                return false;
            default:
                return null;
        }
    }

    /**
     * Lever splits a posting into an opening paragraph, titled lists and a closing section.
     */
    static String composeDescription(JsonNode posting) {
        StringBuilder html = new StringBuilder(cleanText(posting, "description"));
        for (JsonNode list : posting.path("lists")) {
            String heading = cleanText(list, "text");
            if (!heading.isEmpty()) {
                html.append("<h3>").append(heading).append("</h3>");
            }
            String items = cleanText(list, "content");
            if (!items.isEmpty()) {
                html.append("<ul>").append(items).append("</ul>");
            }
        }
        html.append(cleanText(posting, "additional"));
        return html.toString();
    }
}
