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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for BambooHR-hosted postings ({@code https://{tenant}.bamboohr.com/careers/{id}}).
 * Uses the public careers JSON endpoints instead of the rendered page.
 */
@Slf4j
@Component
public class BambooHrParser extends AbstractAtsParser {

    private static final Pattern JOB_PATH = Pattern.compile("^/careers/(\\d+)(?:/.*)?$");
    private static final String HOST_SUFFIX = ".bamboohr.com";

    private final BoundedMemo<String, JsonNode> jobDetails = new BoundedMemo<>(256);
    private final BoundedMemo<String, JsonNode> companyInfo = new BoundedMemo<>(64);

    public BambooHrParser(WebClient.Builder webClientBuilder, HarvestMetrics metrics, ObjectMapper objectMapper) {
        super(webClientBuilder, metrics, objectMapper);
    }

    @Override
    public String getName() {
        return "bamboohr";
    }

    @Override
    public boolean canHandle(String url) {
        return match(url) != null;
    }

    @Override
    public ExtractedJob parse(String url) {
        JobRef ref = match(url);
        if (ref == null) {
            throw new ExtractionException("Not a BambooHR job URL: " + url);
        }
        JsonNode detail = jobDetails.get(ref.baseUrl() + "|" + ref.jobId(),
                key -> requireObject(fetchJson(detailUrl(ref.baseUrl(), ref.jobId())), "result", "BambooHR job detail"));
        JsonNode jobOpening = detail.get("jobOpening");
        if (jobOpening == null || !jobOpening.isObject()) {
            throw new FetchException("BambooHR detail payload missing 'jobOpening'");
        }
        JsonNode company = companyInfo.get(ref.baseUrl(),
                base -> requireObject(fetchJson(companyInfoUrl(base)), "result", "BambooHR company info"));

        JobFields fields = mapFields(jobOpening, company);
        String shareUrl = cleanText(jobOpening, "jobOpeningShareUrl");
        String canonical = shareUrl.isEmpty() ? url : shareUrl;
        log.debug("BambooHR posting {} mapped from {} (job {})", canonical, ref.baseUrl(), ref.jobId());
        return new ExtractedJob(fields, canonical, searchableMarkup(fields), getName());
    }

    protected String detailUrl(String baseUrl, String jobId) {
        return baseUrl + "/careers/" + jobId + "/detail";
    }

    protected String companyInfoUrl(String baseUrl) {
        return baseUrl + "/careers/company-info";
    }

    record JobRef(String baseUrl, String jobId) {
    }

    static JobRef match(String url) {
        URI uri = UrlUtils.safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        if (!uri.getHost().toLowerCase(Locale.ROOT).endsWith(HOST_SUFFIX)) {
            return null;
        }
        Matcher matcher = JOB_PATH.matcher(uri.getRawPath() == null ? "" : uri.getRawPath());
        if (!matcher.matches()) {
            return null;
        }
        return new JobRef(uri.getScheme() + "://" + uri.getRawAuthority(), matcher.group(1));
    }

    static JobFields mapFields(JsonNode jobOpening, JsonNode company) {
        Double[] salary = extractCompensation(jobOpening.get("compensation"));
        JsonNode description = jobOpening.get("description");
        return JobFields.builder()
                .title(cleanText(jobOpening, "jobOpeningName"))
                .companyName(cleanText(company, "name"))
                .location(composeLocation(jobOpening))
                .remoteOk(mapRemote(jobOpening.get("locationType")))
                .jobType(cleanText(jobOpening, "employmentStatusLabel"))
                .descriptionHtml(description != null && description.isTextual() ? description.asText() : "")
                .minSalary(salary[0])
                .maxSalary(salary[1])
                .applicationLink(cleanText(jobOpening, "jobOpeningShareUrl"))
                .build();
    }

    /**
     * "City, State[, Country]", or the country alone when city and state are unknown.
     */
    static String composeLocation(JsonNode jobOpening) {
        JsonNode location = jobOpening.path("location");
        JsonNode atsLocation = jobOpening.path("atsLocation");

        String city = firstNonEmpty(cleanText(location, "city"), cleanText(atsLocation, "city"));
        String state = firstNonEmpty(cleanText(location, "state"), cleanText(atsLocation, "state"),
                cleanText(atsLocation, "province"));
        String country = firstNonEmpty(cleanText(location, "addressCountry"), cleanText(atsLocation, "country"),
                cleanText(atsLocation, "countryId"));

        List<String> parts = new ArrayList<>();
        if (!city.isEmpty()) {
            parts.add(city);
        }
        if (!state.isEmpty()) {
            parts.add(state);
        }
        if (!country.isEmpty() && !parts.contains(country)) {
            parts.add(country);
        }
        return String.join(", ", parts);
    }

    /**
     * locationType: "1" remote, "0" on-site, anything else (including "2", hybrid) unknown.
     */
    static Boolean mapRemote(JsonNode locationType) {
        if (locationType == null || locationType.isNull()) {
            return null;
        }
        String code = locationType.isNumber() || locationType.isTextual() ? locationType.asText().strip() : "";
        if ("1".equals(code)) {
            return true;
        }
        if ("0".equals(code)) {
            return false;
        }
        return null;
    }

    static Double[] extractCompensation(JsonNode compensation) {
        if (compensation == null || !compensation.isObject()) {
            return new Double[] {null, null};
        }
        JsonNode source = compensation.get("range") != null && compensation.get("range").isObject()
                ? compensation.get("range")
                : compensation;
        return new Double[] {
                coerceNumber(firstPresent(source, "min", "minimum")),
                coerceNumber(firstPresent(source, "max", "maximum"))
        };
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isTextual() && value.asText().isEmpty()) {
                continue;
            }
            if (value.isNumber() && value.asDouble() == 0d) {
                continue;
            }
            return value;
        }
        return null;
    }
}
