package dev.jobharvest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.ai.ExtractionOracle;
import dev.jobharvest.ai.JobSchemas;
import dev.jobharvest.ai.OracleRequest;
import dev.jobharvest.ats.AtsParser;
import dev.jobharvest.ats.AtsParserRegistry;
import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.config.OracleProperties;
import dev.jobharvest.error.ExtractionException;
import dev.jobharvest.fetch.PageFetcher;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.ExtractedJob;
import dev.jobharvest.model.JobFields;
import dev.jobharvest.model.PageContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Produces the fields of one candidate: a matching ATS parser first, the
 * generic page-fetch plus oracle extraction when no parser matches or the parser fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobFieldExtractor {

    static final String GENERIC_EXTRACTOR = "generic";

    private static final String NOTES = "Common signals: 'Apply', 'Responsibilities', 'Qualifications'. "
            + "Words like 'Remote'/'Hybrid' may influence remote_ok.";

    private final AtsParserRegistry parserRegistry;
    private final PageFetcher pageFetcher;
    private final ExtractionOracle oracle;
    private final JobSchemas schemas;
    private final HarvestProperties harvestProperties;
    private final OracleProperties oracleProperties;
    private final HarvestMetrics metrics;
    private final ObjectMapper objectMapper;

    public ExtractedJob extract(String jobUrl) {
        ExtractedJob job = parserRegistry.find(jobUrl)
                .flatMap(parser -> parseDeterministically(parser, jobUrl))
                .orElseGet(() -> extractGeneric(jobUrl));
        metrics.recordExtraction(job.extractor());
        return job;
    }

    private Optional<ExtractedJob> parseDeterministically(AtsParser parser, String jobUrl) {
        try {
            ExtractedJob job = parser.parse(jobUrl);
            log.info("ats_parser_used url={} parser={}", jobUrl, parser.getName());
            return Optional.of(job);
        } catch (RuntimeException e) {
            log.warn("ats_parser_error url={} parser={} error={}", jobUrl, parser.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    ExtractedJob extractGeneric(String jobUrl) {
        PageContent page = pageFetcher.fetch(jobUrl);
        String canonical = page.canonicalOr(jobUrl);
        String html = page.html();

        JsonNode schema = schemas.jobFields();
        JsonNode result = oracle.completeJson(new OracleRequest(
                fieldsSystemPrompt(schemas.text(schema)),
                fieldsUserPrompt(jobUrl, canonical, html),
                schema,
                oracleProperties.getModelJobFields(),
                null));

        try {
            JobFields fields = objectMapper.treeToValue(result, JobFields.class);
            return new ExtractedJob(fields, canonical, html, GENERIC_EXTRACTOR);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Extracted fields for " + jobUrl + " do not map to a job: "
                    + e.getOriginalMessage(), e);
        }
    }

    private String fieldsSystemPrompt(String schemaText) {
        return "You are an expert ATS parser. Return ONLY a JSON object that conforms to this JSON Schema (Draft 2020-12):\n"
                + schemaText + "\n"
                + "Rules: Prefer exact strings from the page for title and location. "
                + "remote_ok must be boolean; infer only if clearly stated. "
                + "job_type must be one of: Full Time, Part Time, Internship. "
                + "description_html must be HTML of the job description (not full page). "
                + "If salary not present, set both salaries to null. "
                + "application_link should be the primary apply URL; fall back to the job page URL if none. "
                + "Do not include markdown, code fences, or explanations.";
    }

    private String fieldsUserPrompt(String jobUrl, String canonical, String html) {
        int limit = harvestProperties.getHtmlPayloadLimit();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("Job URL", jobUrl);
        payload.put("Canonical URL", canonical);
        payload.put("HTML", html.length() > limit ? html.substring(0, limit) : html);
        payload.put("Notes", NOTES);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Could not serialize page of " + jobUrl, e);
        }
    }
}
