package dev.jobharvest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.error.HarvestException;
import dev.jobharvest.error.ValidationException;
import dev.jobharvest.model.PipelineRequest;
import dev.jobharvest.model.RunResult;
import dev.jobharvest.service.JobPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the run request from configuration, runs the pipeline and reports the summary.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

    private static final String SEPARATOR = "========================================";

    private final JobPipelineService pipelineService;
    private final HarvestProperties harvestProperties;
    private final ObjectMapper objectMapper;

    @Value("${harvest.metrics-wait-seconds:0}")
    private int metricsWaitSeconds;

    /**
     * @return the result of a run in which at least one Source was processed or no error occurred
     * @throws IllegalStateException when the run cannot start or fails entirely
     */
    public RunResult execute() {
        log.info(SEPARATOR);
        log.info("Job Harvest Starting");
        log.info(SEPARATOR);

        try {
            List<String> sources = resolveSources(harvestProperties.getUrls(), harvestProperties.getInputFile());
            RunResult result = pipelineService.run(buildRequest(sources));
            log.info("run_summary {}", summaryJson(result));

            if (result.isFailed()) {
                throw new HarvestException("Harvest failed: " + result.firstErrorMessage());
            }

            log.info(SEPARATOR);
            log.info("Job Harvest Completed: {} rows appended, {} duplicates, {} errors",
                    result.totals().rowsAppended(), result.totals().duplicates(), result.totals().errors());
            log.info(SEPARATOR);

            handleMetricsWait();
            return result;
        } catch (RuntimeException e) {
            log.error("Job Harvest failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Pipeline execution failed: " + e.getMessage(), e);
        }
    }

    PipelineRequest buildRequest(List<String> sources) {
        return PipelineRequest.builder()
                .careersUrls(sources)
                .dryRun(harvestProperties.isDryRun())
                .resume(harvestProperties.isResume())
                .concurrency(harvestProperties.getConcurrency())
                .maxJobs(harvestProperties.getMaxJobs())
                .companyOverride(harvestProperties.getCompanyOverride())
                .build();
    }

    /**
     * Configured URLs followed by the non-blank lines of the input file, without duplicates.
     */
    static List<String> resolveSources(Collection<String> urls, String inputFile) {
        List<String> candidates = new ArrayList<>();
        if (urls != null) {
            candidates.addAll(urls);
        }
        if (inputFile != null && !inputFile.isBlank()) {
            try {
                candidates.addAll(Files.readAllLines(Path.of(inputFile), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new ValidationException("Cannot read input file " + inputFile + ": " + e.getMessage());
            }
        }
        Set<String> sources = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                sources.add(candidate.strip());
            }
        }
        return new ArrayList<>(sources);
    }

    private String summaryJson(RunResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totals", result.totals());
        summary.put("errors", result.errors());
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize run summary: {}", e.getMessage());
            return result.totals().toString();
        }
    }

    private void handleMetricsWait() {
        if (metricsWaitSeconds > 0) {
            log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
            try {
                Thread.sleep(metricsWaitSeconds * 1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Metrics wait interrupted");
            }
        }
    }
}
