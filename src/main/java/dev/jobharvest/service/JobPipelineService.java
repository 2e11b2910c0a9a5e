package dev.jobharvest.service;

import dev.jobharvest.config.HarvestProperties;
import dev.jobharvest.error.ValidationException;
import dev.jobharvest.fetch.AnchorExtractor;
import dev.jobharvest.fetch.PageFetcher;
import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.Anchor;
import dev.jobharvest.model.CandidateSelection;
import dev.jobharvest.model.ErrorScope;
import dev.jobharvest.model.ExtractedJob;
import dev.jobharvest.model.JobFields;
import dev.jobharvest.model.JobRow;
import dev.jobharvest.model.PageContent;
import dev.jobharvest.model.PipelineRequest;
import dev.jobharvest.model.RunResult;
import dev.jobharvest.sink.RowSink;
import dev.jobharvest.sink.RowSinkFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Main orchestration service for a harvest run.
 * Sources are processed one after another; the candidates of a Source run on a
 * bounded worker pool. A failing candidate or Source is recorded and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPipelineService {

    private final PageFetcher pageFetcher;
    private final CandidateSelector candidateSelector;
    private final JobFieldExtractor jobFieldExtractor;
    private final FieldPostprocessor fieldPostprocessor;
    private final FingerprintCache fingerprintCache;
    private final BoundedWorkerPool workerPool;
    private final RowSinkFactory rowSinkFactory;
    private final HarvestProperties harvestProperties;
    private final HarvestMetrics metrics;

    /**
     * Run the pipeline over every Source of the request.
     *
     * @throws ValidationException    when the request is unusable
     * @throws dev.jobharvest.error.ConfigurationException when the sink cannot be built
     */
    public RunResult run(PipelineRequest request) {
        validate(request);
        int concurrency = Math.min(request.concurrency(), Math.max(1, harvestProperties.getMaxConcurrency()));
        if (concurrency < request.concurrency()) {
            log.info("Concurrency clamped from {} to {}", request.concurrency(), concurrency);
        }

        RowSink sink = rowSinkFactory.create(request);
        sink.ensureHeader();

        log.info("========================================");
        log.info("Starting harvest of {} careers page(s) (concurrency={}, dryRun={}, resume={})",
                request.careersUrls().size(), concurrency, request.dryRun(), request.resume());
        log.info("========================================");

        ResultAggregator aggregator = new ResultAggregator(metrics);
        for (String sourceUrl : request.careersUrls()) {
            processSource(sourceUrl, request, concurrency, sink, aggregator);
        }

        RunResult result = aggregator.toResult(request.dryRun());
        metrics.updateLastRunStats(result.totals());
        log.info("Harvest completed: {}", result.totals());
        return result;
    }

    void validate(PipelineRequest request) {
        if (request.careersUrls().isEmpty()) {
            throw new ValidationException("Provide at least one careers URL");
        }
        if (request.careersUrls().stream().anyMatch(url -> url == null || url.isBlank())) {
            throw new ValidationException("Careers URLs must not be blank");
        }
        if (request.concurrency() <= 0) {
            throw new ValidationException("concurrency must be greater than zero");
        }
        if (request.maxJobs() != null && request.maxJobs() <= 0) {
            throw new ValidationException("maxJobs must be a positive integer");
        }
    }

    private void processSource(String sourceUrl, PipelineRequest request, int concurrency, RowSink sink,
                               ResultAggregator aggregator) {
        try {
            PageContent page = pageFetcher.fetch(sourceUrl);
            List<Anchor> anchors = AnchorExtractor.extract(page);
            CandidateSelection selection = candidateSelector.select(sourceUrl, anchors);
            metrics.recordSelectionTier(selection.tier());

            List<String> candidates = selection.urls();
            aggregator.jobUrlsFound(candidates.size());
            if (!candidates.isEmpty()) {
                log.info("job_urls_selected url={} count={} tier={} sample={}", sourceUrl, candidates.size(),
                        selection.tier(), candidates.subList(0, Math.min(3, candidates.size())));
            }
            if (request.maxJobs() != null && candidates.size() > request.maxJobs()) {
                candidates = candidates.subList(0, request.maxJobs());
            }

            List<JobRow> rows = workerPool.mapOrdered(
                            candidates,
                            concurrency,
                            jobUrl -> processCandidate(jobUrl, request, aggregator),
                            (jobUrl, error) -> recordJobError(jobUrl, error, aggregator))
                    .stream()
                    .flatMap(Optional::stream)
                    .toList();

            if (!rows.isEmpty()) {
                aggregator.rowsAppended(sink.append(rows));
            }
            aggregator.careersProcessed();
            log.info("careers_done url={} candidates={} rows={}", sourceUrl, candidates.size(), rows.size());
        } catch (RuntimeException e) {
            log.warn("careers_error url={} error={}", sourceUrl, messageOf(e));
            aggregator.error(ErrorScope.CAREERS, sourceUrl, messageOf(e));
        }
    }

    /**
     * Per-candidate pipeline; runs on a worker thread.
     *
     * @return the row, or empty when skipped by resume or dropped as a duplicate
     */
    Optional<JobRow> processCandidate(String jobUrl, PipelineRequest request, ResultAggregator aggregator) {
        if (request.resume() && fingerprintCache.isJobSeen(jobUrl)) {
            log.debug("job_skipped url={} reason=seen", jobUrl);
            return Optional.empty();
        }

        ExtractedJob extracted = jobFieldExtractor.extract(jobUrl);
        String canonical = extracted.canonicalUrl() != null ? extracted.canonicalUrl() : jobUrl;
        JobFields fields = fieldPostprocessor.apply(extracted.fields(), request.companyOverride(),
                extracted.pageHtml(), jobUrl, canonical);

        String fingerprint = FingerprintCache.fingerprint(canonical, fields.getTitle(), fields.getCompanyName());
        if (fingerprintCache.isFingerprintSeen(fingerprint)) {
            log.debug("job_duplicate url={} fingerprint={}", jobUrl, fingerprint);
            aggregator.duplicate();
            return Optional.empty();
        }
        fingerprintCache.markJobSeen(jobUrl, canonical, fields.getTitle(), fields.getCompanyName(), fingerprint);
        return Optional.of(JobRow.from(fields));
    }

    private void recordJobError(String jobUrl, Throwable error, ResultAggregator aggregator) {
        log.warn("job_error url={} error={}", jobUrl, messageOf(error));
        aggregator.error(ErrorScope.JOB, jobUrl, messageOf(error));
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
