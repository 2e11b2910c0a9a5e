package dev.jobharvest.metrics;

import dev.jobharvest.model.ErrorScope;
import dev.jobharvest.model.RunTotals;
import dev.jobharvest.model.SelectionTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for harvest runs.
 */
@Component
public class HarvestMetrics {

    private static final String TAG_SERVICE = "service";
    private final MeterRegistry registry;

    private final Counter careersProcessedCounter;
    private final Counter jobUrlsFoundCounter;
    private final Counter rowsAppendedCounter;
    private final Counter duplicatesCounter;
    private final Counter oracleAttemptsCounter;
    private final Counter oracleFailuresCounter;

    private final ConcurrentHashMap<String, Timer> serviceTimers = new ConcurrentHashMap<>();

    private final AtomicInteger lastRunRowsAppended = new AtomicInteger(0);
    private final AtomicInteger lastRunErrors = new AtomicInteger(0);

    public HarvestMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.careersProcessedCounter = Counter.builder("job_harvest_careers_processed_total")
                .description("Careers pages processed successfully")
                .register(registry);

        this.jobUrlsFoundCounter = Counter.builder("job_harvest_job_urls_found_total")
                .description("Candidate job URLs discovered")
                .register(registry);

        this.rowsAppendedCounter = Counter.builder("job_harvest_rows_appended_total")
                .description("Rows appended to the sink")
                .register(registry);

        this.duplicatesCounter = Counter.builder("job_harvest_duplicates_total")
                .description("Postings dropped as fingerprint duplicates")
                .register(registry);

        this.oracleAttemptsCounter = Counter.builder("job_harvest_oracle_attempts_total")
                .description("Structured completion attempts")
                .register(registry);

        this.oracleFailuresCounter = Counter.builder("job_harvest_oracle_failures_total")
                .description("Structured completion attempts that produced no valid object")
                .register(registry);

        Gauge.builder("job_harvest_last_run_rows_appended", lastRunRowsAppended, AtomicInteger::get)
                .description("Rows appended in last run")
                .register(registry);

        Gauge.builder("job_harvest_last_run_errors", lastRunErrors, AtomicInteger::get)
                .description("Errors recorded in last run")
                .register(registry);
    }

    public void recordCareersProcessed() {
        careersProcessedCounter.increment();
    }

    public void recordJobUrlsFound(int count) {
        jobUrlsFoundCounter.increment(count);
    }

    public void recordRowsAppended(int count) {
        rowsAppendedCounter.increment(count);
    }

    public void recordDuplicate() {
        duplicatesCounter.increment();
    }

    public void recordError(ErrorScope scope) {
        Counter.builder("job_harvest_errors_total")
                .tag("scope", scope.getLabel())
                .register(registry)
                .increment();
    }

    /**
     * Record which selection tier produced the candidates of a Source.
     */
    public void recordSelectionTier(SelectionTier tier) {
        Counter.builder("job_harvest_selection_tier_total")
                .tag("tier", tier.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * Record which extractor produced the fields of a posting.
     */
    public void recordExtraction(String extractor) {
        Counter.builder("job_harvest_extractions_total")
                .tag("extractor", extractor)
                .register(registry)
                .increment();
    }

    public void recordOracleAttempt() {
        oracleAttemptsCounter.increment();
    }

    public void recordOracleFailure() {
        oracleFailuresCounter.increment();
    }

    public Timer getServiceTimer(String service) {
        return serviceTimers.computeIfAbsent(service, name ->
                Timer.builder("job_harvest_external_call_duration")
                        .description("Latency of calls to external services")
                        .tag(TAG_SERVICE, name)
                        .register(registry));
    }

    public void recordCallLatency(String service, long latencyMs) {
        getServiceTimer(service).record(Duration.ofMillis(latencyMs));
    }

    public void updateLastRunStats(RunTotals totals) {
        lastRunRowsAppended.set(totals.rowsAppended());
        lastRunErrors.set(totals.errors());
    }
}
