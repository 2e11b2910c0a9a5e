package dev.jobharvest.metrics;

import dev.jobharvest.model.ErrorScope;
import dev.jobharvest.model.RunTotals;
import dev.jobharvest.model.SelectionTier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestMetricsTest {

    private MeterRegistry meterRegistry;
    private HarvestMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new HarvestMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Run counters")
    class RunCounterTests {

        @Test
        @DisplayName("Should record Sources and job URLs")
        void shouldRecordSourcesAndUrls() {
            metrics.recordCareersProcessed();
            metrics.recordJobUrlsFound(12);

            assertThat(meterRegistry.counter("job_harvest_careers_processed_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_harvest_job_urls_found_total").count()).isEqualTo(12.0);
        }

        @Test
        @DisplayName("Should record rows and duplicates")
        void shouldRecordRowsAndDuplicates() {
            metrics.recordRowsAppended(3);
            metrics.recordDuplicate();
            metrics.recordDuplicate();

            assertThat(meterRegistry.counter("job_harvest_rows_appended_total").count()).isEqualTo(3.0);
            assertThat(meterRegistry.counter("job_harvest_duplicates_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should tag errors by scope")
        void shouldTagErrors() {
            metrics.recordError(ErrorScope.JOB);
            metrics.recordError(ErrorScope.JOB);
            metrics.recordError(ErrorScope.CAREERS);

            assertThat(meterRegistry.counter("job_harvest_errors_total", "scope", "job").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_harvest_errors_total", "scope", "careers").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Extraction counters")
    class ExtractionTests {

        @Test
        void shouldTagSelectionTierAndExtractor() {
            metrics.recordSelectionTier(SelectionTier.ATS_BOARD);
            metrics.recordExtraction("bamboohr");

            assertThat(meterRegistry.counter("job_harvest_selection_tier_total", "tier", "ats_board").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_harvest_extractions_total", "extractor", "bamboohr").count())
                    .isEqualTo(1.0);
        }

        @Test
        void shouldCountOracleAttemptsAndFailures() {
            metrics.recordOracleAttempt();
            metrics.recordOracleAttempt();
            metrics.recordOracleFailure();

            assertThat(meterRegistry.counter("job_harvest_oracle_attempts_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_harvest_oracle_failures_total").count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Should reuse one timer per external service")
    void shouldRecordCallLatency() {
        metrics.recordCallLatency("firecrawl", 120);
        metrics.recordCallLatency("firecrawl", 80);

        Timer timer = metrics.getServiceTimer("firecrawl");
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Should expose last run stats as gauges")
    void shouldUpdateLastRunGauges() {
        metrics.updateLastRunStats(new RunTotals(2, 10, 7, 1, 3));

        assertThat(meterRegistry.get("job_harvest_last_run_rows_appended").gauge().value()).isEqualTo(7.0);
        assertThat(meterRegistry.get("job_harvest_last_run_errors").gauge().value()).isEqualTo(3.0);
    }
}
