package dev.jobharvest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings of the harvest pipeline.
 * Loaded from application.yml under 'harvest' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {

    private List<String> urls = new ArrayList<>();
    private String inputFile;
    private String companyOverride;
    private boolean dryRun = false;
    private boolean resume = false;
    private int concurrency = 8;
    private int maxConcurrency = 8;
    private Integer maxJobs;
    private int anchorLimit = 150;
    private int boardAnchorLimit = 200;
    private int htmlPayloadLimit = 250_000;
    private boolean exitOnCompletion = true;
    private Sink sink = new Sink();

    @Data
    public static class Sink {
        private SinkType type = SinkType.SHEETS;
        private String csvPath = "data/jobs.csv";
        private String dryRunPath = "data/dry_run.csv";
    }

    public enum SinkType {
        NONE,
        CSV,
        SHEETS
    }
}
