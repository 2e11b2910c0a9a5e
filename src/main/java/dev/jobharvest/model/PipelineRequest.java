package dev.jobharvest.model;

import lombok.Builder;

import java.util.List;

/**
 * Parameters of one pipeline invocation.
 *
 * @param careersUrls     Sources to process, in order
 * @param dryRun          write rows to the local dry-run file instead of the configured sink
 * @param resume          skip candidate URLs already present in the cache
 * @param concurrency     worker pool size per Source
 * @param maxJobs         optional cap on candidates processed per Source
 * @param companyOverride replaces the extracted company name when set
 * @param spreadsheetId   spreadsheet target for the sheets sink
 * @param worksheet       worksheet name for the sheets sink
 */
@Builder
public record PipelineRequest(
        List<String> careersUrls,
        boolean dryRun,
        boolean resume,
        int concurrency,
        Integer maxJobs,
        String companyOverride,
        String spreadsheetId,
        String worksheet) {

    public PipelineRequest {
        careersUrls = careersUrls == null ? List.of() : List.copyOf(careersUrls);
    }
}
