package dev.jobharvest.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Snapshot of the run counters.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunTotals(
        int careersProcessed,
        int jobUrlsFound,
        int rowsAppended,
        int duplicates,
        int errors) {
}
