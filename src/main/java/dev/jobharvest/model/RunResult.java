package dev.jobharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of one pipeline invocation.
 */
public record RunResult(RunTotals totals, List<ErrorEntry> errors, boolean dryRun) {

    public RunResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * A run fails when no Source completed and at least one error was recorded.
     */
    @JsonIgnore
    public boolean isFailed() {
        return totals.careersProcessed() == 0 && !errors.isEmpty();
    }

    @JsonIgnore
    public String firstErrorMessage() {
        return errors.isEmpty() ? null : errors.get(0).message();
    }
}
