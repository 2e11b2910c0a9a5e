package dev.jobharvest.service;

import dev.jobharvest.metrics.HarvestMetrics;
import dev.jobharvest.model.ErrorEntry;
import dev.jobharvest.model.ErrorScope;
import dev.jobharvest.model.RunResult;
import dev.jobharvest.model.RunTotals;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-scoped counters and error log, safe for concurrent workers.
 */
public class ResultAggregator {

    private final HarvestMetrics metrics;

    private final AtomicInteger careersProcessed = new AtomicInteger();
    private final AtomicInteger jobUrlsFound = new AtomicInteger();
    private final AtomicInteger rowsAppended = new AtomicInteger();
    private final AtomicInteger duplicates = new AtomicInteger();
    private final AtomicInteger errorCount = new AtomicInteger();
    private final List<ErrorEntry> errors = new CopyOnWriteArrayList<>();

    public ResultAggregator(HarvestMetrics metrics) {
        this.metrics = metrics;
    }

    public void careersProcessed() {
        careersProcessed.incrementAndGet();
        metrics.recordCareersProcessed();
    }

    public void jobUrlsFound(int count) {
        jobUrlsFound.addAndGet(count);
        metrics.recordJobUrlsFound(count);
    }

    public void rowsAppended(int count) {
        rowsAppended.addAndGet(count);
        metrics.recordRowsAppended(count);
    }

    public void duplicate() {
        duplicates.incrementAndGet();
        metrics.recordDuplicate();
    }

    public void error(ErrorScope scope, String url, String message) {
        errorCount.incrementAndGet();
        errors.add(new ErrorEntry(scope, url, message));
        metrics.recordError(scope);
    }

    public RunTotals totals() {
        return new RunTotals(
                careersProcessed.get(),
                jobUrlsFound.get(),
                rowsAppended.get(),
                duplicates.get(),
                errorCount.get());
    }

    public List<ErrorEntry> errors() {
        return List.copyOf(errors);
    }

    public RunResult toResult(boolean dryRun) {
        return new RunResult(totals(), errors(), dryRun);
    }
}
