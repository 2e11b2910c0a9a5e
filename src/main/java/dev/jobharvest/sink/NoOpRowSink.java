package dev.jobharvest.sink;

import dev.jobharvest.model.JobRow;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class NoOpRowSink implements RowSink {

    @Override
    public void ensureHeader() {
        // nothing to prepare
    }

    @Override
    public int append(List<JobRow> rows) {
        log.info("Discarding {} rows (sink disabled)", rows.size());
        return rows.size();
    }

    @Override
    public String describe() {
        return "none";
    }
}
