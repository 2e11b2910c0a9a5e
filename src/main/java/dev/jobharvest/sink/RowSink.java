package dev.jobharvest.sink;

import dev.jobharvest.model.JobRow;

import java.util.List;

/**
 * Destination for finished rows.
 */
public interface RowSink {

    /**
     * Write the column header if the destination has none yet. Idempotent.
     */
    void ensureHeader();

    /**
     * Append rows in order.
     *
     * @return number of rows appended
     */
    int append(List<JobRow> rows);

    /**
     * Human-readable target, for logs.
     */
    String describe();
}
