package dev.jobharvest.ats;

import dev.jobharvest.model.ExtractedJob;

/**
 * Deterministic parser for one applicant-tracking system's posting URLs.
 */
public interface AtsParser {

    /**
     * Parser name used in logs and metrics.
     */
    String getName();

    /**
     * Matches on URL shape alone; performs no I/O.
     */
    boolean canHandle(String url);

    /**
     * Fetch the posting's structured data and map it to job fields.
     *
     * @throws dev.jobharvest.error.HarvestException when a lookup fails or the payload lacks an expected field
     */
    ExtractedJob parse(String url);
}
