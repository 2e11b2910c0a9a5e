package dev.jobharvest.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Schema-constrained structured completion service.
 * Implemented per LLM provider.
 */
public interface ExtractionOracle {

    /**
     * Obtain an object that validates against {@code request.schema()}.
     *
     * @param request prompts, schema, optional model override and retry budget
     * @return the schema-valid object
     * @throws dev.jobharvest.error.ExtractionException when the retry budget is exhausted
     *                                                   or the provider rejects the request
     */
    JsonNode completeJson(OracleRequest request);

    /**
     * Provider name used in logs and metrics.
     */
    String getName();
}
