package dev.jobharvest.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One structured completion request.
 *
 * @param systemPrompt instruction embedding the exact schema text
 * @param userPrompt   serialized user payload
 * @param schema       JSON Schema the answer must satisfy
 * @param model        model override, or null for the provider default
 * @param maxRetries   retry budget, or null for the configured default
 */
public record OracleRequest(
        String systemPrompt,
        String userPrompt,
        JsonNode schema,
        String model,
        Integer maxRetries) {
}
