package dev.jobharvest.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Output schemas of the oracle calls, loaded once from the classpath.
 */
@Slf4j
@Component
public class JobSchemas {

    static final String JOB_URL_INDICES = "schemas/job_urls_indices.schema.json";
    static final String JOB_FIELDS = "schemas/job_fields.schema.json";

    private final ObjectMapper objectMapper;
    private final JsonNode jobUrlIndices;
    private final JsonNode jobFields;

    public JobSchemas(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.jobUrlIndices = load(JOB_URL_INDICES);
        this.jobFields = load(JOB_FIELDS);
    }

    public JsonNode jobUrlIndices() {
        return jobUrlIndices;
    }

    public JsonNode jobFields() {
        return jobFields;
    }

    /**
     * Compact text of a schema, for embedding in a prompt.
     */
    public String text(JsonNode schema) {
        return schema.toString();
    }

    private JsonNode load(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            log.error("Failed to load schema {}", path, e);
            throw new IllegalStateException("Could not load schema " + path, e);
        }
    }
}
