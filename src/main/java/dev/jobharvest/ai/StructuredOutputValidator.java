package dev.jobharvest.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates model output against a JSON Schema (Draft 2020-12).
 */
@Component
public class StructuredOutputValidator {

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private final Map<JsonNode, JsonSchema> compiled = new ConcurrentHashMap<>();

    /**
     * @return violation messages, empty when {@code instance} is valid
     */
    public List<String> validate(JsonNode schema, JsonNode instance) {
        JsonSchema jsonSchema = compiled.computeIfAbsent(schema, factory::getSchema);
        return jsonSchema.validate(instance).stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
    }
}
