package com.deepansh.desk.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema of a structured action the model may request.
 * Decouples the wire format from the Dispatcher and Worker code that handles it.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    /**
     * Converts to the chat-completions tool format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }

    /** JSON schema for an object whose properties are all strings. */
    public static Map<String, Object> objectSchema(Map<String, String> stringProperties,
                                                   List<String> required) {
        Map<String, Object> props = new LinkedHashMap<>();
        stringProperties.forEach((name, description) ->
                props.put(name, Map.of("type", "string", "description", description)));
        return Map.of(
                "type", "object",
                "properties", props,
                "required", required
        );
    }
}
