package com.example.phoneshop.lisa.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * A callable capability described for an agent: name, purpose, a JSON-schema-like description
 * of its input, and the function itself.
 */
public record ToolDefinition(
        String name,
        String description,
        Map<String, Object> inputSchema,
        @JsonIgnore Function<JsonNode, Mono<Object>> function
) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        inputSchema = inputSchema == null ? Map.of() : Map.copyOf(inputSchema);
    }

    public Mono<Object> invoke(JsonNode input) {
        return function.apply(input);
    }

    /** Schema of an object with the given required properties. */
    static Map<String, Object> objectSchema(Map<String, Object> properties) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", properties.keySet().stream().sorted().toList());
    }
}
