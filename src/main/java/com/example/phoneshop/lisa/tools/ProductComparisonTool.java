package com.example.phoneshop.lisa.tools;

import com.example.phoneshop.lisa.service.ProductComparisonService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class ProductComparisonTool {

    public static final String NAME = "product_comparison";

    private final ProductComparisonService comparisonService;

    public ToolDefinition definition() {
        return new ToolDefinition(
                NAME,
                "Retrieves information for two or more products and returns a Markdown comparison "
                        + "table plus product image URLs.",
                ToolDefinition.objectSchema(Map.of("product_names",
                        Map.of("type", "array", "items", Map.of("type", "string"), "minItems", 2))),
                this::run);
    }

    Mono<Object> run(JsonNode input) {
        List<String> names = new ArrayList<>();
        JsonNode node = input == null ? null : input.get("product_names");
        if (node != null && node.isArray()) {
            node.forEach(n -> {
                if (n.isTextual() && !n.asText().isBlank()) {
                    names.add(n.asText().trim());
                }
            });
        }
        return comparisonService.compare(names)
                .map(report -> Map.of("table", report.table(), "images", report.images()));
    }
}
