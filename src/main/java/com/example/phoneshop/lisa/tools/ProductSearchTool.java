package com.example.phoneshop.lisa.tools;

import com.example.phoneshop.lisa.retrieval.ContextFormatter;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.Map;

@RequiredArgsConstructor
public class ProductSearchTool {

    public static final String NAME = "product_search";
    static final String NOTHING_FOUND = "Không tìm thấy thông tin sản phẩm nào phù hợp với câu hỏi của bạn.";

    private final RetrievalService retrievalService;

    public ToolDefinition definition() {
        return new ToolDefinition(
                NAME,
                "Answers questions about phone products: specifications, prices, comparisons or reviews. "
                        + "The input is the user's question.",
                ToolDefinition.objectSchema(Map.of("query", Map.of("type", "string"))),
                this::run);
    }

    Mono<Object> run(JsonNode input) {
        String query = input == null ? "" : input.path("query").asText("");
        if (query.isBlank()) {
            return Mono.just(NOTHING_FOUND);
        }
        return retrievalService.retrieve(query)
                .map(results -> results.isEmpty() ? NOTHING_FOUND : ContextFormatter.format(results));
    }
}
