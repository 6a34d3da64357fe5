package com.example.phoneshop.lisa.controller;

import com.example.phoneshop.lisa.response.ErrorResponse;
import com.example.phoneshop.lisa.tools.ToolDefinition;
import com.example.phoneshop.lisa.tools.ToolRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/v1/tools")
@Tag(name = "Tools", description = "Invoke the assistant's tools directly")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    @Operation(summary = "List tools with their input schemas")
    public Collection<ToolDefinition> list() {
        return toolRegistry.all();
    }

    @PostMapping("/{name}")
    @Operation(summary = "Invoke a tool", description = "The request body is the tool input as a JSON object.")
    public Mono<ResponseEntity<Object>> invoke(@PathVariable("name") String name,
                                               @RequestBody(required = false) JsonNode input) {
        return toolRegistry.find(name)
                .map(tool -> Mono.defer(() -> tool.invoke(input == null ? JsonNodeFactory.instance.objectNode() : input))
                        .<ResponseEntity<Object>>map(result -> ResponseEntity.ok(Map.of("tool", name, "result", result)))
                        .onErrorResume(ex -> {
                            log.error("tool {} failed", name, ex);
                            return Mono.just(ResponseEntity.internalServerError()
                                    .body(ErrorResponse.of("Tool " + name + " failed.")));
                        }))
                .orElseGet(() -> Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.of("Unknown tool: " + name))));
    }
}
