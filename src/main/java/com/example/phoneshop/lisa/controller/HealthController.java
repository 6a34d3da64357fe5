package com.example.phoneshop.lisa.controller;

import com.example.phoneshop.lisa.retrieval.LexicalIndex;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final LexicalIndex lexicalIndex;

    @GetMapping("/health")
    @Operation(summary = "Liveness probe")
    public Map<String, Object> health() {
        return Map.of("status", "ok", "passages", lexicalIndex.size());
    }
}
