package com.example.phoneshop.lisa.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class ToolRegistry {

    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

    public ToolRegistry(List<ToolDefinition> definitions) {
        for (ToolDefinition def : definitions) {
            if (tools.putIfAbsent(def.name(), def) != null) {
                throw new IllegalArgumentException("duplicate tool name: " + def.name());
            }
        }
        log.info("registered tools: {}", tools.keySet());
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<ToolDefinition> all() {
        return Collections.unmodifiableCollection(tools.values());
    }
}
