package com.example.phoneshop.lisa.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class ToolRegistryTest {

  private static ToolDefinition tool(String name) {
    return new ToolDefinition(name, "test tool", Map.of(), input -> Mono.just(name));
  }

  @Test
  void findsToolsByNameInRegistrationOrder() {
    ToolRegistry registry = new ToolRegistry(List.of(tool("b"), tool("a")));

    assertThat(registry.find("a")).isPresent();
    assertThat(registry.find("missing")).isEmpty();
    assertThat(registry.all()).extracting(ToolDefinition::name).containsExactly("b", "a");
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThatThrownBy(() -> new ToolRegistry(List.of(tool("x"), tool("x"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("x");
  }
}
