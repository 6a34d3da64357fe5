package com.example.phoneshop.lisa.generation;

import dev.langchain4j.data.message.ChatMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The text-generation capability: one full reply, or the same reply as incremental chunks.
 * Implementations bound each call with a timeout and retry transient failures.
 */
public interface GenerationGateway {

    Mono<String> invoke(List<ChatMessage> messages);

    Flux<String> stream(List<ChatMessage> messages);
}
