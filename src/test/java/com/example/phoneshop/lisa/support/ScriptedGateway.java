package com.example.phoneshop.lisa.support;

import com.example.phoneshop.lisa.generation.GenerationGateway;
import dev.langchain4j.data.message.ChatMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Answers every call through a function of the input messages and records what it was sent.
 * Streams split the answer into words.
 */
public class ScriptedGateway implements GenerationGateway {

  private final Function<List<ChatMessage>, Mono<String>> script;
  public final List<List<ChatMessage>> invocations = Collections.synchronizedList(new ArrayList<>());
  public final List<List<ChatMessage>> streams = Collections.synchronizedList(new ArrayList<>());

  public ScriptedGateway(Function<List<ChatMessage>, Mono<String>> script) {
    this.script = script;
  }

  public static ScriptedGateway replying(String text) {
    return new ScriptedGateway(messages -> Mono.just(text));
  }

  @Override
  public Mono<String> invoke(List<ChatMessage> messages) {
    invocations.add(List.copyOf(messages));
    return Mono.defer(() -> script.apply(messages));
  }

  @Override
  public Flux<String> stream(List<ChatMessage> messages) {
    streams.add(List.copyOf(messages));
    return Mono.defer(() -> script.apply(messages))
        .flatMapMany(text -> {
          List<String> chunks = new ArrayList<>();
          for (String word : text.split("(?<= )")) {
            chunks.add(word);
          }
          return Flux.fromIterable(chunks);
        });
  }
}
