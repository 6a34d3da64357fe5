package com.example.phoneshop.lisa.router;

import com.example.phoneshop.lisa.generation.GenerationGateway;
import com.example.phoneshop.lisa.model.RouterDecision;
import com.example.phoneshop.lisa.prompt.PromptLibrary;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Chooses the execution path for a user turn. Small talk is caught by regex; everything else
 * goes to the model, whose JSON answer is validated and retried with a stricter instruction.
 * When every attempt fails the utterance itself becomes a retrieval query, so
 * {@link #classify} never errors.
 */
@Slf4j
public class IntentRouter {

    private final GenerationGateway gateway;
    private final PromptLibrary prompts;
    private final RouterOutputParser parser;
    private final int maxRetries;

    public IntentRouter(GenerationGateway gateway, PromptLibrary prompts, RouterOutputParser parser, int maxRetries) {
        this.gateway = gateway;
        this.prompts = prompts;
        this.parser = parser;
        this.maxRetries = Math.max(0, maxRetries);
    }

    public Mono<RouterDecision> classify(String utterance) {
        String trimmed = utterance == null ? "" : utterance.trim();
        if (trimmed.isEmpty()) {
            return Mono.just(new RouterDecision.Chat(""));
        }
        if (ChatFastPath.matches(trimmed)) {
            log.debug("fast-path chat for '{}'", trimmed);
            return Mono.just(new RouterDecision.Chat(trimmed));
        }
        RouterDecision fallback = new RouterDecision.Retrieval(trimmed);
        return attempt(utterance, 0)
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("router gave up after {} attempts, falling back to retrieval", maxRetries + 1);
                    return fallback;
                }))
                .onErrorResume(e -> {
                    log.error("router failed unexpectedly, falling back to retrieval", e);
                    return Mono.just(fallback);
                });
    }

    /** Completes empty when this and all later attempts fail. */
    private Mono<RouterDecision> attempt(String utterance, int attempt) {
        if (attempt > maxRetries) {
            return Mono.empty();
        }
        String instruction = attempt == 0 ? prompts.router() : prompts.strictRouter();
        List<ChatMessage> messages = List.of(SystemMessage.from(instruction), UserMessage.from(utterance));

        return gateway.invoke(messages)
                .map(parser::parse)
                .onErrorResume(e -> Mono.just(new RouterOutputParser.ParseResult(null, "model call failed: " + e)))
                .flatMap(result -> {
                    if (result.isValid()) {
                        log.debug("router attempt {} -> {}", attempt + 1, result.decision());
                        return Mono.just(result.decision());
                    }
                    log.warn("router attempt {}/{} invalid: {}", attempt + 1, maxRetries + 1, result.error());
                    return attempt(utterance, attempt + 1);
                });
    }
}
