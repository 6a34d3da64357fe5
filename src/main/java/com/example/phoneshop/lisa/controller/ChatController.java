package com.example.phoneshop.lisa.controller;

import com.example.phoneshop.lisa.generation.GenerationFailedException;
import com.example.phoneshop.lisa.request.ChatRequest;
import com.example.phoneshop.lisa.response.ErrorResponse;
import com.example.phoneshop.lisa.service.ChatOrchestrator;
import com.example.phoneshop.lisa.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@Tag(name = "Chat", description = "Talk to Lisa, the phone-shop assistant")
@RequiredArgsConstructor
public class ChatController {

    private final ChatOrchestrator orchestrator;

    @PostMapping(value = "/chat", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "One full reply",
            description = "Routes the message, retrieves product context when needed and returns the whole reply. "
                    + "Omit thread_id to start a new conversation."
    )
    public Mono<ResponseEntity<Object>> chat(@RequestBody ChatRequest req) {
        return orchestrator.chat(req.getMessage(), req.getThreadId())
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(new ErrorResponse(ex.getReasons()))))
                .onErrorResume(GenerationFailedException.class, ex -> {
                    log.error("chat reply unavailable", ex);
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(ErrorResponse.of("The assistant is temporarily unavailable. Please try again later.")));
                })
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while answering chat", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(unexpected(ex)));
                });
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(
            summary = "Streamed reply",
            description = "Plain-text stream: a thread_id:<id> line, then RETRIEVAL_INFO:<n> or COMPARISON_INFO:<n> "
                    + "when product context was used, then the reply text as it is generated."
    )
    public Mono<ResponseEntity<Flux<String>>> stream(@RequestBody ChatRequest req) {
        return orchestrator.prepare(req.getMessage(), req.getThreadId())
                .map(ctx -> ResponseEntity.ok()
                        .contentType(MediaType.TEXT_PLAIN)
                        .body(orchestrator.stream(ctx)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest()
                                .contentType(MediaType.TEXT_PLAIN)
                                .body(Flux.just(String.join("\n", ex.getReasons()) + "\n"))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while preparing chat stream", ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .contentType(MediaType.TEXT_PLAIN)
                            .body(Flux.just(unexpected(ex).errors().get(0) + "\n")));
                });
    }

    private static ErrorResponse unexpected(Throwable ex) {
        String detail = ex.getMessage();
        return ErrorResponse.of((detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail);
    }
}
