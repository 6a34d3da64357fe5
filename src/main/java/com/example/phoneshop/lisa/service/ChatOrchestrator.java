package com.example.phoneshop.lisa.service;

import com.example.phoneshop.lisa.generation.GenerationFailedException;
import com.example.phoneshop.lisa.generation.GenerationGateway;
import com.example.phoneshop.lisa.memory.ConversationMemoryManager;
import com.example.phoneshop.lisa.memory.PreparedTurn;
import com.example.phoneshop.lisa.model.RouterDecision;
import com.example.phoneshop.lisa.model.TurnContext;
import com.example.phoneshop.lisa.prompt.PromptLibrary;
import com.example.phoneshop.lisa.retrieval.ContextFormatter;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import com.example.phoneshop.lisa.router.IntentRouter;
import com.example.phoneshop.lisa.validation.ValidationContext;
import com.example.phoneshop.lisa.validation.ValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one user turn: validate, route, gather context for the chosen path, then generate through
 * the conversation memory. Stages run strictly in that order.
 *
 * <p>Retrieval problems never fail a turn; they degrade to an apology context. Generation
 * problems do, and surface as {@link GenerationFailedException}.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatOrchestrator {

    private static final String STREAM_ERROR = "ERROR: Lisa đang bận, vui lòng thử lại sau.";

    private final ValidationService validationService;
    private final IntentRouter intentRouter;
    private final RetrievalService retrievalService;
    private final ProductComparisonService comparisonService;
    private final ConversationMemoryManager memoryManager;
    private final GenerationGateway gateway;
    private final PromptLibrary prompts;

    public Mono<ChatReply> chat(String message, String threadId) {
        return prepare(message, threadId).flatMap(this::reply);
    }

    public Flux<String> chatStream(String message, String threadId) {
        return prepare(message, threadId).flatMapMany(this::stream);
    }

    /** Validation, routing and context gathering. Fails only with a validation error. */
    public Mono<TurnContext> prepare(String message, String threadId) {
        return Mono.fromCallable(() -> validationService.validate(message, threadId))
                .map(this::newTurn)
                .flatMap(ctx -> intentRouter.classify(ctx.getMessage())
                        .map(decision -> {
                            ctx.setDecision(decision);
                            return ctx.addStep("route", decision.route().name());
                        }))
                .flatMap(this::gatherContext);
    }

    public Mono<ChatReply> reply(TurnContext ctx) {
        return memoryManager.prepareTurn(ctx.getThreadId(), ctx.getMessage(), contextMessage(ctx))
                .flatMap(turn -> gateway.invoke(turn.modelInput())
                        .doOnNext(response -> memoryManager.commitTurn(turn, response)))
                .map(response -> {
                    ctx.addStep("generate", response.length() + " chars");
                    logSteps(ctx);
                    return new ChatReply(ctx.getThreadId(), routeName(ctx), response,
                            ctx.getInfoCount(), List.copyOf(ctx.getNotices()));
                })
                .onErrorMap(e -> !(e instanceof GenerationFailedException),
                        e -> new GenerationFailedException("generation failed for thread " + ctx.getThreadId(), e));
    }

    /**
     * Control lines ({@code thread_id:<id>}, then the info line when there is one) followed by the
     * reply chunks. A generation failure after the control lines becomes a final {@code ERROR:}
     * line. History is committed only when the reply completes.
     */
    public Flux<String> stream(TurnContext ctx) {
        List<String> control = new ArrayList<>(2);
        control.add("thread_id:" + ctx.getThreadId() + "\n");
        String infoLine = ctx.infoLine();
        if (infoLine != null) {
            control.add(infoLine + "\n");
        }

        AtomicBoolean emitted = new AtomicBoolean(false);
        Flux<String> body = memoryManager.prepareTurn(ctx.getThreadId(), ctx.getMessage(), contextMessage(ctx))
                .flatMapMany(turn -> {
                    StringBuilder reply = new StringBuilder();
                    return gateway.stream(turn.modelInput())
                            .doOnNext(chunk -> {
                                reply.append(chunk);
                                emitted.set(true);
                            })
                            .doOnComplete(() -> {
                                memoryManager.commitTurn(turn, reply.toString());
                                ctx.addStep("generate", reply.length() + " chars streamed");
                                logSteps(ctx);
                            });
                })
                .onErrorResume(e -> {
                    log.error("streaming reply failed for thread {}", ctx.getThreadId(), e);
                    return Flux.just((emitted.get() ? "\n" : "") + STREAM_ERROR + "\n");
                });

        return Flux.fromIterable(control).concatWith(body);
    }

    private TurnContext newTurn(ValidationContext validated) {
        String threadId = validated.getThreadId();
        if (threadId == null || threadId.isBlank()) {
            threadId = UUID.randomUUID().toString();
        }
        TurnContext ctx = new TurnContext()
                .setThreadId(threadId)
                .setMessage(validated.getProcessedMessage());
        ctx.getNotices().addAll(validated.getNotices());
        return ctx.addStep("validate", validated.getNotices().isEmpty() ? "ok" : String.join("; ", validated.getNotices()));
    }

    private Mono<TurnContext> gatherContext(TurnContext ctx) {
        RouterDecision decision = ctx.getDecision();
        if (decision instanceof RouterDecision.Retrieval retrieval) {
            return retrievalService.retrieve(retrieval.info())
                    .map(results -> ctx.setResults(results)
                            .setInfoCount(results.size())
                            .setRetrievalContext(ContextFormatter.format(results))
                            .addStep("retrieve", results.size() + " products"))
                    .onErrorResume(e -> {
                        log.error("retrieval failed for '{}', continuing without product info", retrieval.info(), e);
                        return Mono.just(degraded(ctx));
                    });
        }
        if (decision instanceof RouterDecision.Comparison comparison) {
            return comparisonService.compare(List.copyOf(comparison.products()))
                    .map(report -> ctx.setInfoCount(report.foundCount())
                            .setRetrievalContext(ProductComparisonService.toContext(report))
                            .addStep("compare", report.foundCount() + "/" + comparison.products().size() + " products found"))
                    .onErrorResume(e -> {
                        log.error("comparison failed for {}, continuing without product info", comparison.products(), e);
                        return Mono.just(degraded(ctx));
                    });
        }
        return Mono.just(ctx);
    }

    private static TurnContext degraded(TurnContext ctx) {
        return ctx.setRetrievalDegraded(true)
                .setInfoCount(0)
                .setResults(new ArrayList<>())
                .setRetrievalContext(ContextFormatter.RETRIEVAL_UNAVAILABLE)
                .addStep("retrieve", "degraded");
    }

    private String contextMessage(TurnContext ctx) {
        String context = ctx.getRetrievalContext();
        return context == null ? null : prompts.context(context);
    }

    private static String routeName(TurnContext ctx) {
        return ctx.getDecision() == null ? "chat" : ctx.getDecision().route().name().toLowerCase(Locale.ROOT);
    }

    private static void logSteps(TurnContext ctx) {
        if (log.isDebugEnabled()) {
            ctx.getSteps().forEach(s -> log.debug("[{}] {} +{}ms {}", ctx.getThreadId(), s.name(), s.elapsedMs(), s.note()));
        }
    }
}
