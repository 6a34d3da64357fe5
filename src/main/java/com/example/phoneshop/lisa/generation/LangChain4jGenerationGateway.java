package com.example.phoneshop.lisa.generation;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class LangChain4jGenerationGateway implements GenerationGateway {

    private final ChatModel chatModel;
    private final StreamingChatModel streamingChatModel;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;

    public LangChain4jGenerationGateway(ChatModel chatModel,
                                        StreamingChatModel streamingChatModel,
                                        Duration timeout,
                                        RetryPolicy retryPolicy) {
        this.chatModel = chatModel;
        this.streamingChatModel = streamingChatModel;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Mono<String> invoke(List<ChatMessage> messages) {
        Mono<String> call = Mono.fromCallable(() -> {
                    ChatResponse response = chatModel.chat(messages);
                    AiMessage ai = response == null ? null : response.aiMessage();
                    return ai == null || ai.text() == null ? "" : ai.text();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);
        return retryPolicy.applyTo(call, "chat invoke")
                .doOnError(e -> log.error("generation failed after retries: {}", e.toString()));
    }

    /**
     * Streams partial responses. A failure before the first chunk is retried like
     * {@link #invoke}; once text has been emitted the error is passed through, since a replay
     * would duplicate what the client already received.
     */
    @Override
    public Flux<String> stream(List<ChatMessage> messages) {
        AtomicBoolean emitted = new AtomicBoolean(false);
        Flux<String> call = Flux.<String>create(sink -> streamingChatModel.chat(messages,
                        new StreamingChatResponseHandler() {
                            @Override
                            public void onPartialResponse(String partialResponse) {
                                if (partialResponse != null && !partialResponse.isEmpty()) {
                                    emitted.set(true);
                                    sink.next(partialResponse);
                                }
                            }

                            @Override
                            public void onCompleteResponse(ChatResponse completeResponse) {
                                sink.complete();
                            }

                            @Override
                            public void onError(Throwable error) {
                                sink.error(error);
                            }
                        }))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout);

        RetryPolicy firstChunkOnly = new RetryPolicy(retryPolicy.maxAttempts(), retryPolicy.baseDelay(),
                e -> !emitted.get() && retryPolicy.retryable().test(e));
        return firstChunkOnly.applyTo(call, "chat stream")
                .doOnError(e -> log.error("streaming generation failed: {}", e.toString()));
    }
}
