package com.example.phoneshop.lisa.memory;

import com.example.phoneshop.lisa.generation.GenerationGateway;
import com.example.phoneshop.lisa.model.ConversationState;
import com.example.phoneshop.lisa.model.StoredMessage;
import com.example.phoneshop.lisa.prompt.PromptLibrary;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-thread conversation history with summary compaction.
 *
 * <p>Below the threshold the full stored history is replayed to the model and each turn appends
 * the user message and the reply. Once the stored history reaches {@code summaryThreshold}
 * messages it is condensed into one summary, the model sees only that summary plus the new user
 * message, and the stored history is replaced by {@code [summary, user, reply]}.
 *
 * <p>The persona and any per-turn context are system messages added to the model input only.
 */
@Slf4j
public class ConversationMemoryManager {

    private final Map<String, ConversationState> threads = new ConcurrentHashMap<>();
    private final GenerationGateway gateway;
    private final PromptLibrary prompts;
    private final int summaryThreshold;

    public ConversationMemoryManager(GenerationGateway gateway, PromptLibrary prompts, int summaryThreshold) {
        if (summaryThreshold < 1) {
            throw new IllegalArgumentException("summaryThreshold must be >= 1");
        }
        this.gateway = gateway;
        this.prompts = prompts;
        this.summaryThreshold = summaryThreshold;
    }

    /**
     * @param contextSystemMessage retrieval or comparison context for this turn, or null
     */
    public Mono<PreparedTurn> prepareTurn(String threadId, String userMessage, String contextSystemMessage) {
        ConversationState state = threads.computeIfAbsent(threadId, ConversationState::new);
        List<StoredMessage> history = state.snapshot();
        StoredMessage user = StoredMessage.user(userMessage);

        if (history.size() >= summaryThreshold) {
            log.info("compacting thread {} ({} stored messages)", threadId, history.size());
            return summarize(history).map(summaryText -> {
                StoredMessage summary = StoredMessage.summary(summaryText);
                List<ChatMessage> input = head(contextSystemMessage);
                addConverted(input, summary);
                addConverted(input, user);
                return new PreparedTurn(threadId, PreparedTurn.Mode.COMPACTING, user, summary, input);
            });
        }

        List<ChatMessage> input = head(contextSystemMessage);
        for (StoredMessage m : history) {
            addConverted(input, m);
        }
        addConverted(input, user);
        return Mono.just(new PreparedTurn(threadId, PreparedTurn.Mode.NORMAL, user, null, input));
    }

    public void commitTurn(PreparedTurn turn, String response) {
        ConversationState state = threads.computeIfAbsent(turn.threadId(), ConversationState::new);
        StoredMessage reply = StoredMessage.assistant(response);
        if (turn.mode() == PreparedTurn.Mode.COMPACTING) {
            state.replaceAll(List.of(turn.summary(), turn.user(), reply));
        } else {
            state.append(turn.user());
            state.append(reply);
        }
        log.debug("thread {} now holds {} messages", turn.threadId(), state.size());
    }

    public List<StoredMessage> history(String threadId) {
        ConversationState state = threads.get(threadId);
        return state == null ? List.of() : state.snapshot();
    }

    public void clear(String threadId) {
        threads.remove(threadId);
    }

    private Mono<String> summarize(List<StoredMessage> history) {
        List<ChatMessage> input = new ArrayList<>(history.size() + 1);
        for (StoredMessage m : history) {
            addConverted(input, m);
        }
        input.add(UserMessage.from(prompts.summary()));
        return gateway.invoke(input);
    }

    private List<ChatMessage> head(String contextSystemMessage) {
        List<ChatMessage> input = new ArrayList<>();
        input.add(SystemMessage.from(prompts.persona()));
        if (contextSystemMessage != null && !contextSystemMessage.isBlank()) {
            input.add(SystemMessage.from(contextSystemMessage));
        }
        return input;
    }

    // summaries are replayed as assistant turns
    private static void addConverted(List<ChatMessage> input, StoredMessage m) {
        if (m.content().isBlank()) {
            return;
        }
        switch (m.role()) {
            case USER -> input.add(UserMessage.from(m.content()));
            case ASSISTANT, SUMMARY -> input.add(AiMessage.from(m.content()));
        }
    }
}
