package com.example.phoneshop.lisa.memory;

import com.example.phoneshop.lisa.model.StoredMessage;
import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * Result of {@link ConversationMemoryManager#prepareTurn}: the messages to send to the model and
 * what has to be written back once the reply is known.
 *
 * @param summary the new summary when {@code mode} is {@link Mode#COMPACTING}, otherwise null
 */
public record PreparedTurn(String threadId,
                           Mode mode,
                           StoredMessage user,
                           StoredMessage summary,
                           List<ChatMessage> modelInput) {

    public enum Mode {
        NORMAL,
        COMPACTING
    }

    public PreparedTurn {
        modelInput = List.copyOf(modelInput);
    }
}
