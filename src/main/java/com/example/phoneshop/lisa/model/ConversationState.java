package com.example.phoneshop.lisa.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stored history of one conversation thread. Mutated only by the memory manager; overlapping
 * turns on the same thread are the caller's responsibility.
 */
public class ConversationState {

  private final String threadId;
  private final List<StoredMessage> messages = new ArrayList<>();

  public ConversationState(String threadId) {
    this.threadId = Objects.requireNonNull(threadId, "threadId");
  }

  public String getThreadId() {
    return threadId;
  }

  public synchronized List<StoredMessage> snapshot() {
    return List.copyOf(messages);
  }

  public synchronized int size() {
    return messages.size();
  }

  public synchronized void append(StoredMessage message) {
    messages.add(Objects.requireNonNull(message, "message"));
  }

  /** Deletes every stored message and installs the given ones in order. */
  public synchronized void replaceAll(List<StoredMessage> replacement) {
    messages.clear();
    messages.addAll(replacement);
  }
}
