package com.example.phoneshop.lisa.model;

import java.util.UUID;

/** One entry of a thread's stored history. */
public record StoredMessage(Role role, String content, String id) {

  public enum Role {
    USER,
    ASSISTANT,
    SUMMARY
  }

  public StoredMessage {
    content = content == null ? "" : content;
    id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }

  public static StoredMessage user(String content) {
    return new StoredMessage(Role.USER, content, null);
  }

  public static StoredMessage assistant(String content) {
    return new StoredMessage(Role.ASSISTANT, content, null);
  }

  public static StoredMessage summary(String content) {
    return new StoredMessage(Role.SUMMARY, content, null);
  }
}
