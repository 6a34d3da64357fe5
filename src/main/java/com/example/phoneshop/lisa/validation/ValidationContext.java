package com.example.phoneshop.lisa.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The request message and thread id as they pass through validation. Validators may replace the
 * processed message and attach user facing notices.
 */
public class ValidationContext {

  private final String rawMessage;
  private String processedMessage;
  private final String threadId;
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(String rawMessage, String threadId) {
    this.rawMessage = rawMessage;
    this.processedMessage = rawMessage;
    this.threadId = threadId;
  }

  public String getRawMessage() {
    return rawMessage;
  }

  public String getProcessedMessage() {
    return processedMessage;
  }

  public void setProcessedMessage(String processedMessage) {
    this.processedMessage = processedMessage;
  }

  /** The caller supplied thread id, possibly null. */
  public String getThreadId() {
    return threadId;
  }

  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
