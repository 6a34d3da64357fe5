package com.example.phoneshop.lisa.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-turn state carried through route, retrieval, memory and generation.
 */
@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class TurnContext {
  // input
  private String threadId;
  private String message;
  private List<String> notices = new ArrayList<>();

  // routing
  private RouterDecision decision;

  // retrieval / comparison
  private List<RankedResult> results = new ArrayList<>();
  private int infoCount;
  private String retrievalContext;
  private boolean retrievalDegraded;

  // audit trail
  private Instant startedAt = Instant.now();
  private List<StepLog> steps = new ArrayList<>();

  public TurnContext addStep(String name, String note) {
    long elapsed = Duration.between(startedAt, Instant.now()).toMillis();
    steps.add(new StepLog(name, note, Instant.now(), elapsed));
    return this;
  }

  /** Control line announcing how much context this turn carries, or null on the chat path. */
  public String infoLine() {
    if (decision == null) {
      return null;
    }
    return switch (decision.route()) {
      case RETRIEVAL -> "RETRIEVAL_INFO:" + infoCount;
      case COMPARISON -> "COMPARISON_INFO:" + infoCount;
      case CHAT -> null;
    };
  }
}
