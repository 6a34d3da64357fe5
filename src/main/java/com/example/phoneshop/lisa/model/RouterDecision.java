package com.example.phoneshop.lisa.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Execution path chosen for one user turn. Exactly one variant is active; the compact
 * constructors reject shapes that must never become a decision.
 */
public interface RouterDecision {

  Route route();

  enum Route {
    CHAT,
    RETRIEVAL,
    COMPARISON
  }

  record Chat(String info) implements RouterDecision {
    public Chat {
      info = info == null ? "" : info;
    }

    @Override
    public Route route() {
      return Route.CHAT;
    }
  }

  record Retrieval(String info) implements RouterDecision {
    public Retrieval {
      if (info == null || info.isBlank()) {
        throw new IllegalArgumentException("retrieval info must be non-empty");
      }
    }

    @Override
    public Route route() {
      return Route.RETRIEVAL;
    }
  }

  record Comparison(Set<String> products) implements RouterDecision {
    public Comparison {
      Objects.requireNonNull(products, "products");
      Set<String> cleaned = new LinkedHashSet<>();
      for (String p : products) {
        if (p != null && !p.isBlank()) {
          cleaned.add(p.trim());
        }
      }
      if (cleaned.size() < 2) {
        throw new IllegalArgumentException("comparison requires >= 2 non-empty product names");
      }
      products = Collections.unmodifiableSet(cleaned);
    }

    @Override
    public Route route() {
      return Route.COMPARISON;
    }
  }
}
