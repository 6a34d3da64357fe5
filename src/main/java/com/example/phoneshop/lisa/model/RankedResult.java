package com.example.phoneshop.lisa.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A passage with a score from one ranking stage. Transient: lives at most as long as the cache
 * entry that holds it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RankedResult(Passage passage, double score, ResultSource source) {

  public RankedResult {
    Objects.requireNonNull(passage, "passage");
    Objects.requireNonNull(source, "source");
  }

  public RankedResult rescored(double newScore, ResultSource newSource) {
    return new RankedResult(passage, newScore, newSource);
  }
}
