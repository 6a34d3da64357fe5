package com.example.phoneshop.lisa.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * One indexed catalog passage. Immutable once indexed; shared read-only by the indexes and
 * every downstream stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Passage(String id, String content, PassageMetadata metadata) {

  public Passage {
    Objects.requireNonNull(id, "id");
    content = content == null ? "" : content;
    metadata = metadata == null ? PassageMetadata.empty() : metadata;
  }

  /**
   * Aggregation key used for fusion and reranking. Falls back to the passage id when the stored
   * metadata carries no product id.
   */
  @JsonIgnore
  public String productKey() {
    String productId = metadata.productId();
    return (productId == null || productId.isBlank()) ? id : productId;
  }
}
