package com.example.phoneshop.lisa.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class CacheKeyUtils {

  public static final String FUSION_PREFIX = "fusion:";
  public static final String RERANK_PREFIX = "rerank:";

  private CacheKeyUtils() {}

  public static String fusionKey(String query, int topK) {
    return FUSION_PREFIX + sha256(normalizeQuery(query) + "|" + topK);
  }

  public static String rerankKey(String query, int topK) {
    return RERANK_PREFIX + sha256(normalizeQuery(query) + "|" + topK + "|rerank");
  }

  /** Trims and collapses runs of whitespace; null becomes empty. */
  public static String normalizeQuery(String query) {
    if (query == null) {
      return "";
    }
    return query.trim().replaceAll("\\s+", " ");
  }

  public static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
      StringBuilder builder = new StringBuilder(hash.length * 2);
      for (byte b : hash) {
        builder.append(String.format("%02x", b));
      }
      return builder.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
