package com.example.phoneshop.lisa.retrieval;

public enum RerankPolicy {
    /** Best {@code topK} products by score. */
    TOP_K,
    /** Every product whose best score exceeds the configured threshold. */
    THRESHOLD
}
