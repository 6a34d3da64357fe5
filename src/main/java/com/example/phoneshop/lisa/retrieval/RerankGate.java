package com.example.phoneshop.lisa.retrieval;

import java.util.List;
import java.util.Locale;

public enum RerankGate {
    ALWAYS,
    /** Rerank only queries asking for comparison or evaluation. */
    KEYWORDS;

    public boolean admits(String query, List<String> keywords) {
        if (this == ALWAYS) {
            return true;
        }
        if (query == null || keywords == null) {
            return false;
        }
        String q = query.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (k != null && !k.isBlank() && q.contains(k.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
