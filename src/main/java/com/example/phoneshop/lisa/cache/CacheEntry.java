package com.example.phoneshop.lisa.cache;

import java.time.Instant;

public record CacheEntry<V>(V value, Instant createdAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
