package com.example.phoneshop.lisa.cache;

import com.example.phoneshop.lisa.model.RankedResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local cache. Expiry is checked on read; once {@code maxEntries} is exceeded the
 * oldest inserted keys are evicted first. Rewriting a key moves it to the back of the eviction order.
 */
@Slf4j
public class InMemoryResultCache implements ResultCache {

    private final ConcurrentHashMap<String, CacheEntry<List<RankedResult>>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> order = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final Clock clock;

    public InMemoryResultCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    @Override
    public Mono<List<RankedResult>> get(String key) {
        return Mono.fromSupplier(() -> {
            if (key == null) {
                return null;
            }
            CacheEntry<List<RankedResult>> entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                if (entries.remove(key, entry)) {
                    order.remove(key);
                }
                log.debug("cache entry expired key={}", key);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> put(String key, List<RankedResult> value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            if (key == null || value == null || ttl == null || ttl.isNegative() || ttl.isZero()) {
                return;
            }
            Instant now = clock.instant();
            if (entries.put(key, new CacheEntry<>(List.copyOf(value), now, now.plus(ttl))) != null) {
                order.remove(key);
            }
            order.add(key);
            evictIfNeeded();
        });
    }

    int size() {
        return entries.size();
    }

    int queuedKeys() {
        return order.size();
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            String key = order.poll();
            if (key == null) {
                break;
            }
            entries.remove(key);
        }
    }
}
