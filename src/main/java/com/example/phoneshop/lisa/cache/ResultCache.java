package com.example.phoneshop.lisa.cache;

import com.example.phoneshop.lisa.model.RankedResult;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Key/value store for ranked result lists, shared by the fusion and rerank stages.
 * Keys carry their stage as a prefix, see {@link CacheKeyUtils}.
 */
public interface ResultCache {

    /** Completes empty on a miss, an expired entry, or an entry that cannot be read. */
    Mono<List<RankedResult>> get(String key);

    /** Last writer wins. Never fails: write problems are logged by the implementation. */
    Mono<Void> put(String key, List<RankedResult> value, Duration ttl);
}
