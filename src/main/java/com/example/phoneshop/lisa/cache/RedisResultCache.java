package com.example.phoneshop.lisa.cache;

import com.example.phoneshop.lisa.model.RankedResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Redis-backed cache that survives restarts. Each value is a JSON document holding the result
 * list and its expiry; Redis TTL is set as well, but expiry is re-checked on read.
 */
@Slf4j
public class RedisResultCache implements ResultCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;

    public RedisResultCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Mono<List<RankedResult>> get(String key) {
        return Mono.fromCallable(() -> read(key))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("redis cache read failed key={}: {}", key, e.toString());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> put(String key, List<RankedResult> value, Duration ttl) {
        return Mono.<Void>fromRunnable(() -> write(key, value, ttl))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("redis cache write failed key={}: {}", key, e.toString());
                    return Mono.empty();
                });
    }

    private List<RankedResult> read(String key) {
        String raw = redisTemplate.opsForValue().get(keyPrefix + key);
        if (raw == null) {
            return null;
        }
        Payload payload;
        try {
            payload = objectMapper.readValue(raw, Payload.class);
        } catch (JsonProcessingException e) {
            log.warn("discarding corrupt cache entry key={}: {}", key, e.getOriginalMessage());
            return null;
        }
        if (payload == null || payload.results() == null) {
            return null;
        }
        if (clock.millis() > payload.expiresAtEpochMillis()) {
            return null;
        }
        return payload.results();
    }

    private void write(String key, List<RankedResult> value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(new Payload(clock.millis() + ttl.toMillis(), value));
        } catch (JsonProcessingException e) {
            log.warn("cache value not serializable key={}: {}", key, e.getOriginalMessage());
            return;
        }
        redisTemplate.opsForValue().set(keyPrefix + key, json, ttl);
    }

    public record Payload(long expiresAtEpochMillis, List<RankedResult> results) {
    }
}
