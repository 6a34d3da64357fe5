package com.example.phoneshop.lisa.config;

import com.example.phoneshop.lisa.cache.InMemoryResultCache;
import com.example.phoneshop.lisa.cache.RedisResultCache;
import com.example.phoneshop.lisa.cache.ResultCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(LisaProperties props,
                                   ObjectProvider<StringRedisTemplate> redisTemplate,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        LisaProperties.Cache cfg = props.getCache();
        if (cfg.getStore() == LisaProperties.Cache.Store.REDIS) {
            log.info("result cache: redis (prefix '{}')", cfg.getKeyPrefix());
            return new RedisResultCache(redisTemplate.getObject(), objectMapper, clock, cfg.getKeyPrefix());
        }
        log.info("result cache: in-memory (max {} entries)", cfg.getMaxEntries());
        return new InMemoryResultCache(cfg.getMaxEntries(), clock);
    }
}
