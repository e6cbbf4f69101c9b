package com.dealengine.condition;

import com.dealengine.common.IdempotencyKeys;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Bounded memo of compiled conditions, keyed by normalized source.
 *
 * Uses Caffeine's size-bounded Window TinyLFU eviction, so free-text sources from
 * less trusted authoring paths cannot grow it without limit. Population goes
 * through {@link Cache#get}, an atomic compute-if-absent: concurrent callers for
 * the same source parse it once. Failed parses are not cached.
 */
@Component
@Slf4j
public class ConditionCache {

    private final ConditionParser parser;
    private final Cache<String, Condition> cache;

    public ConditionCache(ConditionParser parser,
                          @Value("${deal-engine.conditions.cache.max-size:10000}") long maxSize,
                          @Value("${deal-engine.conditions.cache.expire-after-access:PT12H}") Duration expireAfterAccess) {
        this.parser = parser;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(expireAfterAccess)
            .recordStats()
            .removalListener((String key, Condition value, RemovalCause cause) ->
                log.debug("Condition cache eviction: source='{}', cause={}", key, cause))
            .build();

        log.info("Condition cache initialized: maxSize={}, expireAfterAccess={}", maxSize, expireAfterAccess);
    }

    /**
     * Compile a condition, reusing the cached tree when this normalized source was seen before.
     *
     * @throws com.dealengine.common.exception.ConditionParseException if the source is not valid
     */
    public Condition compile(String source) {
        String normalized = ConditionParser.normalize(source);
        return cache.get(normalized, key -> {
            Predicate predicate = parser.parse(key);
            log.debug("Compiled condition '{}' -> {}", key, predicate.describe());
            return new Condition(key, IdempotencyKeys.conditionSignature(key), predicate);
        });
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
