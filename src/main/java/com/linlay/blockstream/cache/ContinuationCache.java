package com.linlay.blockstream.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 跨轮次推理续接缓存。
 * <p>
 * 按 provider 命名空间隔离，保存上一轮 provider 返回的不透明续接数据（如 thought signature、
 * 加密的 reasoning item）。条目写入时计算绝对过期时间，过期条目在下一次 {@link #get(String)} 时惰性清除，
 * 不启动后台清理线程。
 */
public class ContinuationCache<V> {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private static final Logger log = LoggerFactory.getLogger(ContinuationCache.class);

    private final String namespace;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, ContinuationCacheEntry<V>> entries = new ConcurrentHashMap<>();

    public ContinuationCache(String namespace) {
        this(namespace, DEFAULT_TTL, Clock.systemUTC());
    }

    public ContinuationCache(String namespace, Duration ttl, Clock clock) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.namespace = namespace;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String namespace() {
        return namespace;
    }

    public void set(String key, V value) {
        requireKey(key);
        Objects.requireNonNull(value, "value must not be null");
        Instant expiresAt = clock.instant().plus(ttl);
        entries.put(key, new ContinuationCacheEntry<>(key, value, expiresAt));
        log.debug("[{}] continuation stored key={}, expiresAt={}", namespace, key, expiresAt);
    }

    public Optional<V> get(String key) {
        requireKey(key);
        ContinuationCacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            // only drop the entry we looked at; a concurrent set may already have replaced it
            entries.remove(key, entry);
            log.debug("[{}] continuation expired key={}", namespace, key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void remove(String key) {
        requireKey(key);
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    private void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }
}
