package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.trading.pipeline.TradeProposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Advisor proposals keyed by (user, ticker) with a TTL. Concurrent misses for one key share a
 * single computation; a failed computation leaves no entry behind and is rethrown to every waiter.
 */
@Component
@Slf4j
public class RecommendationCache {

    public record CacheKey(Long userId, String ticker) {
        public CacheKey {
            ticker = ticker == null ? null : ticker.toUpperCase(Locale.ROOT);
        }
    }

    private static final class Entry {
        private final CompletableFuture<TradeProposal> result = new CompletableFuture<>();
        private volatile Instant expiresAt;
    }

    private final Map<CacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public RecommendationCache(Clock clock) {
        this.clock = clock;
    }

    public TradeProposal getOrCompute(CacheKey key, Duration ttl, Supplier<TradeProposal> computeFn) {
        while (true) {
            Entry existing = entries.get(key);
            if (existing != null) {
                if (!existing.result.isDone()) {
                    log.debug("Joining in-flight computation for {}", key);
                    return await(existing);
                }
                if (!isExpired(existing)) {
                    log.debug("Cache hit for {}", key);
                    return existing.result.join();
                }
                entries.remove(key, existing);
                continue;
            }
            Entry created = new Entry();
            if (entries.putIfAbsent(key, created) == null) {
                return compute(key, created, ttl, computeFn);
            }
        }
    }

    private TradeProposal compute(CacheKey key, Entry entry, Duration ttl, Supplier<TradeProposal> computeFn) {
        TradeProposal value;
        try {
            value = computeFn.get();
        } catch (RuntimeException | Error e) {
            // remove before completing so late arrivals start a fresh computation
            entries.remove(key, entry);
            entry.result.completeExceptionally(e);
            throw e;
        }
        entry.expiresAt = Instant.now(clock).plus(ttl);
        entry.result.complete(value);
        return value;
    }

    private TradeProposal await(Entry entry) {
        try {
            return entry.result.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public void invalidate(CacheKey key) {
        Entry removed = entries.remove(key);
        if (removed != null) {
            log.debug("Invalidated cache entry {}", key);
        }
    }

    public int evictExpired() {
        int evicted = 0;
        for (Map.Entry<CacheKey, Entry> mapping : entries.entrySet()) {
            Entry entry = mapping.getValue();
            if (entry.result.isDone() && isExpired(entry) && entries.remove(mapping.getKey(), entry)) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry) {
        Instant expiresAt = entry.expiresAt;
        return expiresAt != null && Instant.now(clock).isAfter(expiresAt);
    }
}
