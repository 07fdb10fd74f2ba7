package com.dcision.pipeline.cache;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.PipelineException;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Stage outputs keyed by fingerprint, with at most one computation in flight per
 * fingerprint.
 * <p>
 * The first caller for a fingerprint claims it and computes on its own thread; concurrent
 * callers wait for that claim and receive the same value or the same exception. A claim
 * that fails is dropped, so failures are never cached. Entries expire {@code ttl} after
 * they were written.
 */
@Slf4j
@Component
public class ResultCache {

    private final AsyncCache<String, CacheEntry> entries;
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public ResultCache(PipelineProperties properties, Clock clock) {
        this(properties.getCache().getTtl(), properties.getCache().getMaxEntries(), Ticker.systemTicker(), clock);
    }

    public ResultCache(Duration ttl, long maxEntries, Ticker ticker, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .executor(Runnable::run)
                .buildAsync();
    }

    /**
     * Returns the cached value for {@code fingerprint}, or runs {@code compute} on the
     * calling thread if nobody holds it.
     *
     * @throws InterruptedException if interrupted while waiting for another caller's computation
     */
    public <T> CacheLookup<T> getOrCompute(String fingerprint, StageName stage, Class<T> type,
                                           Supplier<T> compute) throws InterruptedException {
        CompletableFuture<CacheEntry> claim = new CompletableFuture<>();
        CompletableFuture<CacheEntry> existing = entries.asMap().putIfAbsent(fingerprint, claim);
        if (existing != null) {
            return CacheLookup.hit(type.cast(await(existing).getPayload()));
        }

        T value;
        try {
            value = compute.get();
        } catch (RuntimeException | Error e) {
            entries.asMap().remove(fingerprint, claim);
            claim.completeExceptionally(e);
            throw e;
        }
        claim.complete(new CacheEntry(fingerprint, stage, value, clock.instant(), ttl));
        log.debug("Cached {} output under {}", stage.wireName(), fingerprint);
        return CacheLookup.computed(value);
    }

    public boolean contains(String fingerprint) {
        CompletableFuture<CacheEntry> future = entries.getIfPresent(fingerprint);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    public long size() {
        return entries.synchronous().estimatedSize();
    }

    public void invalidateAll() {
        entries.synchronous().invalidateAll();
    }

    private static CacheEntry await(CompletableFuture<CacheEntry> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PipelineException(ErrorKind.INTERNAL, "Shared computation failed", cause);
        }
    }
}
