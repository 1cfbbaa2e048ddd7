package tech.gatekeeper.platform.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.jboss.logging.Logger;
import tech.gatekeeper.platform.authorization.events.InvalidationEvent;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, time-expiring store of permission decisions, backed by Caffeine.
 *
 * <p>Each entry expires at {@code now + ttl}, where the TTL is chosen per entry.
 * Expired entries are never returned: a lookup past expiry behaves as a miss and the
 * stale entry is dropped. Past {@code maxSize} entries, Caffeine's size policy evicts
 * the least recently and least frequently used entries.
 *
 * <p>Safe for concurrent use without external locking. Reads do not serialize on a
 * shared lock.
 *
 * <p>Entries are owned by this instance. Other caches (in this or another execution
 * context) hold their own copies and are kept in step through invalidation events.
 */
public class PermissionCache {

    private static final Logger LOG = Logger.getLogger(PermissionCache.class);

    private final Cache<CacheKey, CacheEntry> cache;
    private final Duration defaultTtl;
    private final long maxSize;
    private final Ticker ticker;

    public PermissionCache(long maxSize, Duration defaultTtl) {
        this(maxSize, defaultTtl, Ticker.systemTicker());
    }

    public PermissionCache(long maxSize, Duration defaultTtl, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.defaultTtl = requirePositive(defaultTtl);
        this.maxSize = maxSize;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new DecisionExpiry())
            .ticker(ticker)
            .executor(Runnable::run)
            .recordStats()
            .build();
    }

    /**
     * Get a cached decision.
     *
     * @param key The cache key
     * @return The cached decision, or empty if absent or expired
     */
    public Optional<Boolean> get(CacheKey key) {
        CacheEntry entry = cache.getIfPresent(key);
        return entry != null ? Optional.of(entry.decision()) : Optional.empty();
    }

    /**
     * Put a decision in the cache with the default TTL.
     */
    public void put(CacheKey key, boolean decision) {
        put(key, decision, defaultTtl);
    }

    /**
     * Put a decision in the cache with a custom TTL.
     */
    public void put(CacheKey key, boolean decision, Duration ttl) {
        long expiresAt = ticker.read() + requirePositive(ttl).toNanos();
        cache.put(key, new CacheEntry(decision, expiresAt));
    }

    /**
     * Remove every entry the event applies to.
     *
     * @return number of entries removed
     */
    public int invalidate(InvalidationEvent event) {
        if (event instanceof InvalidationEvent.Everything) {
            int size = (int) cache.estimatedSize();
            cache.invalidateAll();
            LOG.debugf("Invalidated all cached permission decisions (%d entries)", size);
            return size;
        }

        List<CacheKey> stale = cache.asMap().keySet().stream()
            .filter(event::appliesTo)
            .toList();
        cache.invalidateAll(stale);
        LOG.debugf("Invalidated %d cached permission decisions for %s", stale.size(), event);
        return stale.size();
    }

    /**
     * Drop expired entries now instead of waiting for them to be looked up.
     * Not required for correctness; reclaims memory.
     *
     * @return number of entries dropped
     */
    public long sweepExpired() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        return Math.max(0, before - cache.estimatedSize());
    }

    /**
     * @return number of live entries after pending maintenance has run
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long maxSize() {
        return maxSize;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public PermissionCacheStats stats() {
        CacheStats stats = cache.stats();
        return new PermissionCacheStats(
            cache.estimatedSize(),
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            stats.hitRate()
        );
    }

    /**
     * Register Caffeine's size, hit, miss and eviction meters under the given cache name.
     */
    public void bindTo(MeterRegistry registry, String cacheName) {
        CaffeineCacheMetrics.monitor(registry, cache, cacheName);
    }

    private static Duration requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        return ttl;
    }

    /**
     * Decision plus the ticker time at which it stops being served.
     */
    record CacheEntry(boolean decision, long expiresAtNanos) {}

    private static final class DecisionExpiry implements Expiry<CacheKey, CacheEntry> {

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry entry, long currentTime) {
            return Math.max(0, entry.expiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry entry, long currentTime, long currentDuration) {
            return Math.max(0, entry.expiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
