package com.csd.pkghealth.service;

import com.csd.pkghealth.model.CacheStats;
import com.csd.pkghealth.model.DependencyTreeResult;
import com.csd.pkghealth.model.PackageMetadata;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory TTL cache for registry metadata and built dependency trees.
 * Shared by all scans; every operation is a single atomic map operation.
 */
@Slf4j
public class PackageCache {

    private final Map<String, CacheEntry<PackageMetadata>> metadataCache = new ConcurrentHashMap<>();
    private final Map<String, CacheEntry<DependencyTreeResult>> treeCache = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final Duration defaultTtl;
    private final Clock clock;
    private volatile boolean enabled;

    public PackageCache(boolean enabled, Duration defaultTtl, Clock clock) {
        this.enabled = enabled;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public PackageMetadata getMetadata(String packageName) {
        return lookup(metadataCache, packageName);
    }

    public void setMetadata(String packageName, PackageMetadata metadata) {
        setMetadata(packageName, metadata, null);
    }

    public void setMetadata(String packageName, PackageMetadata metadata, Duration ttl) {
        store(metadataCache, packageName, metadata, ttl);
    }

    public DependencyTreeResult getTree(String key) {
        return lookup(treeCache, key);
    }

    public void setTree(String key, DependencyTreeResult tree) {
        setTree(key, tree, null);
    }

    public void setTree(String key, DependencyTreeResult tree, Duration ttl) {
        store(treeCache, key, tree, ttl);
    }

    /**
     * Drops every entry and resets the hit/miss counters.
     */
    public void clear() {
        metadataCache.clear();
        treeCache.clear();
        hits.set(0);
        misses.set(0);
        log.info("Package cache cleared");
    }

    /**
     * Removes expired entries from both maps.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int before = metadataCache.size() + treeCache.size();
        metadataCache.values().removeIf(entry -> !entry.isValid(now));
        treeCache.values().removeIf(entry -> !entry.isValid(now));
        int removed = before - (metadataCache.size() + treeCache.size());
        if (removed > 0) {
            log.debug("Removed {} expired cache entries", removed);
        }
        return Math.max(removed, 0);
    }

    public CacheStats getStats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        return CacheStats.builder()
                .hits(h)
                .misses(m)
                .hitRate(total > 0 ? (double) h / total : 0.0)
                .metadataSize(metadataCache.size())
                .treeSize(treeCache.size())
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    private <T> T lookup(Map<String, CacheEntry<T>> map, String key) {
        if (!enabled) {
            return null;
        }
        CacheEntry<T> entry = map.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return null;
        }
        if (!entry.isValid(clock.instant())) {
            map.remove(key, entry);
            misses.incrementAndGet();
            return null;
        }
        hits.incrementAndGet();
        log.debug("Cache hit for {}", key);
        return entry.getData();
    }

    private <T> void store(Map<String, CacheEntry<T>> map, String key, T value, Duration ttl) {
        if (!enabled || value == null) {
            return;
        }
        Duration effective = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
        map.put(key, new CacheEntry<>(value, clock.instant(), effective));
    }
}
