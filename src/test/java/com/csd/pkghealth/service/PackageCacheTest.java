package com.csd.pkghealth.service;

import com.csd.pkghealth.model.CacheStats;
import com.csd.pkghealth.model.DependencyTreeNode;
import com.csd.pkghealth.model.DependencyTreeResult;
import com.csd.pkghealth.model.PackageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PackageCacheTest {

    private MutableClock clock;
    private PackageCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(RegistryFixtures.NOW);
        cache = new PackageCache(true, Duration.ofHours(1), clock);
    }

    @Test
    void storedMetadataIsReturnedUntilTtlExpires() {
        PackageMetadata lodash = RegistryFixtures.pkg("lodash", "4.17.21", Map.of());
        cache.setMetadata("lodash", lodash);

        assertSame(lodash, cache.getMetadata("lodash"));
        assertSame(lodash, cache.getMetadata("lodash"));

        clock.advance(Duration.ofMinutes(60));
        assertSame(lodash, cache.getMetadata("lodash"), "entry is still valid at exactly the ttl");

        clock.advance(Duration.ofSeconds(1));
        assertNull(cache.getMetadata("lodash"));
        assertEquals(0, cache.getStats().getMetadataSize(), "expired entry is removed on lookup");
    }

    @Test
    void perEntryTtlOverridesDefault() {
        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()), Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(6));
        assertNull(cache.getMetadata("a"));
    }

    @Test
    void nonPositiveTtlFallsBackToDefault() {
        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()), Duration.ZERO);
        cache.setMetadata("b", RegistryFixtures.pkg("b", "1.0.0", Map.of()), Duration.ofSeconds(-5));
        clock.advance(Duration.ofMinutes(30));
        assertNotNull(cache.getMetadata("a"));
        assertNotNull(cache.getMetadata("b"));
    }

    @Test
    void statsTrackHitsAndMisses() {
        assertEquals(0.0, cache.getStats().getHitRate());

        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()));
        cache.getMetadata("a");
        cache.getMetadata("a");
        cache.getMetadata("missing");

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(2.0 / 3.0, stats.getHitRate(), 1e-9);
        assertEquals(1, stats.getTotalSize());
    }

    @Test
    void expiredLookupCountsAsMiss() {
        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()));
        clock.advance(Duration.ofHours(2));
        cache.getMetadata("a");
        assertEquals(1, cache.getStats().getMisses());
        assertEquals(0, cache.getStats().getHits());
    }

    @Test
    void treesAreCachedSeparately() {
        DependencyTreeNode root = DependencyTreeNode.builder().name("app").version("1.0.0").build();
        DependencyTreeResult tree = new DependencyTreeResult(root, 1, Map.of());
        cache.setTree("app@1.0.0", tree);
        cache.setMetadata("app", RegistryFixtures.pkg("app", "1.0.0", Map.of()));

        assertSame(tree, cache.getTree("app@1.0.0"));
        assertNull(cache.getMetadata("app@1.0.0"));
        assertEquals(1, cache.getStats().getTreeSize());
        assertEquals(1, cache.getStats().getMetadataSize());
        assertEquals(2, cache.getStats().getTotalSize());
    }

    @Test
    void disabledCacheStoresNothingAndCountsNothing() {
        cache.setEnabled(false);
        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()));
        assertNull(cache.getMetadata("a"));
        assertEquals(0, cache.getStats().getMisses());

        cache.setEnabled(true);
        assertNull(cache.getMetadata("a"), "nothing was stored while disabled");
        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()));
        assertNotNull(cache.getMetadata("a"));
    }

    @Test
    void clearDropsEntriesAndResetsCounters() {
        cache.setMetadata("a", RegistryFixtures.pkg("a", "1.0.0", Map.of()));
        cache.getMetadata("a");
        cache.getMetadata("b");

        cache.clear();

        CacheStats stats = cache.getStats();
        assertEquals(0, stats.getHits());
        assertEquals(0, stats.getMisses());
        assertEquals(0, stats.getTotalSize());
    }

    @Test
    void cleanupRemovesOnlyExpiredEntries() {
        cache.setMetadata("short", RegistryFixtures.pkg("short", "1.0.0", Map.of()), Duration.ofMinutes(1));
        cache.setMetadata("long", RegistryFixtures.pkg("long", "1.0.0", Map.of()));
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.cleanupExpired());
        assertEquals(1, cache.getStats().getMetadataSize());
        assertNotNull(cache.getMetadata("long"));
    }
}
