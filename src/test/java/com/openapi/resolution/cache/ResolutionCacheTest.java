package com.openapi.resolution.cache;

import com.openapi.resolution.core.model.PrimitiveSchema;
import com.openapi.resolution.core.model.PrimitiveType;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResolutionCacheTest {

    private static ResolvedSchema schema(String name) {
        return PrimitiveSchema.of(PrimitiveType.STRING).withSourceName(name);
    }

    @Nested
    @DisplayName("NoOpResolutionCache")
    class NoOpTests {

        @Test
        @DisplayName("Should compute every time")
        void alwaysComputes() {
            NoOpResolutionCache cache = new NoOpResolutionCache();
            AtomicInteger computed = new AtomicInteger();

            cache.getOrCompute("k", () -> {
                computed.incrementAndGet();
                return schema("A");
            });
            cache.getOrCompute("k", () -> {
                computed.incrementAndGet();
                return schema("A");
            });

            assertEquals(2, computed.get());
            assertTrue(cache.getIfPresent("k").isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void emptyStats() {
            NoOpResolutionCache cache = new NoOpResolutionCache();

            assertEquals(CacheStats.empty(), cache.getStats());
            assertEquals(0, cache.evictTo(0));
        }
    }

    @Nested
    @DisplayName("CaffeineResolutionCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should compute once and then serve hits")
        void computesOnce() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            AtomicInteger computed = new AtomicInteger();

            for (int i = 0; i < 4; i++) {
                cache.getOrCompute("doc|ref:#/components/schemas/A", () -> {
                    computed.incrementAndGet();
                    return schema("A");
                });
            }

            CacheStats stats = cache.getStats();
            assertEquals(1, computed.get());
            assertEquals(3, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(0.75, stats.hitRate(), 0.0001);
            assertEquals(1, stats.size());
            assertEquals(1, stats.totalSizeHint());
        }

        @Test
        @DisplayName("Failures are not cached")
        void failuresNotCached() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());

            assertThrows(IllegalStateException.class, () -> cache.getOrCompute("k", () -> {
                throw new IllegalStateException("boom");
            }));
            ResolvedSchema value = cache.getOrCompute("k", () -> schema("B"));

            assertEquals("B", value.sourceName());
            assertTrue(cache.getIfPresent("k").isPresent());
        }

        @Test
        @DisplayName("Concurrent requests for one key share a single computation")
        void concurrentSingleFlight() throws Exception {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            AtomicInteger computed = new AtomicInteger();
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<ResolvedSchema>> results = new ArrayList<>();
                results.add(pool.submit(() -> cache.getOrCompute("k", () -> {
                    computed.incrementAndGet();
                    started.countDown();
                    awaitQuietly(release);
                    return schema("Shared");
                })));
                assertTrue(started.await(5, TimeUnit.SECONDS));
                for (int i = 0; i < 7; i++) {
                    results.add(pool.submit(() -> cache.getOrCompute("k", () -> {
                        computed.incrementAndGet();
                        return schema("Other");
                    })));
                }
                release.countDown();

                for (Future<ResolvedSchema> result : results) {
                    assertEquals("Shared", result.get(5, TimeUnit.SECONDS).sourceName());
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, computed.get());
            assertEquals(7, cache.getStats().hits());
        }

        @Test
        @DisplayName("A recursive request from the computing thread computes without waiting")
        void reentrantRequest() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());

            ResolvedSchema outer = cache.getOrCompute("k", () -> cache.getOrCompute("k", () -> schema("Inner")));

            assertEquals("Inner", outer.sourceName());
        }

        @Test
        @DisplayName("evictTo shrinks the cache and records evictions")
        void evictTo() {
            MetricsService metrics = mock(MetricsService.class);
            CaffeineResolutionCache cache = new CaffeineResolutionCache(new CacheConfig(true, 10), metrics);
            for (int i = 0; i < 10; i++) {
                String name = "S" + i;
                cache.getOrCompute(name, () -> schema(name));
            }

            long removed = cache.evictTo(5);

            assertTrue(removed >= 5, "removed " + removed);
            assertTrue(cache.getStats().size() <= 5);
            assertEquals(10, cache.maxSize());
            verify(metrics, atLeastOnce()).recordCacheEviction();
            verify(metrics, times(10)).recordCacheMiss();
        }

        @Test
        @DisplayName("clear and invalidate drop entries")
        void clearAndInvalidate() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            cache.getOrCompute("a", () -> schema("A"));
            cache.getOrCompute("b", () -> schema("B"));

            cache.invalidate("a");
            assertTrue(cache.getIfPresent("a").isEmpty());
            assertTrue(cache.getIfPresent("b").isPresent());

            cache.clear();
            assertTrue(cache.getIfPresent("b").isEmpty());
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
