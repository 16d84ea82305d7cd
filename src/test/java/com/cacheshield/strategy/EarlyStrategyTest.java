package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.key.CallArgs;
import com.cacheshield.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 提前刷新策略单元测试
 */
class EarlyStrategyTest {

    private MutableClock clock;
    private Cache cache;
    private final AtomicInteger calls = new AtomicInteger();
    private final CallArgs args = CallArgs.of("id", 1);

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = Cache.builder()
            .clock(clock)
            .backend(new MemoryBackend("memory", 1000, clock))
            .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("提前过期后 100 个并发调用立即返回旧值，只触发一次后台重算")
    void testSingleBackgroundRecompute() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch refreshed = new CountDownLatch(1);
        EarlyStrategy<String> loader = cache.early()
            .key("spu:{id}")
            .ttl("10m")
            .earlyTtl("7m")
            .listener(new RefreshListener() {
                @Override
                public void onRefreshed(String key, Object value) {
                    refreshed.countDown();
                }
            })
            .build(a -> {
                int n = calls.incrementAndGet();
                if (n > 1) {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return "v" + n;
            });

        assertEquals("v1", loader.apply(args));
        clock.advance(Duration.ofMinutes(8));

        int callers = 100;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(16);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return loader.apply(args);
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertEquals("v1", result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        release.countDown();
        assertTrue(refreshed.await(5, TimeUnit.SECONDS));
        assertEquals(2, calls.get());
        assertEquals("v2", loader.apply(args));
    }

    @Test
    @DisplayName("提前过期前直接命中")
    void testFreshHit() {
        EarlyStrategy<String> loader = cache.early()
            .key("spu:{id}")
            .ttl("10m")
            .earlyTtl("7m")
            .build(a -> "v" + calls.incrementAndGet());

        loader.apply(args);
        clock.advance(Duration.ofMinutes(6));

        assertEquals("v1", loader.apply(args));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("background=false - 调用方等待重算完成但仍返回旧值")
    void testForegroundRefresh() {
        EarlyStrategy<String> loader = cache.early()
            .key("spu:{id}")
            .ttl("10m")
            .earlyTtl("7m")
            .background(false)
            .build(a -> "v" + calls.incrementAndGet());

        loader.apply(args);
        clock.advance(Duration.ofMinutes(8));

        assertEquals("v1", loader.apply(args));
        assertEquals(2, calls.get());
        assertEquals("v2", loader.apply(args));
        assertFalse(cache.exists("early:v2:spu:1:lock"));
    }

    @Test
    @DisplayName("后台重算失败通过回调通知，旧值不受影响")
    void testRefreshFailure() throws InterruptedException {
        CountDownLatch failed = new CountDownLatch(1);
        EarlyStrategy<String> loader = cache.early()
            .key("spu:{id}")
            .ttl("10m")
            .earlyTtl("7m")
            .listener(new RefreshListener() {
                @Override
                public void onFailure(String key, Throwable error) {
                    failed.countDown();
                }
            })
            .build(a -> {
                if (calls.incrementAndGet() > 1) {
                    throw new IllegalStateException("db down");
                }
                return "v1";
            });

        loader.apply(args);
        clock.advance(Duration.ofMinutes(8));

        assertEquals("v1", loader.apply(args));
        assertTrue(failed.await(5, TimeUnit.SECONDS));
        assertEquals("v1", ((EarlyEntry) cache.get("early:v2:spu:1")).value());
    }

    @Test
    @DisplayName("整体过期后同步重新计算")
    void testHardExpiry() {
        EarlyStrategy<String> loader = cache.early()
            .key("spu:{id}")
            .ttl("10m")
            .build(a -> "v" + calls.incrementAndGet());

        loader.apply(args);
        clock.advance(Duration.ofMinutes(10));

        assertEquals("v2", loader.apply(args));
    }
}
