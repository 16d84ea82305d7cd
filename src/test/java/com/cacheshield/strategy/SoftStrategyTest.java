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
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 软过期策略单元测试
 */
class SoftStrategyTest {

    private MutableClock clock;
    private Cache cache;
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean failing = new AtomicBoolean();
    private final CallArgs args = CallArgs.of("id", 1);
    private SoftStrategy<String> loader;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = Cache.builder()
            .clock(clock)
            .backend(new MemoryBackend("memory", 1000, clock))
            .build();
        loader = cache.soft()
            .key("spu:{id}")
            .ttl("10m")
            .softTtl("1m")
            .exceptions(IllegalStateException.class)
            .build(a -> {
                calls.incrementAndGet();
                if (failing.get()) {
                    throw new IllegalStateException("db down");
                }
                return "v" + calls.get();
            });
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("软过期前命中")
    void testFreshHit() {
        loader.apply(args);
        clock.advance(Duration.ofSeconds(30));

        assertEquals("v1", loader.apply(args));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("软过期后同步重算")
    void testRecomputeAfterSoftExpiry() {
        loader.apply(args);
        clock.advance(Duration.ofMinutes(2));

        assertEquals("v2", loader.apply(args));
    }

    @Test
    @DisplayName("软过期后重算失败返回旧值")
    void testFallbackOnFailure() {
        loader.apply(args);
        clock.advance(Duration.ofMinutes(2));
        failing.set(true);

        assertEquals("v1", loader.apply(args));
    }

    @Test
    @DisplayName("硬过期后失败向上传播")
    void testHardExpiryPropagates() {
        loader.apply(args);
        clock.advance(Duration.ofMinutes(10));
        failing.set(true);

        assertThrows(IllegalStateException.class, () -> loader.apply(args));
    }
}
