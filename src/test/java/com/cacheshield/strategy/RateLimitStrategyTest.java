package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.exception.RateLimitException;
import com.cacheshield.key.CallArgs;
import com.cacheshield.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 限流策略单元测试
 */
class RateLimitStrategyTest {

    private MutableClock clock;
    private Cache cache;
    private final AtomicInteger calls = new AtomicInteger();
    private final CallArgs args = CallArgs.of("user", "u1");

    @BeforeEach
    void setUp() {
        // 从窗口起点开始
        clock = new MutableClock(1_700_000_040_000L);
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
    @DisplayName("limit=10 - 第 11 次调用被拒绝，封禁期内不再调用")
    void testLimitAndBan() {
        RateLimitStrategy<String> api = cache.rateLimit()
            .key("api:{user}")
            .limit(10)
            .period("60s")
            .build(a -> "ok-" + calls.incrementAndGet());

        for (int i = 0; i < 10; i++) {
            api.apply(args);
        }
        assertThrows(RateLimitException.class, () -> api.apply(args));
        assertEquals(10, calls.get());

        // 进入下一个窗口，但封禁尚未过期
        clock.advance(Duration.ofSeconds(59));
        assertThrows(RateLimitException.class, () -> api.apply(args));
        assertEquals(10, calls.get());

        clock.advance(Duration.ofSeconds(1));
        assertEquals("ok-11", api.apply(args));
    }

    @Test
    @DisplayName("自定义限流动作的返回值作为结果")
    void testFallbackAction() {
        RateLimitStrategy<String> api = cache.rateLimit()
            .key("api:{user}")
            .limit(1)
            .period(Duration.ofMinutes(1))
            .action((a, key) -> "limited")
            .build(a -> "ok");

        assertEquals("ok", api.apply(args));
        assertEquals("limited", api.apply(args));
    }

    @Test
    @DisplayName("不同 Key 独立计数")
    void testIndependentKeys() {
        RateLimitStrategy<String> api = cache.rateLimit()
            .key("api:{user}")
            .limit(1)
            .period("1m")
            .build(a -> "ok");

        assertEquals("ok", api.apply(CallArgs.of("user", "u1")));
        assertEquals("ok", api.apply(CallArgs.of("user", "u2")));
    }

    @Test
    @DisplayName("滑动窗口限流")
    void testSliceRateLimit() {
        SliceRateLimitStrategy<String> api = cache.sliceRateLimit()
            .key("api:{user}")
            .limit(3)
            .period("60s")
            .slices(6)
            .ttl(Duration.ofSeconds(1))
            .build(a -> "ok-" + calls.incrementAndGet());

        for (int i = 0; i < 3; i++) {
            api.apply(args);
        }
        assertThrows(RateLimitException.class, () -> api.apply(args));

        // 封禁过期后仍在同一周期内，计数没有滑出
        clock.advance(Duration.ofSeconds(2));
        assertThrows(RateLimitException.class, () -> api.apply(args));

        clock.advance(Duration.ofSeconds(60));
        assertEquals("ok-4", api.apply(args));
    }

    @Test
    @DisplayName("参数校验")
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> cache.rateLimit().key("api:{user}").limit(0).period("1m").build(a -> "ok"));
        assertThrows(IllegalArgumentException.class,
            () -> cache.rateLimit().key("api:{user}").limit(1).build(a -> "ok"));
    }
}
