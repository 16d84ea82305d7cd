package com.cacheshield.observe;

import com.cacheshield.Cache;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.key.CallArgs;
import com.cacheshield.strategy.CachedOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 缓存使用记录单元测试
 */
class CacheObservationTest {

    private Cache cache;

    @BeforeEach
    void setUp() {
        cache = Cache.builder()
            .backend(new MemoryBackend())
            .backend("hot:", new MemoryBackend("hot", 100, Clock.systemUTC()))
            .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("写入与命中都被记录")
    void testRecordsWriteAndHit() {
        CachedOperation<String> loader = cache.simple().key("user:{id}").ttl("5m").build(args -> "alice");

        try (CacheObservation.Scope scope = CacheObservation.start()) {
            loader.apply(CallArgs.of("id", 1));
            loader.apply(CallArgs.of("id", 1));

            List<CacheRecord> records = scope.records();
            assertEquals(2, records.size());
            assertEquals(new CacheRecord("user:1", "simple", "memory", Duration.ofMinutes(5), null), records.get(0));
            assertEquals(new CacheRecord("user:1", "simple", "memory", null, null), records.get(1));
        }
        assertFalse(CacheObservation.isActive());
    }

    @Test
    @DisplayName("记录路由到的后端名称")
    void testRecordsBackend() {
        CachedOperation<String> loader = cache.simple().key("hot:{id}").ttl(60).build(args -> "v");

        try (CacheObservation.Scope scope = CacheObservation.start()) {
            loader.apply(CallArgs.of("id", 1));
            assertEquals("hot", scope.records().get(0).backend());
        }
    }

    @Test
    @DisplayName("故障转移记录被降级掉的异常")
    void testRecordsFailoverError() {
        AtomicBoolean failing = new AtomicBoolean();
        CachedOperation<String> loader = cache.failover()
            .key("price:{id}")
            .ttl("1h")
            .exceptions(IllegalStateException.class)
            .build(args -> {
                if (failing.get()) {
                    throw new IllegalStateException("down");
                }
                return "100";
            });
        loader.apply(CallArgs.of("id", 1));
        failing.set(true);

        try (CacheObservation.Scope scope = CacheObservation.start()) {
            assertEquals("100", loader.apply(CallArgs.of("id", 1)));
            CacheRecord record = scope.records().get(0);
            assertEquals("fail:price:1", record.key());
            assertInstanceOf(IllegalStateException.class, record.error());
        }
    }

    @Test
    @DisplayName("嵌套作用域同时记录到外层")
    void testNestedScopes() {
        CachedOperation<String> loader = cache.simple().key("user:{id}").ttl(60).build(args -> "v");

        try (CacheObservation.Scope outer = CacheObservation.start()) {
            loader.apply(CallArgs.of("id", 1));
            try (CacheObservation.Scope inner = CacheObservation.start()) {
                loader.apply(CallArgs.of("id", 2));
                assertEquals(1, inner.records().size());
            }
            assertEquals(2, outer.records().size());
            assertTrue(CacheObservation.isActive());
        }
    }

    @Test
    @DisplayName("没有作用域时不记录")
    void testNoScope() {
        CacheObservation.record(new CacheRecord("k", "simple", "memory", null, null));
        assertFalse(CacheObservation.isActive());
    }
}
