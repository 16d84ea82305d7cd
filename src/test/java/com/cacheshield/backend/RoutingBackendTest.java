package com.cacheshield.backend;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 前缀路由后端单元测试
 */
class RoutingBackendTest {

    private MemoryBackend defaultBackend;
    private MemoryBackend userBackend;
    private RoutingBackend routing;

    @BeforeEach
    void setUp() {
        defaultBackend = new MemoryBackend("default", 100, Clock.systemUTC());
        userBackend = new MemoryBackend("users", 100, Clock.systemUTC());
        routing = new RoutingBackend("routing", Map.of("", defaultBackend, "user:", userBackend));
    }

    @Test
    @DisplayName("必须注册默认后端")
    void testDefaultBackendRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> new RoutingBackend("r", Map.of("user:", userBackend)));
    }

    @Test
    @DisplayName("最长前缀匹配")
    void testRouteByLongestPrefix() {
        routing.set("user:1", "u", null);
        routing.set("order:1", "o", null);

        assertEquals("u", userBackend.get("user:1"));
        assertNull(defaultBackend.get("user:1"));
        assertEquals("o", defaultBackend.get("order:1"));
        assertSame(userBackend, routing.route("user:42"));
    }

    @Test
    @DisplayName("批量读取跨后端分组，结果保持输入顺序")
    void testGetManyAcrossBackends() {
        routing.set("user:1", "u1", null);
        routing.set("order:1", "o1", null);
        routing.set("user:2", "u2", null);

        List<Object> values = routing.getMany(List.of("order:1", "user:2", "missing", "user:1"));

        assertEquals(List.of("o1", "u2"), values.subList(0, 2));
        assertNull(values.get(2));
        assertEquals("u1", values.get(3));
    }

    @Test
    @DisplayName("通配模式广播到可能匹配的后端")
    void testPatternBroadcast() {
        routing.set("user:1", "u", null);
        routing.set("order:1", "o", null);

        try (Stream<String> keys = routing.scan("*")) {
            assertEquals(2, keys.count());
        }
        assertEquals(1, routing.deleteMatch("user:*"));
        assertEquals(1, routing.getKeysCount());
    }
}
