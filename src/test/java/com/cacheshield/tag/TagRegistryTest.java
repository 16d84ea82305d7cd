package com.cacheshield.tag;

import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tag 登记单元测试
 */
class TagRegistryTest {

    private MutableClock clock;
    private MemoryBackend backend;
    private TagRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        backend = new MemoryBackend("memory", 1000, clock);
        registry = new TagRegistry(backend, backend);
    }

    @Test
    @DisplayName("删除 Tag 删除所有成员 Key 与成员集合")
    void testDeleteTag() {
        for (int i = 0; i < 250; i++) {
            backend.set("sku:" + i, "v" + i, Duration.ofMinutes(5));
            registry.register("sku:" + i, List.of("spu:1"), Duration.ofMinutes(5));
        }
        backend.set("sku:other", "x");
        registry.register("sku:other", List.of("spu:2"), null);

        assertEquals(250, registry.deleteTag("spu:1"));

        assertFalse(backend.exists("sku:0"));
        assertFalse(backend.exists("sku:249"));
        assertFalse(backend.exists(TagRegistry.tagKey("spu:1")));
        assertTrue(backend.exists("sku:other"));
    }

    @Test
    @DisplayName("一个 Key 可以登记到多个 Tag")
    void testMultipleTags() {
        backend.set("sku:1", "v");
        registry.register("sku:1", List.of("spu:1", "brand:9"), null);

        assertEquals(1, registry.deleteTag("brand:9"));
        assertEquals(0, registry.deleteTag("spu:1"));
    }

    @Test
    @DisplayName("取消登记后删除 Tag 不影响该 Key")
    void testUnregister() {
        backend.set("sku:1", "v");
        registry.register("sku:1", List.of("spu:1"), null);
        registry.unregister("sku:1", List.of("spu:1"));

        assertEquals(0, registry.deleteTag("spu:1"));
        assertTrue(backend.exists("sku:1"));
    }

    @Test
    @DisplayName("成员集合的过期时间不短于最长存活的成员")
    void testMembershipExpiryFollowsLongestMember() {
        String tagKey = TagRegistry.tagKey("spu:1");

        registry.register("sku:1", List.of("spu:1"), Duration.ofSeconds(60));
        assertEquals(60_000, backend.getExpire(tagKey));

        registry.register("sku:2", List.of("spu:1"), Duration.ofSeconds(120));
        assertEquals(120_000, backend.getExpire(tagKey));

        registry.register("sku:3", List.of("spu:1"), Duration.ofSeconds(30));
        assertEquals(120_000, backend.getExpire(tagKey));

        clock.advance(Duration.ofSeconds(121));
        assertFalse(backend.exists(tagKey));
    }

    @Test
    @DisplayName("永不过期的成员使成员集合永不过期")
    void testUnlimitedMemberKeepsMembership() {
        String tagKey = TagRegistry.tagKey("spu:1");

        registry.register("sku:1", List.of("spu:1"), Duration.ofSeconds(60));
        registry.register("sku:2", List.of("spu:1"), null);
        assertEquals(CacheConstants.UNLIMITED, backend.getExpire(tagKey));

        registry.register("sku:3", List.of("spu:1"), Duration.ofSeconds(30));
        assertEquals(CacheConstants.UNLIMITED, backend.getExpire(tagKey));
    }

    @Test
    @DisplayName("Tag Key 格式")
    void testTagKey() {
        assertEquals("_tag:spu:1", TagRegistry.tagKey("spu:1"));
    }
}
