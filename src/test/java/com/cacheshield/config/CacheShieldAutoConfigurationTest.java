package com.cacheshield.config;

import com.cacheshield.Cache;
import com.cacheshield.codec.CodecRegistry;
import com.cacheshield.exception.BackendUnavailableException;
import com.cacheshield.transaction.TransactionMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 自动装配单元测试
 */
class CacheShieldAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CacheShieldAutoConfiguration.class));

    @Test
    @DisplayName("默认装配内存后端的 Cache")
    void testDefaultCache() {
        contextRunner.run(context -> {
            assertEquals(1, context.getBeansOfType(Cache.class).size());
            assertEquals(1, context.getBeansOfType(CodecRegistry.class).size());
            Cache cache = context.getBean(Cache.class);
            assertEquals("cache-shield", cache.name());
            assertEquals("memory", cache.backendName("any"));
            assertEquals(List.of(BackendUnavailableException.class), cache.defaultFailoverExceptions());
        });
    }

    @Test
    @DisplayName("cache-shield.enabled=false 时不装配")
    void testDisabled() {
        contextRunner.withPropertyValues("cache-shield.enabled=false")
            .run(context -> assertTrue(context.getBeansOfType(Cache.class).isEmpty()));
    }

    @Test
    @DisplayName("绑定配置属性")
    void testPropertiesBinding() {
        contextRunner.withPropertyValues(
                "cache-shield.name=catalog",
                "cache-shield.safe-mode=true",
                "cache-shield.memory.prefix=local:",
                "cache-shield.memory.max-size=500",
                "cache-shield.lock.wait-time=5s",
                "cache-shield.transaction.mode=SERIALIZABLE",
                "cache-shield.failover-exceptions=java.lang.IllegalStateException")
            .run(context -> {
                CacheShieldProperties properties = context.getBean(CacheShieldProperties.class);
                assertTrue(properties.isSafeMode());
                assertEquals(500, properties.getMemory().getMaxSize());
                assertEquals(Duration.ofSeconds(5), properties.getLock().getWaitTime());
                assertEquals(TransactionMode.SERIALIZABLE, properties.getTransaction().getMode());

                Cache cache = context.getBean(Cache.class);
                assertEquals("catalog", cache.name());
                assertEquals(TransactionMode.SERIALIZABLE, cache.transactions().getDefaultMode());
                assertEquals(List.of(IllegalStateException.class), cache.defaultFailoverExceptions());
            });
    }

    @Test
    @DisplayName("非异常类型的故障转移配置启动失败")
    void testInvalidFailoverException() {
        contextRunner.withPropertyValues("cache-shield.failover-exceptions=java.lang.String")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("存在 MeterRegistry 时记录命令指标")
    void testMetricsWhenRegistryPresent() {
        contextRunner.withBean(SimpleMeterRegistry.class)
            .run(context -> {
                Cache cache = context.getBean(Cache.class);
                cache.get("missing");
                SimpleMeterRegistry registry = context.getBean(SimpleMeterRegistry.class);
                assertFalse(registry.getMeters().isEmpty());
            });
    }

    @Test
    @DisplayName("用户自定义 Cache 时不覆盖")
    void testUserDefinedCache() {
        contextRunner.withBean(Cache.class, () -> Cache.builder().name("custom").build())
            .run(context -> assertEquals("custom", context.getBean(Cache.class).name()));
    }
}
