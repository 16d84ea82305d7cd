package com.cacheshield.config;

import com.cacheshield.Cache;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.backend.RedisBackend;
import com.cacheshield.codec.CodecRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 缓存自动装配
 *
 * 1. CodecRegistry - Redis 值编码
 * 2. Cache - 内存后端 + （存在 StringRedisTemplate 时）Redis 后端，存在 MeterRegistry 时记录命令指标
 */
@Slf4j
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(CacheShieldProperties.class)
@ConditionalOnProperty(prefix = "cache-shield", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheShieldAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CodecRegistry cacheShieldCodecRegistry() {
        return CodecRegistry.withDefaults();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Cache cacheShield(CacheShieldProperties properties,
                             CodecRegistry codecRegistry,
                             ObjectProvider<StringRedisTemplate> redisTemplate,
                             ObjectProvider<MeterRegistry> meterRegistry) {
        CacheShieldProperties.LockConfig lock = properties.getLock();
        Cache.Builder builder = Cache.builder()
            .name(properties.getName())
            .safeMode(properties.isSafeMode())
            .refreshThreads(properties.getRefreshThreads())
            .lockWait(lock.getWaitTime())
            .lockBackoff(IntervalFunction.ofExponentialBackoff(
                lock.getBackoffInitial(), lock.getBackoffMultiplier(), lock.getBackoffMax()))
            .transactionMode(properties.getTransaction().getMode())
            .transactionTimeout(properties.getTransaction().getTimeout());

        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template != null && properties.getRedis().isEnabled()) {
            String prefix = properties.getRedis().getPrefix();
            builder.backend(prefix, new RedisBackend("redis", template, codecRegistry));
            log.info("[CacheShield] Redis backend registered, prefix: '{}'", prefix);
        }
        CacheShieldProperties.MemoryConfig memory = properties.getMemory();
        if (memory.getPrefix() != null) {
            builder.backend(memory.getPrefix(),
                new MemoryBackend("memory", memory.getMaxSize(), Clock.systemUTC()));
            log.info("[CacheShield] Memory backend registered, prefix: '{}'", memory.getPrefix());
        }

        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null) {
            builder.meterRegistry(registry);
        }
        if (!properties.getFailoverExceptions().isEmpty()) {
            builder.failoverExceptions(resolveExceptions(properties.getFailoverExceptions()));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable>[] resolveExceptions(List<String> names) {
        List<Class<? extends Throwable>> types = new ArrayList<>();
        for (String name : names) {
            Class<?> type = ClassUtils.resolveClassName(name, CacheShieldAutoConfiguration.class.getClassLoader());
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Not an exception type: " + name);
            }
            types.add((Class<? extends Throwable>) type);
        }
        return types.toArray(new Class[0]);
    }
}
