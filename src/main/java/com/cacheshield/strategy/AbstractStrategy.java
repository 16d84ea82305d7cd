package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.key.CallArgs;
import com.cacheshield.key.KeyTemplate;
import com.cacheshield.observe.CacheObservation;
import com.cacheshield.observe.CacheRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * 策略基类：Key 推导、写入条件、写入 + Tag 登记 + 观测记录
 *
 * @param <R> 结果类型
 */
public abstract class AbstractStrategy<R> implements CachedOperation<R> {

    private static final Logger log = LoggerFactory.getLogger(AbstractStrategy.class);

    protected final Cache cache;
    protected final CachedOperation<R> operation;
    protected final StrategySettings settings;
    private final String strategyName;

    protected AbstractStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                               String strategyName) {
        this.cache = cache;
        this.operation = operation;
        this.settings = settings;
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public StrategySettings getSettings() {
        return settings;
    }

    public String key(CallArgs args) {
        return settings.key().resolve(args);
    }

    protected Duration ttl(CallArgs args, Object result) {
        return settings.ttl() == null ? null : settings.ttl().resolve(args, result);
    }

    /**
     * 调用目标操作，满足写入条件时把结果（或可缓存的异常）包装后写入
     *
     * @param wrap 写入前对值的包装（如 Early 条目），结果本身不受影响
     */
    protected R callAndStore(CallArgs args, String key, UnaryOperator<Object> wrap) {
        long start = System.nanoTime();
        R result;
        try {
            result = operation.apply(args);
        } catch (RuntimeException e) {
            if (shouldStore(null, e, args, key, System.nanoTime() - start)) {
                store(key, wrap.apply(new CachedFailure(e)), ttl(args, null), args, e);
            }
            throw e;
        }
        if (result == null) {
            // 后端不保存 null，null 即未命中
            return null;
        }
        if (shouldStore(result, null, args, key, System.nanoTime() - start)) {
            store(key, wrap.apply(result), ttl(args, result), args, null);
        }
        return result;
    }

    protected boolean shouldStore(Object result, Throwable error, CallArgs args, String key, long elapsedNanos) {
        if (settings.timeCondition() != null && elapsedNanos < settings.timeCondition().toNanos()) {
            return false;
        }
        return settings.condition().test(result, error, args, key);
    }

    protected void store(String key, Object value, Duration ttl, CallArgs args, Throwable error) {
        if (value == null) {
            log.debug("Skip storing null result, key: {}", key);
            return;
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            log.debug("Skip storing with non-positive ttl, key: {}", key);
            return;
        }
        cache.set(key, value, ttl);
        if (!settings.tags().isEmpty()) {
            cache.tags().register(key, tags(args), ttl);
        }
        observe(key, ttl, error);
    }

    protected List<String> tags(CallArgs args) {
        List<String> tags = new ArrayList<>(settings.tags().size());
        for (KeyTemplate tag : settings.tags()) {
            tags.add(tag.render(args));
        }
        return tags;
    }

    protected void observe(String key, Duration ttl, Throwable error) {
        if (CacheObservation.isActive()) {
            CacheObservation.record(new CacheRecord(key, strategyName, cache.backendName(key), ttl, error));
        }
    }

    /**
     * 命中：记录观测并返回缓存值（缓存的异常重新抛出）
     */
    protected R hit(String key, Object cached) {
        log.debug("Cache hit: strategy={}, key={}", strategyName, key);
        observe(key, null, cached instanceof CachedFailure failure ? failure.error() : null);
        return unwrap(cached);
    }

    @SuppressWarnings("unchecked")
    protected R unwrap(Object cached) {
        return (R) CachedFailure.unwrap(cached);
    }

    /**
     * 在后台线程中重新计算并写入；结果与失败都通过 listener 通知，不影响触发方
     *
     * @param onDone 任务结束时执行（释放刷新锁）
     */
    protected CompletableFuture<Void> refreshInBackground(CallArgs args, String key, UnaryOperator<Object> wrap,
                                                          RefreshListener listener, Runnable onDone) {
        return CompletableFuture.runAsync(() -> {
            try {
                R value = callAndStore(args, key, wrap);
                log.info("Background refresh completed: strategy={}, key={}", strategyName, key);
                listener.onRefreshed(key, value);
            } catch (RuntimeException e) {
                log.error("Background refresh failed: strategy={}, key={}", strategyName, key, e);
                listener.onFailure(key, e);
            } finally {
                onDone.run();
            }
        }, cache.executor());
    }
}
