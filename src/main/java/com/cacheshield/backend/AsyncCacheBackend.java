package com.cacheshield.backend;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * 后端的异步视图
 * 每个操作提交到给定线程池执行，返回 {@link CompletableFuture}，失败以异常完成
 */
public class AsyncCacheBackend {

    private final CacheBackend delegate;
    private final Executor executor;

    public AsyncCacheBackend(CacheBackend delegate, Executor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }

    public CacheBackend delegate() {
        return delegate;
    }

    public CompletableFuture<Object> get(String key) {
        return submit(() -> delegate.get(key));
    }

    public CompletableFuture<List<Object>> getMany(List<String> keys) {
        return submit(() -> delegate.getMany(keys));
    }

    public CompletableFuture<Boolean> set(String key, Object value, Duration ttl, ExistCondition exist) {
        return submit(() -> delegate.set(key, value, ttl, exist));
    }

    public CompletableFuture<Boolean> set(String key, Object value, Duration ttl) {
        return set(key, value, ttl, ExistCondition.ANY);
    }

    public CompletableFuture<Void> setMany(Map<String, Object> pairs, Duration ttl) {
        return CompletableFuture.runAsync(() -> delegate.setMany(pairs, ttl), executor);
    }

    public CompletableFuture<Long> incr(String key, long delta, Duration ttl) {
        return submit(() -> delegate.incr(key, delta, ttl));
    }

    public CompletableFuture<Boolean> expire(String key, Duration ttl) {
        return submit(() -> delegate.expire(key, ttl));
    }

    public CompletableFuture<Long> getExpire(String key) {
        return submit(() -> delegate.getExpire(key));
    }

    public CompletableFuture<Boolean> delete(String key) {
        return submit(() -> delegate.delete(key));
    }

    public CompletableFuture<Long> deleteMany(Collection<String> keys) {
        return submit(() -> delegate.deleteMany(keys));
    }

    public CompletableFuture<Long> deleteMatch(String pattern) {
        return submit(() -> delegate.deleteMatch(pattern));
    }

    public CompletableFuture<Boolean> deleteIfValue(String key, Object expected) {
        return submit(() -> delegate.deleteIfValue(key, expected));
    }

    public CompletableFuture<Boolean> replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        return submit(() -> delegate.replaceIfValue(key, expected, value, ttl));
    }

    /**
     * 扫描结果在后台线程中物化为列表
     */
    public CompletableFuture<List<String>> scan(String pattern) {
        return submit(() -> {
            try (Stream<String> keys = delegate.scan(pattern)) {
                return keys.toList();
            }
        });
    }

    public CompletableFuture<Boolean> exists(String key) {
        return submit(() -> delegate.exists(key));
    }

    public CompletableFuture<Long> getKeysCount() {
        return submit(delegate::getKeysCount);
    }

    public CompletableFuture<String> ping(String message) {
        return submit(() -> delegate.ping(message));
    }

    public CompletableFuture<Void> clear() {
        return CompletableFuture.runAsync(delegate::clear, executor);
    }

    public CompletableFuture<boolean[]> getBits(String key, long... offsets) {
        return submit(() -> delegate.getBits(key, offsets));
    }

    public CompletableFuture<Void> setBits(String key, long... offsets) {
        return CompletableFuture.runAsync(() -> delegate.setBits(key, offsets), executor);
    }

    public CompletableFuture<Set<String>> setPop(String key, int count) {
        return submit(() -> delegate.setPop(key, count));
    }

    public CompletableFuture<Void> close() {
        return CompletableFuture.runAsync(delegate::close, executor);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> action) {
        return CompletableFuture.supplyAsync(action, executor);
    }
}
