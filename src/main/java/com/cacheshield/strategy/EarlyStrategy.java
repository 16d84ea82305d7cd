package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.key.CallArgs;
import com.cacheshield.lock.LockHandle;
import com.cacheshield.ttl.Ttl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;

/**
 * 提前刷新缓存（防缓存击穿）
 *
 * <p>条目保存 值 + 提前过期时间点，整体按 ttl 过期。提前过期前直接返回；
 * 提前过期后、ttl 之前立即返回旧值，并由抢到 {@code <key>:lock} 的调用方提交一次后台重算，
 * 同一个 Key 同时最多只有一个后台重算。条目过期后同步计算。
 */
public class EarlyStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(EarlyStrategy.class);

    private final Ttl earlyTtl;
    private final boolean background;
    private final RefreshListener listener;

    EarlyStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                  Ttl earlyTtl, boolean background, RefreshListener listener) {
        super(cache, operation, settings, "early");
        this.earlyTtl = earlyTtl;
        this.background = background;
        this.listener = listener;
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        Object cached = cache.get(key);
        if (!(cached instanceof EarlyEntry entry)) {
            return callAndStore(args, key, entryWrapper(args));
        }
        if (!entry.isFresh(cache.clock().millis())) {
            triggerRefresh(args, key);
        }
        return hit(key, entry.value());
    }

    private void triggerRefresh(CallArgs args, String key) {
        Duration lockTtl = earlyTtl.resolve(args);
        Optional<LockHandle> lock = cache.locks().tryAcquire(key + CacheConstants.EARLY_LOCK_SUFFIX, lockTtl);
        if (lock.isEmpty()) {
            return;
        }
        LockHandle handle = lock.get();
        log.info("Recalculate cache for {} in background", key);
        CompletableFuture<Void> task;
        try {
            task = refreshInBackground(args, key, entryWrapper(args), listener, handle::close);
        } catch (RejectedExecutionException e) {
            handle.close();
            log.warn("Background refresh rejected, key: {}", key);
            return;
        }
        if (!background) {
            task.join();
        }
    }

    private UnaryOperator<Object> entryWrapper(CallArgs args) {
        return value -> new EarlyEntry(value, cache.clock().millis() + earlyTtl.resolve(args, value).toMillis());
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private Ttl earlyTtl;
        private boolean background = true;
        private RefreshListener listener = RefreshListener.NONE;

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_EARLY);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder earlyTtl(Duration earlyTtl) {
            this.earlyTtl = Ttl.of(earlyTtl);
            return this;
        }

        public Builder earlyTtl(String earlyTtl) {
            this.earlyTtl = Ttl.of(earlyTtl);
            return this;
        }

        public Builder earlyTtl(Ttl earlyTtl) {
            this.earlyTtl = earlyTtl;
            return this;
        }

        /**
         * false 时触发刷新的调用方等待后台重算结束（仍返回旧值）
         */
        public Builder background(boolean background) {
            this.background = background;
            return this;
        }

        public Builder listener(RefreshListener listener) {
            this.listener = listener;
            return this;
        }

        public <R> EarlyStrategy<R> build(CachedOperation<R> operation) {
            if (ttl == null) {
                throw new IllegalStateException("Early strategy requires a ttl");
            }
            Ttl early = earlyTtl != null ? earlyTtl : ttl.scaled(CacheConstants.DEFAULT_EARLY_RATIO);
            return new EarlyStrategy<>(cache, operation, settings(), early, background, listener);
        }
    }
}
