package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.exception.LockTimeoutException;
import com.cacheshield.key.CallArgs;
import com.cacheshield.lock.LockHandle;

import java.time.Duration;

/**
 * 互斥执行：持有 Key 锁期间调用目标操作，任何退出路径都会释放锁
 *
 * <p>本身不写缓存，通常包在缓存策略外层（锁内二次检查缓存），防止并发回源。
 */
public class LockedStrategy<R> extends AbstractStrategy<R> {

    private final boolean waitForLock;
    private final Duration waitTimeout;

    LockedStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                   boolean waitForLock, Duration waitTimeout) {
        super(cache, operation, settings, "locked");
        this.waitForLock = waitForLock;
        this.waitTimeout = waitTimeout;
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        Duration lockTtl = ttl(args, null);
        LockHandle handle = waitForLock
            ? cache.locks().acquire(key, lockTtl, waitTimeout)
            : cache.locks().tryAcquire(key, lockTtl)
                .orElseThrow(() -> new LockTimeoutException(key, "Lock is busy for key: " + key));
        try (handle) {
            return operation.apply(args);
        }
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private boolean waitForLock = true;
        private Duration waitTimeout = Duration.ofMillis(CacheConstants.LOCK_WAIT_TIME_MS);

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_LOCK);
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * false 时锁被占用立即失败
         */
        public Builder waitForLock(boolean waitForLock) {
            this.waitForLock = waitForLock;
            return this;
        }

        public Builder waitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
            return this;
        }

        public <R> LockedStrategy<R> build(CachedOperation<R> operation) {
            if (ttl == null) {
                ttl(Duration.ofMillis(CacheConstants.LOCK_LEASE_TIME_MS));
            }
            return new LockedStrategy<>(cache, operation, settings(), waitForLock, waitTimeout);
        }
    }
}
