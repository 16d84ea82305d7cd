package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.key.CallArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * 按命中次数失效的缓存
 *
 * <p>命中计数保存在 {@code <key>:counter}，每次读取原子自增。计数不超过 cacheHits 时返回缓存值；
 * 计数等于 updateAfter 时额外启动一次后台刷新。超过 cacheHits 时同步重新计算并重置计数。
 */
public class HitStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(HitStrategy.class);

    private final long cacheHits;
    private final long updateAfter;
    private final RefreshListener listener;

    HitStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                long cacheHits, long updateAfter, RefreshListener listener) {
        super(cache, operation, settings, "hit");
        this.cacheHits = cacheHits;
        this.updateAfter = updateAfter;
        this.listener = listener;
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        String counterKey = key + CacheConstants.HIT_COUNTER_SUFFIX;
        Object cached = cache.get(key);
        if (cached != null) {
            long hits = cache.incr(counterKey, 1, ttl(args, null));
            if (hits <= cacheHits) {
                if (updateAfter > 0 && hits == updateAfter) {
                    log.debug("Hit count reached update threshold, refreshing key: {}", key);
                    refreshInBackground(args, key, value -> value, listener, () -> cache.delete(counterKey));
                }
                return hit(key, cached);
            }
            log.info("Hit count exhausted, recomputing key: {}, hits: {}", key, hits);
        }
        R result = callAndStore(args, key, UnaryOperator.identity());
        cache.delete(counterKey);
        return result;
    }

    /**
     * 当前命中计数（读取次数）
     */
    public long hits(CallArgs args) {
        Object value = cache.get(key(args) + CacheConstants.HIT_COUNTER_SUFFIX);
        return value instanceof Number number ? number.longValue() : 0;
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private long cacheHits;
        private long updateAfter;
        private RefreshListener listener = RefreshListener.NONE;

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_HIT);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder cacheHits(long cacheHits) {
            this.cacheHits = cacheHits;
            return this;
        }

        /**
         * 命中计数达到该值时后台刷新，0 表示不刷新
         */
        public Builder updateAfter(long updateAfter) {
            this.updateAfter = updateAfter;
            return this;
        }

        public Builder listener(RefreshListener listener) {
            this.listener = listener;
            return this;
        }

        public <R> HitStrategy<R> build(CachedOperation<R> operation) {
            if (cacheHits <= 0) {
                throw new IllegalArgumentException("cacheHits must be positive");
            }
            if (updateAfter < 0 || updateAfter > cacheHits) {
                throw new IllegalArgumentException("updateAfter must be within [0, cacheHits]");
            }
            if (ttl == null) {
                throw new IllegalStateException("Hit strategy requires a ttl");
            }
            return new HitStrategy<>(cache, operation, settings(), cacheHits, updateAfter, listener);
        }
    }
}
