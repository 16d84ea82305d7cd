package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.counter.SlidingWindowCounter;

import java.time.Duration;

/**
 * 滑动窗口限流：周期切分为若干子窗口，计数为最近一个周期内各子窗口之和
 */
public class SliceRateLimitStrategy<R> extends AbstractRateLimitStrategy<R> {

    private final SlidingWindowCounter counter;
    private final int slices;

    SliceRateLimitStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                           long limit, Duration period, RateLimitAction action, int slices) {
        super(cache, operation, settings, "slice_rate_limit", limit, period, action);
        this.counter = new SlidingWindowCounter(cache, cache.clock());
        this.slices = slices;
    }

    @Override
    protected long count(String key) {
        return counter.increment(key, period, slices);
    }

    public static class Builder extends RateLimitBuilder<Builder> {

        private int slices = CacheConstants.DEFAULT_SLICES;

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_SLICE_RATE_LIMIT);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder slices(int slices) {
            this.slices = slices;
            return this;
        }

        public <R> SliceRateLimitStrategy<R> build(CachedOperation<R> operation) {
            prepare();
            if (slices <= 0) {
                throw new IllegalArgumentException("slices must be positive");
            }
            return new SliceRateLimitStrategy<>(cache, operation, settings(), limit, period, action, slices);
        }
    }
}
