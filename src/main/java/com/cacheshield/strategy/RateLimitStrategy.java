package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.counter.WindowCounter;

import java.time.Duration;

/**
 * 固定窗口限流：每个周期一个计数窗口
 */
public class RateLimitStrategy<R> extends AbstractRateLimitStrategy<R> {

    private final WindowCounter counter;

    RateLimitStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                      long limit, Duration period, RateLimitAction action) {
        super(cache, operation, settings, "rate_limit", limit, period, action);
        this.counter = new WindowCounter(cache, cache.clock());
    }

    @Override
    protected long count(String key) {
        return counter.increment(key, period);
    }

    public static class Builder extends RateLimitBuilder<Builder> {

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_RATE_LIMIT);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public <R> RateLimitStrategy<R> build(CachedOperation<R> operation) {
            prepare();
            return new RateLimitStrategy<>(cache, operation, settings(), limit, period, action);
        }
    }
}
