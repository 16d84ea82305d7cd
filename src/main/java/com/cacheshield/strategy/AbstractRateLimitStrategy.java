package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.key.CallArgs;
import com.cacheshield.ttl.Ttl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 限流策略基类
 *
 * <p>先检查封禁标记 {@code <key>:ban}，存在时直接执行限流动作且不计数；
 * 否则计数，超过 limit 时写入封禁标记（ttl 为封禁时长）并执行限流动作。
 */
public abstract class AbstractRateLimitStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRateLimitStrategy.class);

    protected final long limit;
    protected final Duration period;
    private final RateLimitAction action;

    protected AbstractRateLimitStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                                        String strategyName, long limit, Duration period, RateLimitAction action) {
        super(cache, operation, settings, strategyName);
        this.limit = limit;
        this.period = period;
        this.action = action;
    }

    /**
     * 计入本次调用并返回周期内的调用次数
     */
    protected abstract long count(String key);

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        String banKey = key + CacheConstants.RATE_BAN_SUFFIX;
        if (cache.exists(banKey)) {
            log.debug("Rate limit ban active, key: {}", key);
            return limited(args, key);
        }
        long count = count(key);
        if (count > limit) {
            Duration banTtl = ttl(args, null);
            if (banTtl != null) {
                cache.set(banKey, Boolean.TRUE, banTtl);
            }
            log.warn("Rate limit reached, key: {}, count: {}, limit: {}", key, count, limit);
            return limited(args, key);
        }
        return operation.apply(args);
    }

    @SuppressWarnings("unchecked")
    private R limited(CallArgs args, String key) {
        return (R) action.onLimit(args, key);
    }

    /**
     * 限流策略公共构建参数
     */
    protected abstract static class RateLimitBuilder<B extends RateLimitBuilder<B>> extends StrategyBuilder<B> {

        protected long limit;
        protected Duration period;
        protected RateLimitAction action = RateLimitAction.RAISE;

        protected RateLimitBuilder(Cache cache, String defaultPrefix) {
            super(cache, defaultPrefix);
        }

        public B limit(long limit) {
            this.limit = limit;
            return self();
        }

        public B period(Duration period) {
            this.period = period;
            return self();
        }

        public B period(String period) {
            this.period = Ttl.parse(period);
            return self();
        }

        public B action(RateLimitAction action) {
            this.action = action;
            return self();
        }

        /**
         * 校验参数；未设置封禁时长时默认等于周期
         */
        protected void prepare() {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            if (period == null || period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("period must be positive");
            }
            if (ttl == null) {
                ttl(period);
            }
        }
    }
}
