package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.backend.ExistCondition;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.counter.SlidingWindowCounter;
import com.cacheshield.exception.CircuitBreakerOpenException;
import com.cacheshield.key.CallArgs;
import com.cacheshield.ttl.Ttl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * 熔断器
 *
 * <p>状态完全由后端中的标记推导：
 * <ul>
 *   <li>{@code <key>:open} 存在（ttl）：OPEN</li>
 *   <li>{@code <key>:open} 已过期而 {@code <key>:half_open} 仍存在（ttl + halfOpenTtl）：HALF_OPEN</li>
 *   <li>其余：CLOSED，按周期内滑动窗口统计 total / fails</li>
 * </ul>
 * CLOSED 下 total 达到 minCalls 且失败率（百分比）不低于 errorsRate 时进入 OPEN 并清空统计。
 * HALF_OPEN 下通过 {@code <key>:probe} 条件写入只放行一次探测调用，成功回到 CLOSED，失败重新 OPEN。
 */
public class CircuitBreakerStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerStrategy.class);

    private final double errorsRate;
    private final Duration period;
    private final Duration halfOpenTtl;
    private final long minCalls;
    private final List<Class<? extends Throwable>> exceptions;
    private final SlidingWindowCounter counter;

    CircuitBreakerStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                           double errorsRate, Duration period, Duration halfOpenTtl, long minCalls,
                           List<Class<? extends Throwable>> exceptions) {
        super(cache, operation, settings, "circuit_breaker");
        this.errorsRate = errorsRate;
        this.period = period;
        this.halfOpenTtl = halfOpenTtl;
        this.minCalls = minCalls;
        this.exceptions = exceptions;
        this.counter = new SlidingWindowCounter(cache, cache.clock());
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        return switch (state(key)) {
            case OPEN -> throw new CircuitBreakerOpenException(key);
            case HALF_OPEN -> probe(args, key);
            case CLOSED -> callClosed(args, key);
        };
    }

    public CircuitState state(CallArgs args) {
        return state(key(args));
    }

    private CircuitState state(String key) {
        if (cache.exists(key + CacheConstants.CIRCUIT_OPEN_SUFFIX)) {
            return CircuitState.OPEN;
        }
        if (cache.exists(key + CacheConstants.CIRCUIT_HALF_OPEN_SUFFIX)) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.CLOSED;
    }

    private R callClosed(CallArgs args, String key) {
        long total = counter.increment(key + CacheConstants.CIRCUIT_TOTAL_SUFFIX, period, CacheConstants.DEFAULT_SLICES);
        try {
            return operation.apply(args);
        } catch (RuntimeException e) {
            if (counts(e)) {
                long fails = counter.increment(key + CacheConstants.CIRCUIT_FAILS_SUFFIX, period,
                    CacheConstants.DEFAULT_SLICES);
                if (total >= minCalls && fails * 100.0 / total >= errorsRate) {
                    log.warn("Circuit breaker opened, key: {}, fails: {}, total: {}", key, fails, total);
                    open(args, key);
                }
            }
            throw e;
        }
    }

    private R probe(CallArgs args, String key) {
        String probeKey = key + CacheConstants.CIRCUIT_PROBE_SUFFIX;
        if (!cache.set(probeKey, Boolean.TRUE, halfOpenTtl, ExistCondition.MUST_NOT_EXIST)) {
            throw new CircuitBreakerOpenException(key);
        }
        R result;
        try {
            result = operation.apply(args);
        } catch (RuntimeException e) {
            if (counts(e)) {
                log.warn("Circuit breaker probe failed, reopening key: {}", key);
                open(args, key);
            } else {
                cache.delete(probeKey);
            }
            throw e;
        }
        log.info("Circuit breaker probe succeeded, closing key: {}", key);
        cache.deleteMany(List.of(key + CacheConstants.CIRCUIT_OPEN_SUFFIX,
            key + CacheConstants.CIRCUIT_HALF_OPEN_SUFFIX, probeKey));
        return result;
    }

    private void open(CallArgs args, String key) {
        Duration openTtl = ttl(args, null);
        cache.set(key + CacheConstants.CIRCUIT_OPEN_SUFFIX, Boolean.TRUE, openTtl);
        cache.set(key + CacheConstants.CIRCUIT_HALF_OPEN_SUFFIX, Boolean.TRUE, openTtl.plus(halfOpenTtl));
        cache.delete(key + CacheConstants.CIRCUIT_PROBE_SUFFIX);
        counter.reset(key + CacheConstants.CIRCUIT_TOTAL_SUFFIX, period, CacheConstants.DEFAULT_SLICES);
        counter.reset(key + CacheConstants.CIRCUIT_FAILS_SUFFIX, period, CacheConstants.DEFAULT_SLICES);
    }

    private boolean counts(Throwable error) {
        return exceptions.stream().anyMatch(type -> type.isInstance(error));
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private double errorsRate;
        private Duration period;
        private Duration halfOpenTtl;
        private long minCalls = 1;
        private List<Class<? extends Throwable>> exceptions = List.of(RuntimeException.class);

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_CIRCUIT_BREAKER);
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * 失败率阈值（百分比，0 到 100 之间，不含边界）
         */
        public Builder errorsRate(double errorsRate) {
            this.errorsRate = errorsRate;
            return this;
        }

        public Builder period(Duration period) {
            this.period = period;
            return this;
        }

        public Builder period(String period) {
            this.period = Ttl.parse(period);
            return this;
        }

        public Builder halfOpenTtl(Duration halfOpenTtl) {
            this.halfOpenTtl = halfOpenTtl;
            return this;
        }

        public Builder minCalls(long minCalls) {
            this.minCalls = minCalls;
            return this;
        }

        /**
         * 计入失败的异常类型，默认所有运行时异常
         */
        @SafeVarargs
        public final Builder exceptions(Class<? extends Throwable>... exceptions) {
            this.exceptions = List.of(exceptions);
            return this;
        }

        public <R> CircuitBreakerStrategy<R> build(CachedOperation<R> operation) {
            if (errorsRate <= 0 || errorsRate >= 100) {
                throw new IllegalArgumentException("errorsRate must be between 0 and 100 (exclusive)");
            }
            if (period == null || period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("period must be positive");
            }
            if (ttl == null || ttl.isDynamic()) {
                throw new IllegalStateException("Circuit breaker requires a fixed ttl");
            }
            Duration openTtl = ttl.resolve(CallArgs.empty());
            if (openTtl == null) {
                throw new IllegalStateException("Circuit breaker requires a fixed ttl");
            }
            Duration halfOpen = halfOpenTtl != null ? halfOpenTtl : openTtl;
            return new CircuitBreakerStrategy<>(cache, operation, settings(), errorsRate, period, halfOpen,
                minCalls, exceptions);
        }
    }
}
