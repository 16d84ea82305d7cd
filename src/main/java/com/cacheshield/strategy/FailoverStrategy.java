package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.exception.BackendUnavailableException;
import com.cacheshield.key.CallArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 故障转移缓存
 *
 * <p>总是先调用目标操作，成功时尽力写入缓存；抛出配置的异常（未配置时使用全局默认异常）时，
 * 读取缓存中上一次的成功结果返回，缓存为空则重新抛出。
 */
public class FailoverStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(FailoverStrategy.class);

    private final List<Class<? extends Throwable>> exceptions;

    FailoverStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                     List<Class<? extends Throwable>> exceptions) {
        super(cache, operation, settings, "failover");
        this.exceptions = exceptions;
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        long start = System.nanoTime();
        R result;
        try {
            result = operation.apply(args);
        } catch (RuntimeException e) {
            if (!matches(e)) {
                throw e;
            }
            Object cached = cache.get(key);
            if (cached == null) {
                throw e;
            }
            log.warn("Operation failed, serving cached result, key: {}, error: {}", key, e.toString());
            observe(key, null, e);
            return unwrap(cached);
        }
        if (shouldStore(result, null, args, key, System.nanoTime() - start)) {
            try {
                store(key, result, ttl(args, result), args, null);
            } catch (BackendUnavailableException e) {
                log.warn("Failover persist skipped, key: {}, error: {}", key, e.getMessage());
            }
        }
        return result;
    }

    private boolean matches(Throwable error) {
        return exceptions.stream().anyMatch(type -> type.isInstance(error));
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private List<Class<? extends Throwable>> exceptions;

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_FAILOVER);
        }

        @Override
        protected Builder self() {
            return this;
        }

        /**
         * 触发故障转移的异常类型，未设置时使用缓存实例的默认异常
         */
        @SafeVarargs
        public final Builder exceptions(Class<? extends Throwable>... exceptions) {
            this.exceptions = List.of(exceptions);
            return this;
        }

        public <R> FailoverStrategy<R> build(CachedOperation<R> operation) {
            List<Class<? extends Throwable>> types = exceptions != null ? exceptions : cache.defaultFailoverExceptions();
            return new FailoverStrategy<>(cache, operation, settings(), types);
        }
    }
}
