package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.key.CallArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * 简单缓存：命中直接返回，未命中调用目标操作并按条件写入
 */
public class SimpleStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(SimpleStrategy.class);

    SimpleStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings) {
        super(cache, operation, settings, "simple");
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        Object cached = cache.get(key);
        if (cached != null) {
            return hit(key, cached);
        }
        log.debug("Cache miss, key: {}", key);
        return callAndStore(args, key, UnaryOperator.identity());
    }

    public static class Builder extends StrategyBuilder<Builder> {

        public Builder(Cache cache) {
            super(cache, "");
        }

        @Override
        protected Builder self() {
            return this;
        }

        public <R> SimpleStrategy<R> build(CachedOperation<R> operation) {
            return new SimpleStrategy<>(cache, operation, settings());
        }
    }
}
