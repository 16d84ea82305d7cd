package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.key.CallArgs;
import com.cacheshield.ttl.Ttl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 软过期缓存
 *
 * <p>条目保存 值 + 软过期时间点，整体按 ttl（硬过期）过期。软过期后同步重新计算；
 * 重新计算抛出配置的异常时，只要条目仍在硬过期之前就返回旧值，否则向上传播。
 */
public class SoftStrategy<R> extends AbstractStrategy<R> {

    private static final Logger log = LoggerFactory.getLogger(SoftStrategy.class);

    private final Ttl softTtl;
    private final List<Class<? extends Throwable>> fallbackExceptions;

    SoftStrategy(Cache cache, CachedOperation<R> operation, StrategySettings settings,
                 Ttl softTtl, List<Class<? extends Throwable>> fallbackExceptions) {
        super(cache, operation, settings, "soft");
        this.softTtl = softTtl;
        this.fallbackExceptions = fallbackExceptions;
    }

    @Override
    public R apply(CallArgs args) {
        String key = key(args);
        Object cached = cache.get(key);
        if (!(cached instanceof SoftEntry entry)) {
            return callAndStore(args, key, entryWrapper(args));
        }
        if (entry.isFresh(cache.clock().millis())) {
            return hit(key, entry.value());
        }
        try {
            return callAndStore(args, key, entryWrapper(args));
        } catch (RuntimeException e) {
            if (fallbackExceptions.stream().noneMatch(type -> type.isInstance(e))) {
                throw e;
            }
            log.warn("Soft recompute failed, serving previous value, key: {}, error: {}", key, e.toString());
            observe(key, null, e);
            return unwrap(entry.value());
        }
    }

    private UnaryOperator<Object> entryWrapper(CallArgs args) {
        return value -> new SoftEntry(value, cache.clock().millis() + softTtl.resolve(args, value).toMillis());
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private Ttl softTtl;
        private List<Class<? extends Throwable>> exceptions = List.of(RuntimeException.class);

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_SOFT);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder softTtl(Duration softTtl) {
            this.softTtl = Ttl.of(softTtl);
            return this;
        }

        public Builder softTtl(String softTtl) {
            this.softTtl = Ttl.of(softTtl);
            return this;
        }

        public Builder softTtl(Ttl softTtl) {
            this.softTtl = softTtl;
            return this;
        }

        /**
         * 软过期重算失败时回退到旧值的异常类型，默认所有运行时异常
         */
        @SafeVarargs
        public final Builder exceptions(Class<? extends Throwable>... exceptions) {
            this.exceptions = List.of(exceptions);
            return this;
        }

        public <R> SoftStrategy<R> build(CachedOperation<R> operation) {
            if (ttl == null) {
                throw new IllegalStateException("Soft strategy requires a ttl");
            }
            Ttl soft = softTtl != null ? softTtl : ttl.scaled(CacheConstants.DEFAULT_EARLY_RATIO);
            return new SoftStrategy<>(cache, operation, settings(), soft, exceptions);
        }
    }
}
