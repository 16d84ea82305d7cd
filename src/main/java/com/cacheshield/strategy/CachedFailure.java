package com.cacheshield.strategy;

/**
 * 被缓存的异常结果，命中时重新抛出
 */
public record CachedFailure(RuntimeException error) {

    public Object rethrow() {
        throw error;
    }

    /**
     * 命中缓存时统一出口：普通值直接返回，缓存的异常重新抛出
     */
    public static Object unwrap(Object cached) {
        if (cached instanceof CachedFailure failure) {
            return failure.rethrow();
        }
        return cached;
    }
}
