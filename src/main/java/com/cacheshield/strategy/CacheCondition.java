package com.cacheshield.strategy;

import com.cacheshield.key.CallArgs;

import java.util.List;

/**
 * 写入条件：决定一次调用的结果（或异常）是否写入缓存
 */
@FunctionalInterface
public interface CacheCondition {

    /**
     * @param result 调用结果，调用抛出异常时为 null
     * @param error  调用抛出的异常，成功时为 null
     */
    boolean test(Object result, Throwable error, CallArgs args, String key);

    /**
     * 默认条件：只缓存非 null 的正常结果
     */
    static CacheCondition notNull() {
        return (result, error, args, key) -> error == null && result != null;
    }

    /**
     * 除正常结果外，同时缓存给定类型的异常，命中时重新抛出
     */
    @SafeVarargs
    static CacheCondition withExceptions(Class<? extends RuntimeException>... types) {
        List<Class<? extends RuntimeException>> cached = List.of(types);
        return (result, error, args, key) -> {
            if (error == null) {
                return result != null;
            }
            return cached.stream().anyMatch(type -> type.isInstance(error));
        };
    }

    default CacheCondition and(CacheCondition other) {
        return (result, error, args, key) -> test(result, error, args, key) && other.test(result, error, args, key);
    }
}
