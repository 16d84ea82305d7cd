package com.cacheshield.strategy;

import com.cacheshield.exception.RateLimitException;
import com.cacheshield.key.CallArgs;

/**
 * 超过限流阈值时执行的动作，返回值作为本次调用的结果
 */
@FunctionalInterface
public interface RateLimitAction {

    RateLimitAction RAISE = (args, key) -> {
        throw new RateLimitException(key);
    };

    Object onLimit(CallArgs args, String key);
}
