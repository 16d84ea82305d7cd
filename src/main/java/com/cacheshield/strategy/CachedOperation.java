package com.cacheshield.strategy;

import com.cacheshield.key.CallArgs;

/**
 * 被包装的目标操作
 * 所有策略本身也实现该接口，因此可以互相嵌套
 *
 * @param <R> 结果类型
 */
@FunctionalInterface
public interface CachedOperation<R> {

    R apply(CallArgs args);
}
