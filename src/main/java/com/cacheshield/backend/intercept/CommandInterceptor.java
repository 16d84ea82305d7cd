package com.cacheshield.backend.intercept;

import com.cacheshield.backend.Command;

/**
 * 后端命令拦截器
 *
 * <p>在构建时按顺序组合，列表中靠前的拦截器位于外层。
 * 参数数组的布局见 {@link InterceptingBackend}，拦截器可以不调用 {@code next} 直接返回结果。
 */
@FunctionalInterface
public interface CommandInterceptor {

    Object intercept(Command command, Object[] args, CommandChain next);
}
