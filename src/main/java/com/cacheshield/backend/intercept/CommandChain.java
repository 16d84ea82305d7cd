package com.cacheshield.backend.intercept;

import com.cacheshield.backend.Command;

/**
 * 拦截器链中的下一环
 */
public interface CommandChain {

    /**
     * 继续执行命令（可以替换参数）
     */
    Object proceed(Command command, Object[] args);

    /**
     * 最终执行命令的后端名称
     */
    String backend();
}
