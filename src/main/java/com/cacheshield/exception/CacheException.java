package com.cacheshield.exception;

/**
 * 缓存组件异常基类
 * 所有对调用方暴露的失败信号均为可恢复的运行时异常
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
