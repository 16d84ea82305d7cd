package com.cacheshield.exception;

/**
 * 在等待时间内未能获取锁
 */
public class LockTimeoutException extends CacheException {

    private final String key;

    public LockTimeoutException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
