package com.cacheshield.exception;

/**
 * 调用频率超过限流阈值
 */
public class RateLimitException extends CacheException {

    private final String key;

    public RateLimitException(String key) {
        super("Rate limit reached for key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
