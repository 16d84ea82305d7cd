package com.cacheshield.exception;

/**
 * 释放锁时发现锁已过期或被其他持有者占用
 */
public class LockLostException extends CacheException {

    private final String key;

    public LockLostException(String key) {
        super("Lock lost for key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
