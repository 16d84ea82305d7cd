package com.cacheshield.exception;

/**
 * 熔断器处于打开状态，调用被短路
 */
public class CircuitBreakerOpenException extends CacheException {

    private final String key;

    public CircuitBreakerOpenException(String key) {
        super("Circuit breaker is open for key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
