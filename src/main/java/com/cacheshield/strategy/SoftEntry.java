package com.cacheshield.strategy;

/**
 * Soft 策略的缓存条目：值 + 软过期时间点（毫秒时间戳）
 */
public record SoftEntry(Object value, long softExpireAt) {

    public boolean isFresh(long now) {
        return now < softExpireAt;
    }
}
