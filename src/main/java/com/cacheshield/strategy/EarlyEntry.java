package com.cacheshield.strategy;

/**
 * Early 策略的缓存条目：值 + 提前过期时间点（毫秒时间戳）
 */
public record EarlyEntry(Object value, long earlyExpireAt) {

    public boolean isFresh(long now) {
        return now < earlyExpireAt;
    }
}
