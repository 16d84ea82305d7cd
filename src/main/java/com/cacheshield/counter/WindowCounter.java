package com.cacheshield.counter;

import com.cacheshield.backend.CacheBackend;

import java.time.Clock;
import java.time.Duration;

/**
 * 固定窗口计数器
 * 窗口 Key 为 {@code <key>:<窗口序号>}，首次自增设置过期时间为一个周期，窗口翻转时自然归零
 */
public class WindowCounter {

    private final CacheBackend backend;
    private final Clock clock;

    public WindowCounter(CacheBackend backend, Clock clock) {
        this.backend = backend;
        this.clock = clock;
    }

    /**
     * 当前窗口计数加一
     *
     * @return 自增后的计数
     */
    public long increment(String key, Duration period) {
        return backend.incr(windowKey(key, period), 1, period);
    }

    public long current(String key, Duration period) {
        Object value = backend.get(windowKey(key, period));
        return value instanceof Number number ? number.longValue() : 0;
    }

    public String windowKey(String key, Duration period) {
        return key + ":" + clock.millis() / period.toMillis();
    }
}
