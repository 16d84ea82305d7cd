package com.cacheshield.counter;

import com.cacheshield.backend.CacheBackend;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 滑动窗口计数器
 *
 * <p>把周期切分为若干子窗口，每个子窗口一个计数 Key（{@code <key>:<子窗口序号>}），
 * 计数为最近 slices 个子窗口之和。子窗口 Key 的过期时间为一个周期加一个子窗口，
 * 过期数据不会参与求和。
 */
public class SlidingWindowCounter {

    private final CacheBackend backend;
    private final Clock clock;

    public SlidingWindowCounter(CacheBackend backend, Clock clock) {
        this.backend = backend;
        this.clock = clock;
    }

    /**
     * 当前子窗口加一，返回整个周期内的计数
     */
    public long increment(String key, Duration period, int slices) {
        long sliceMillis = sliceMillis(period, slices);
        long current = clock.millis() / sliceMillis;
        backend.incr(key + ":" + current, 1, Duration.ofMillis(period.toMillis() + sliceMillis));
        return sum(key, current, slices);
    }

    public long count(String key, Duration period, int slices) {
        return sum(key, clock.millis() / sliceMillis(period, slices), slices);
    }

    /**
     * 清空周期内所有子窗口
     */
    public void reset(String key, Duration period, int slices) {
        backend.deleteMany(sliceKeys(key, clock.millis() / sliceMillis(period, slices), slices));
    }

    private long sum(String key, long current, int slices) {
        long total = 0;
        for (Object value : backend.getMany(sliceKeys(key, current, slices))) {
            if (value instanceof Number number) {
                total += number.longValue();
            }
        }
        return total;
    }

    private static List<String> sliceKeys(String key, long current, int slices) {
        List<String> keys = new ArrayList<>(slices);
        for (long slice = current - slices + 1; slice <= current; slice++) {
            keys.add(key + ":" + slice);
        }
        return keys;
    }

    private static long sliceMillis(Duration period, int slices) {
        return Math.max(1, period.toMillis() / slices);
    }
}
