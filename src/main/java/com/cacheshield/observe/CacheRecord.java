package com.cacheshield.observe;

import java.time.Duration;

/**
 * 一次由缓存提供或写入缓存的调用
 *
 * @param key      缓存 Key
 * @param strategy 策略名称
 * @param backend  后端名称
 * @param ttl      写入时的过期时间，读取命中时为 null
 * @param error    被缓存或被降级掉的异常，没有则为 null
 */
public record CacheRecord(String key, String strategy, String backend, Duration ttl, Throwable error) {
}
