package com.cacheshield.strategy;

import com.cacheshield.key.KeyResolver;
import com.cacheshield.key.KeyTemplate;
import com.cacheshield.ttl.Ttl;

import java.time.Duration;
import java.util.List;

/**
 * 策略的公共配置（构建后不可变）
 *
 * @param name          策略实例名称，用于默认 Key 与日志
 * @param key           Key 推导函数（已包含前缀）
 * @param ttl           过期时间，null 表示不过期
 * @param condition     写入条件
 * @param timeCondition 最小耗时，调用耗时低于该值时不写入；null 表示不限制
 * @param tags          Tag 模板
 */
public record StrategySettings(String name,
                               KeyResolver key,
                               Ttl ttl,
                               CacheCondition condition,
                               Duration timeCondition,
                               List<KeyTemplate> tags) {
}
