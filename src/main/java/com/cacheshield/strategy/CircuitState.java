package com.cacheshield.strategy;

/**
 * 熔断器状态
 */
public enum CircuitState {

    /** 正常放行，统计失败率 */
    CLOSED,

    /** 熔断中，所有调用直接失败 */
    OPEN,

    /** 半开，只放行一次探测调用 */
    HALF_OPEN
}
