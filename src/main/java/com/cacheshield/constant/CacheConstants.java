package com.cacheshield.constant;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== 过期时间哨兵值 ====================

    /** Key 不存在 */
    public static final long NOT_EXIST = -2;

    /** Key 存在但没有过期时间 */
    public static final long UNLIMITED = -1;

    // ==================== Key 前缀 / 后缀 ====================

    /** Tag 成员集合前缀 */
    public static final String TAG_PREFIX = "_tag:";

    /** Early 策略后台刷新锁后缀 */
    public static final String EARLY_LOCK_SUFFIX = ":lock";

    /** Hit 策略计数器后缀 */
    public static final String HIT_COUNTER_SUFFIX = ":counter";

    /** 限流封禁标记后缀 */
    public static final String RATE_BAN_SUFFIX = ":ban";

    /** 熔断器 Key 后缀 */
    public static final String CIRCUIT_OPEN_SUFFIX = ":open";
    public static final String CIRCUIT_HALF_OPEN_SUFFIX = ":half_open";
    public static final String CIRCUIT_PROBE_SUFFIX = ":probe";
    public static final String CIRCUIT_TOTAL_SUFFIX = ":total";
    public static final String CIRCUIT_FAILS_SUFFIX = ":fails";

    /** 事务行级锁前缀 */
    public static final String TX_LOCK_PREFIX = ":tx_lock:";

    /** SERIALIZABLE 事务全局锁 */
    public static final String TX_GLOBAL_LOCK_KEY = ":serializable:lock";

    // ==================== 默认前缀 ====================

    public static final String PREFIX_EARLY = "early:v2";
    public static final String PREFIX_HIT = "hit";
    public static final String PREFIX_SOFT = "soft";
    public static final String PREFIX_FAILOVER = "fail";
    public static final String PREFIX_LOCK = "lock";
    public static final String PREFIX_RATE_LIMIT = "rate_limit";
    public static final String PREFIX_SLICE_RATE_LIMIT = "srate";
    public static final String PREFIX_CIRCUIT_BREAKER = "circuit_breaker";
    public static final String PREFIX_BLOOM = "bloom";

    // ==================== 分布式锁配置 ====================

    /** 锁默认持有时间（毫秒） */
    public static final long LOCK_LEASE_TIME_MS = 10_000;

    /** 锁默认等待时间（毫秒） */
    public static final long LOCK_WAIT_TIME_MS = 3_000;

    /** 锁轮询初始间隔（毫秒） */
    public static final long LOCK_POLL_INITIAL_MS = 10;

    /** 锁轮询最大间隔（毫秒） */
    public static final long LOCK_POLL_MAX_MS = 200;

    /** 锁轮询退避倍数 */
    public static final double LOCK_POLL_MULTIPLIER = 1.5;

    // ==================== 策略默认值 ====================

    /** 未指定 early_ttl / soft_ttl 时取 ttl 的比例 */
    public static final double DEFAULT_EARLY_RATIO = 0.33;

    /** 滑动窗口默认分片数 */
    public static final int DEFAULT_SLICES = 10;

    /** Tag 删除时每批弹出数量 */
    public static final int TAG_POP_BATCH = 100;

    /** SCAN 每批数量 */
    public static final int SCAN_BATCH = 100;

    // ==================== 事务 ====================

    /** 事务锁默认超时（秒） */
    public static final long TX_TIMEOUT_SECONDS = 10;

    // ==================== 缓存实例 ====================

    /** 内存后端默认容量 */
    public static final long DEFAULT_MEMORY_MAX_SIZE = 10_000;

    /** 后台刷新线程数 */
    public static final int DEFAULT_REFRESH_THREADS = 4;
}
