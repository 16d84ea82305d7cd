package com.cacheshield.config;

import com.cacheshield.constant.CacheConstants;
import com.cacheshield.transaction.TransactionMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 缓存配置属性类
 */
@Data
@ConfigurationProperties(prefix = "cache-shield")
public class CacheShieldProperties {

    /** 总开关 */
    private boolean enabled = true;

    /** 实例名称 */
    private String name = "cache-shield";

    /** 安全模式：普通读写的后端故障返回缺省结果 */
    private boolean safeMode = false;

    /** 后台刷新线程数 */
    private int refreshThreads = CacheConstants.DEFAULT_REFRESH_THREADS;

    /** 故障转移默认异常（全限定类名），为空时使用 BackendUnavailableException */
    private List<String> failoverExceptions = new ArrayList<>();

    /** 内存后端配置 */
    private MemoryConfig memory = new MemoryConfig();

    /** Redis 后端配置 */
    private RedisConfig redis = new RedisConfig();

    /** 锁配置 */
    private LockConfig lock = new LockConfig();

    /** 事务配置 */
    private TransactionConfig transaction = new TransactionConfig();

    @Data
    public static class MemoryConfig {
        /** 最大容量 */
        private long maxSize = CacheConstants.DEFAULT_MEMORY_MAX_SIZE;
        /** 路由前缀，为空时仅在没有其他默认后端时作为默认后端 */
        private String prefix;
    }

    @Data
    public static class RedisConfig {
        /** 存在 StringRedisTemplate 时是否注册 Redis 后端 */
        private boolean enabled = true;
        /** 路由前缀，默认作为默认后端 */
        private String prefix = "";
    }

    @Data
    public static class LockConfig {
        /** 默认等待时间 */
        private Duration waitTime = Duration.ofMillis(CacheConstants.LOCK_WAIT_TIME_MS);
        /** 轮询初始间隔 */
        private Duration backoffInitial = Duration.ofMillis(CacheConstants.LOCK_POLL_INITIAL_MS);
        /** 轮询最大间隔 */
        private Duration backoffMax = Duration.ofMillis(CacheConstants.LOCK_POLL_MAX_MS);
        /** 退避倍数 */
        private double backoffMultiplier = CacheConstants.LOCK_POLL_MULTIPLIER;
    }

    @Data
    public static class TransactionConfig {
        /** 默认事务模式 */
        private TransactionMode mode = TransactionMode.LOCKED;
        /** 事务锁超时 */
        private Duration timeout = Duration.ofSeconds(CacheConstants.TX_TIMEOUT_SECONDS);
    }
}
