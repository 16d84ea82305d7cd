package com.cacheshield.lock;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.backend.ExistCondition;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.exception.CacheException;
import com.cacheshield.exception.LockTimeoutException;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于后端条件写入的 Key 级互斥锁
 *
 * <p>加锁：{@code set(key, token, ttl, MUST_NOT_EXIST)}，冲突时按有界指数退避轮询，超过等待时间抛出
 * {@link LockTimeoutException}。解锁：仅当存储的值等于 token 时删除，锁过期或被抢占视为锁丢失。
 */
public class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final CacheBackend backend;
    private final Duration defaultWait;
    private final IntervalFunction backoff;

    public LockManager(CacheBackend backend) {
        this(backend, Duration.ofMillis(CacheConstants.LOCK_WAIT_TIME_MS),
            IntervalFunction.ofExponentialBackoff(
                CacheConstants.LOCK_POLL_INITIAL_MS,
                CacheConstants.LOCK_POLL_MULTIPLIER,
                CacheConstants.LOCK_POLL_MAX_MS));
    }

    public LockManager(CacheBackend backend, Duration defaultWait, IntervalFunction backoff) {
        this.backend = backend;
        this.defaultWait = defaultWait;
        this.backoff = backoff;
    }

    public LockHandle acquire(String key, Duration ttl) {
        return acquire(key, ttl, defaultWait);
    }

    /**
     * 获取锁，最多等待 wait
     *
     * @throws LockTimeoutException 等待超时或等待期间线程被中断
     */
    public LockHandle acquire(String key, Duration ttl, Duration wait) {
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + wait.toNanos();
        int attempt = 1;
        while (true) {
            if (backend.set(key, token, ttl, ExistCondition.MUST_NOT_EXIST)) {
                log.debug("Lock acquired: key={}, attempt={}", key, attempt);
                return new LockHandle(this, key, token);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Failed to acquire lock for key: {}, wait: {}ms", key, wait.toMillis());
                throw new LockTimeoutException(key, "Lock wait timeout for key: " + key);
            }
            sleep(key, Math.min(backoff.apply(attempt++), Duration.ofNanos(remaining).toMillis() + 1));
        }
    }

    /**
     * 不等待，锁被占用时返回空
     */
    public Optional<LockHandle> tryAcquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        if (backend.set(key, token, ttl, ExistCondition.MUST_NOT_EXIST)) {
            log.debug("Lock acquired: key={}", key);
            return Optional.of(new LockHandle(this, key, token));
        }
        return Optional.empty();
    }

    /**
     * 比较删除释放锁
     *
     * @return false 表示锁已过期或被他人持有（锁丢失）
     */
    public boolean release(String key, String token) {
        if (backend.deleteIfValue(key, token)) {
            log.debug("Lock released: key={}", key);
            return true;
        }
        log.warn("Lock lost before release, key: {}", key);
        return false;
    }

    /**
     * 等待锁释放，最多等待 wait；返回时仍被锁定则为 true。不抛出异常
     */
    public boolean isLocked(String key, Duration wait) {
        long deadline = System.nanoTime() + (wait == null ? 0 : wait.toNanos());
        int attempt = 1;
        try {
            while (backend.exists(key)) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return true;
                }
                Thread.sleep(Math.min(backoff.apply(attempt++), Duration.ofNanos(remaining).toMillis() + 1));
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (CacheException e) {
            log.warn("Lock check failed for key: {}, treating as unlocked: {}", key, e.getMessage());
            return false;
        }
    }

    private static void sleep(String key, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, "Interrupted while waiting for lock: " + key);
        }
    }
}
