package com.cacheshield.transaction;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.lock.LockHandle;
import com.cacheshield.lock.LockManager;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 事务协调器
 *
 * <p>事务绑定在当前线程上。{@link #execute} 正常返回时提交、抛出异常时回滚；
 * 已有事务时嵌套作用域加入外层事务。行级锁与全局锁直接写入原始后端，不经过拦截器。
 */
public class TransactionManager {

    private static final Logger log = LoggerFactory.getLogger(TransactionManager.class);

    private final ThreadLocal<Transaction> current = new ThreadLocal<>();
    private final Map<String, LockManager> lockManagers = new ConcurrentHashMap<>();
    private final CacheBackend globalLockBackend;
    private final TransactionMode defaultMode;
    private final Duration timeout;
    private final IntervalFunction backoff;
    private final Clock clock;

    /**
     * @param clock 计算前镜像剩余过期时间使用，应与后端的时钟一致
     */
    public TransactionManager(CacheBackend globalLockBackend, TransactionMode defaultMode,
                              Duration timeout, IntervalFunction backoff, Clock clock) {
        this.globalLockBackend = globalLockBackend;
        this.defaultMode = defaultMode;
        this.timeout = timeout;
        this.backoff = backoff;
        this.clock = clock;
    }

    /**
     * 当前线程上的活动事务，没有则为 null
     */
    public Transaction current() {
        return current.get();
    }

    Clock clock() {
        return clock;
    }

    public TransactionMode getDefaultMode() {
        return defaultMode;
    }

    public Transaction begin() {
        return begin(defaultMode);
    }

    /**
     * 开启事务并绑定到当前线程，调用方负责 commit 或 rollback
     */
    public Transaction begin(TransactionMode mode) {
        if (current.get() != null) {
            throw new IllegalStateException("Transaction already active on this thread");
        }
        LockHandle globalLock = null;
        if (mode == TransactionMode.SERIALIZABLE) {
            globalLock = lockManager(globalLockBackend).acquire(CacheConstants.TX_GLOBAL_LOCK_KEY, timeout, timeout);
        }
        Transaction transaction = new Transaction(mode, this, timeout, globalLock);
        current.set(transaction);
        log.debug("Transaction started: id={}, mode={}", transaction.getId(), mode);
        return transaction;
    }

    public <T> T execute(TransactionCallback<T> callback) {
        return execute(defaultMode, callback);
    }

    public <T> T execute(TransactionMode mode, TransactionCallback<T> callback) {
        Transaction outer = current.get();
        if (outer != null) {
            return callback.doInTransaction(outer);
        }
        Transaction transaction = begin(mode);
        T result;
        try {
            result = callback.doInTransaction(transaction);
        } catch (RuntimeException | Error e) {
            rollbackOnException(transaction, e);
            throw e;
        }
        if (transaction.isActive()) {
            transaction.commit();
        }
        return result;
    }

    LockManager lockManager(CacheBackend raw) {
        return lockManagers.computeIfAbsent(raw.name(), name -> new LockManager(raw, timeout, backoff));
    }

    void unbind(Transaction transaction) {
        if (current.get() == transaction) {
            current.remove();
        }
    }

    private void rollbackOnException(Transaction transaction, Throwable cause) {
        if (!transaction.isActive()) {
            return;
        }
        log.info("Rolling back transaction {} on exception: {}", transaction.getId(), cause.toString());
        try {
            transaction.rollback();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }
}
