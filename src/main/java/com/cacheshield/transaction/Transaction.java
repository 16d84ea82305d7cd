package com.cacheshield.transaction;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.exception.CacheException;
import com.cacheshield.lock.LockHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.UUID;

/**
 * 缓存事务
 *
 * <p>修改立即作用到后端，事务日志按首次触碰顺序保存每个 Key 的前镜像；
 * 回滚时逆序恢复前镜像（原值与剩余过期时间，或删除原本不存在的 Key），然后释放锁。
 */
public class Transaction {

    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    enum Status {
        ACTIVE, COMMITTED, ROLLED_BACK
    }

    private final String id = UUID.randomUUID().toString();
    private final TransactionMode mode;
    private final TransactionManager manager;
    private final Duration timeout;
    private final Map<String, PreImage> preImages = new LinkedHashMap<>();
    private final List<LockHandle> locks = new ArrayList<>();
    private final LockHandle globalLock;
    private Status status = Status.ACTIVE;
    private boolean rollbackOnly;

    Transaction(TransactionMode mode, TransactionManager manager, Duration timeout, LockHandle globalLock) {
        this.mode = mode;
        this.manager = manager;
        this.timeout = timeout;
        this.globalLock = globalLock;
    }

    public String getId() {
        return id;
    }

    public TransactionMode getMode() {
        return mode;
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public boolean isRollbackOnly() {
        return rollbackOnly;
    }

    /**
     * 标记为只能回滚，作用域结束时回滚而不是提交
     */
    public void setRollbackOnly() {
        this.rollbackOnly = true;
    }

    /**
     * 本事务修改过的 Key（按首次触碰顺序）
     */
    public synchronized List<String> touchedKeys() {
        return preImages.values().stream().map(PreImage::key).toList();
    }

    /**
     * 修改前调用：首次触碰时加锁（LOCKED 模式）并记录前镜像
     */
    synchronized void beforeWrite(CacheBackend raw, String key) {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction " + id + " is not active");
        }
        String logKey = raw.name() + '\u0000' + key;
        if (preImages.containsKey(logKey)) {
            return;
        }
        if (mode == TransactionMode.LOCKED) {
            locks.add(manager.lockManager(raw).acquire(CacheConstants.TX_LOCK_PREFIX + key, timeout, timeout));
        }
        preImages.put(logKey, PreImage.capture(raw, key, manager.clock().millis()));
    }

    /**
     * 修改后调用：记录本事务写入的值（删除为 null），FAST 模式回滚时据此判断 Key 是否被其他写入方改过
     */
    synchronized void afterWrite(CacheBackend raw, String key, Object value) {
        PreImage image = preImages.get(raw.name() + '\u0000' + key);
        if (image != null) {
            image.written(value);
        }
    }

    public synchronized void commit() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction " + id + " is not active");
        }
        if (rollbackOnly) {
            rollback();
            return;
        }
        status = Status.COMMITTED;
        log.debug("Transaction committed: id={}, keys={}", id, preImages.size());
        finish();
    }

    /**
     * 逆序恢复所有前镜像；单个 Key 恢复失败不影响其余 Key，最后抛出第一个失败。
     * FAST 模式不加锁，只恢复仍保持本事务写入值的 Key。
     */
    public synchronized void rollback() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction " + id + " is not active");
        }
        status = Status.ROLLED_BACK;
        RuntimeException failure = null;
        List<PreImage> images = new ArrayList<>(preImages.values());
        long now = manager.clock().millis();
        boolean onlyIfUnchanged = mode == TransactionMode.FAST;
        for (ListIterator<PreImage> it = images.listIterator(images.size()); it.hasPrevious(); ) {
            PreImage image = it.previous();
            try {
                image.restore(now, onlyIfUnchanged);
            } catch (RuntimeException e) {
                log.error("Transaction rollback failed for key: {}, id: {}", image.key(), id, e);
                if (failure == null) {
                    failure = e;
                }
            }
        }
        log.info("Transaction rolled back: id={}, mode={}, keys={}", id, mode, images.size());
        finish();
        if (failure != null) {
            throw new CacheException("Transaction " + id + " rollback incomplete", failure);
        }
    }

    private void finish() {
        for (LockHandle lock : locks) {
            lock.close();
        }
        locks.clear();
        if (globalLock != null) {
            globalLock.close();
        }
        manager.unbind(this);
    }
}
