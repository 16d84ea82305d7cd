package com.cacheshield.transaction;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.backend.ExistCondition;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 事务感知的后端视图
 *
 * <p>当前线程存在活动事务时，修改命令先在原始后端上记录前镜像（LOCKED 模式下先加行级锁），
 * 再经由 delegate 执行。没有事务时直接委托。位图与集合命令不进入事务日志。
 */
public class TransactionalBackend implements CacheBackend {

    private final CacheBackend delegate;
    private final CacheBackend raw;
    private final TransactionManager manager;

    /**
     * @param delegate 实际执行命令的后端（通常带拦截器链）
     * @param raw      记录前镜像、回滚写入使用的原始后端
     */
    public TransactionalBackend(CacheBackend delegate, CacheBackend raw, TransactionManager manager) {
        this.delegate = delegate;
        this.raw = raw;
        this.manager = manager;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Object get(String key) {
        return delegate.get(key);
    }

    @Override
    public List<Object> getMany(List<String> keys) {
        return delegate.getMany(keys);
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, ExistCondition exist) {
        touch(key);
        boolean written = delegate.set(key, value, ttl, exist);
        if (written) {
            written(key, value);
        }
        return written;
    }

    @Override
    public void setMany(Map<String, Object> pairs, Duration ttl) {
        pairs.keySet().forEach(this::touch);
        delegate.setMany(pairs, ttl);
        pairs.forEach(this::written);
    }

    @Override
    public long incr(String key, long delta, Duration ttl) {
        touch(key);
        long value = delegate.incr(key, delta, ttl);
        written(key, value);
        return value;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        touch(key);
        return delegate.expire(key, ttl);
    }

    @Override
    public long getExpire(String key) {
        return delegate.getExpire(key);
    }

    @Override
    public boolean delete(String key) {
        touch(key);
        boolean deleted = delegate.delete(key);
        written(key, null);
        return deleted;
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        keys.forEach(this::touch);
        long deleted = delegate.deleteMany(keys);
        keys.forEach(key -> written(key, null));
        return deleted;
    }

    @Override
    public long deleteMatch(String pattern) {
        Transaction transaction = manager.current();
        if (transaction == null) {
            return delegate.deleteMatch(pattern);
        }
        List<String> keys;
        try (Stream<String> matched = raw.scan(pattern)) {
            keys = matched.toList();
        }
        keys.forEach(key -> transaction.beforeWrite(raw, key));
        long deleted = delegate.deleteMatch(pattern);
        keys.forEach(key -> transaction.afterWrite(raw, key, null));
        return deleted;
    }

    @Override
    public boolean deleteIfValue(String key, Object expected) {
        touch(key);
        boolean deleted = delegate.deleteIfValue(key, expected);
        if (deleted) {
            written(key, null);
        }
        return deleted;
    }

    @Override
    public boolean replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        touch(key);
        boolean replaced = delegate.replaceIfValue(key, expected, value, ttl);
        if (replaced) {
            written(key, value);
        }
        return replaced;
    }

    @Override
    public Stream<String> scan(String pattern) {
        return delegate.scan(pattern);
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public long getKeysCount() {
        return delegate.getKeysCount();
    }

    @Override
    public String ping(String message) {
        return delegate.ping(message);
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    @Override
    public boolean[] getBits(String key, long... offsets) {
        return delegate.getBits(key, offsets);
    }

    @Override
    public void setBits(String key, long... offsets) {
        delegate.setBits(key, offsets);
    }

    @Override
    public void setAdd(String key, Duration ttl, Collection<String> members) {
        delegate.setAdd(key, ttl, members);
    }

    @Override
    public void setRemove(String key, Collection<String> members) {
        delegate.setRemove(key, members);
    }

    @Override
    public Set<String> setPop(String key, int count) {
        return delegate.setPop(key, count);
    }

    @Override
    public void close() {
        delegate.close();
    }

    private void touch(String key) {
        Transaction transaction = manager.current();
        if (transaction != null) {
            transaction.beforeWrite(raw, key);
        }
    }

    private void written(String key, Object value) {
        Transaction transaction = manager.current();
        if (transaction != null) {
            transaction.afterWrite(raw, key, value);
        }
    }
}
