package com.cacheshield.transaction;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.backend.ExistCondition;
import com.cacheshield.constant.CacheConstants;

import java.time.Duration;

/**
 * Key 在事务首次修改前的状态，以及本事务最后写入的值
 *
 * <p>过期时间保存为绝对时间点，回滚时按当时的剩余时间恢复，已经过了原过期时间的 Key 直接删除。
 */
final class PreImage {

    private static final long NO_EXPIRE = -1;

    private final CacheBackend backend;
    private final String key;
    private final Object value;
    private final long expireAt;
    private Object written;

    private PreImage(CacheBackend backend, String key, Object value, long expireAt) {
        this.backend = backend;
        this.key = key;
        this.value = value;
        this.expireAt = expireAt;
        // 只修改过期时间的命令不改变值
        this.written = value;
    }

    static PreImage capture(CacheBackend backend, String key, long now) {
        Object value = backend.get(key);
        if (value == null) {
            return new PreImage(backend, key, null, NO_EXPIRE);
        }
        long expire = backend.getExpire(key);
        if (expire == CacheConstants.NOT_EXIST) {
            // 读取原值与过期时间之间 Key 过期
            return new PreImage(backend, key, null, NO_EXPIRE);
        }
        long expireAt = expire == CacheConstants.UNLIMITED ? NO_EXPIRE : now + expire;
        return new PreImage(backend, key, value, expireAt);
    }

    String key() {
        return key;
    }

    /**
     * 记录本事务写入后的值，删除时为 null
     */
    void written(Object value) {
        this.written = value;
    }

    /**
     * 恢复前镜像
     *
     * @param onlyIfUnchanged 为 true 时只在 Key 仍是本事务写入的值时恢复，不覆盖其他写入方的修改
     */
    void restore(long now, boolean onlyIfUnchanged) {
        boolean expired = expireAt != NO_EXPIRE && expireAt <= now;
        Object target = expired ? null : value;
        Duration ttl = expireAt == NO_EXPIRE ? null : Duration.ofMillis(expireAt - now);
        if (!onlyIfUnchanged) {
            if (target == null) {
                backend.delete(key);
            } else {
                backend.set(key, target, ttl);
            }
            return;
        }
        if (written == null) {
            if (target != null) {
                backend.set(key, target, ttl, ExistCondition.MUST_NOT_EXIST);
            }
        } else if (target == null) {
            backend.deleteIfValue(key, written);
        } else {
            backend.replaceIfValue(key, written, target, ttl);
        }
    }
}
