package com.cacheshield.lock;

import com.cacheshield.exception.LockLostException;

/**
 * 已获取的锁，配合 try-with-resources 保证任何退出路径都会释放
 */
public class LockHandle implements AutoCloseable {

    private final LockManager manager;
    private final String key;
    private final String token;
    private volatile boolean released;

    LockHandle(LockManager manager, String key, String token) {
        this.manager = manager;
        this.key = key;
        this.token = token;
    }

    public String getKey() {
        return key;
    }

    public String getToken() {
        return token;
    }

    /**
     * 释放锁；锁已过期或被他人持有时抛出 {@link LockLostException}
     */
    public void release() {
        if (released) {
            return;
        }
        released = true;
        if (!manager.release(key, token)) {
            throw new LockLostException(key);
        }
    }

    /**
     * 释放锁，锁丢失只记录告警
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            manager.release(key, token);
        }
    }
}
