package com.cacheshield.exception;

/**
 * 存储后端不可达（网络、超时、连接池耗尽等 I/O 失败）
 */
public class BackendUnavailableException extends CacheException {

    private final String backend;

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
