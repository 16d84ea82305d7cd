package com.cacheshield.exception;

/**
 * 缓存值编解码失败
 */
public class CodecException extends CacheException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
