package com.cacheshield.exception;

/**
 * Key 模板语法错误或引用了未注册的转换函数
 */
public class KeyTemplateException extends CacheException {

    public KeyTemplateException(String message) {
        super(message);
    }
}
