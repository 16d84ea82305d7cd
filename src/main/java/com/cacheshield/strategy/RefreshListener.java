package com.cacheshield.strategy;

/**
 * 后台刷新的结果通道
 * 刷新在独立线程中执行，成功或失败都通过该回调通知，不会传递给触发刷新的调用方
 */
public interface RefreshListener {

    RefreshListener NONE = new RefreshListener() {
    };

    default void onRefreshed(String key, Object value) {
    }

    default void onFailure(String key, Throwable error) {
    }
}
