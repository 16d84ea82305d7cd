package com.cacheshield.observe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用作用域内的缓存使用记录
 *
 * <pre>{@code
 * try (CacheObservation.Scope scope = CacheObservation.start()) {
 *     service.load(id);
 *     List<CacheRecord> records = scope.records();
 * }
 * }</pre>
 *
 * 作用域绑定在当前线程上，可以嵌套；后台刷新线程的写入不计入调用方作用域。
 */
public final class CacheObservation {

    private static final ThreadLocal<Scope> CURRENT = new ThreadLocal<>();

    private CacheObservation() {}

    public static Scope start() {
        Scope scope = new Scope(CURRENT.get());
        CURRENT.set(scope);
        return scope;
    }

    public static boolean isActive() {
        return CURRENT.get() != null;
    }

    /**
     * 记录到当前作用域（以及所有外层作用域），没有作用域时忽略
     */
    public static void record(CacheRecord record) {
        for (Scope scope = CURRENT.get(); scope != null; scope = scope.parent) {
            scope.add(record);
        }
    }

    public static final class Scope implements AutoCloseable {

        private final Scope parent;
        private final List<CacheRecord> records = Collections.synchronizedList(new ArrayList<>());

        private Scope(Scope parent) {
            this.parent = parent;
        }

        private void add(CacheRecord record) {
            records.add(record);
        }

        /**
         * 按发生顺序返回记录快照
         */
        public List<CacheRecord> records() {
            synchronized (records) {
                return List.copyOf(records);
            }
        }

        @Override
        public void close() {
            if (parent == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(parent);
            }
        }
    }
}
