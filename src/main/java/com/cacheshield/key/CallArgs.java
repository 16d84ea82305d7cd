package com.cacheshield.key;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 一次调用的具名参数（保持声明顺序，值可以为 null）
 */
public final class CallArgs {

    private static final CallArgs EMPTY = new CallArgs(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private CallArgs(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CallArgs empty() {
        return EMPTY;
    }

    /**
     * 按 名称, 值, 名称, 值 ... 的顺序构造
     */
    public static CallArgs of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Arguments must be name/value pairs");
        }
        LinkedHashMap<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            values.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return new CallArgs(values);
    }

    public static CallArgs fromMap(Map<String, ?> values) {
        return new CallArgs(new LinkedHashMap<>(values));
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 返回追加（或覆盖）一个参数后的新实例
     */
    public CallArgs with(String name, Object value) {
        LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new CallArgs(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CallArgs other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "CallArgs" + values;
    }
}
