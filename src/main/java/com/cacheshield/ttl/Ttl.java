package com.cacheshield.ttl;

import com.cacheshield.key.CallArgs;

import java.time.Duration;
import java.util.Locale;

/**
 * 过期时间
 *
 * <p>支持秒数、{@link Duration}、时长字符串（{@code "1d2h3m"}、{@code "90"}）
 * 以及调用参数（和结果）的函数。函数返回值可以是以上任一形式，返回 null 表示不过期。
 */
public final class Ttl {

    private final Duration fixed;
    private final TtlFunction function;

    private Ttl(Duration fixed, TtlFunction function) {
        this.fixed = fixed;
        this.function = function;
    }

    /**
     * 不过期
     */
    public static Ttl none() {
        return new Ttl(null, null);
    }

    public static Ttl ofSeconds(long seconds) {
        return new Ttl(Duration.ofSeconds(seconds), null);
    }

    public static Ttl of(Duration duration) {
        return new Ttl(duration, null);
    }

    public static Ttl of(String text) {
        return new Ttl(parse(text), null);
    }

    public static Ttl of(TtlFunction function) {
        return new Ttl(null, function);
    }

    public boolean isDynamic() {
        return function != null;
    }

    public Duration resolve(CallArgs args) {
        return resolve(args, null);
    }

    /**
     * 计算本次调用的过期时间
     *
     * @param result 调用结果（写入前计算时可以为 null）
     */
    public Duration resolve(CallArgs args, Object result) {
        if (function == null) {
            return fixed;
        }
        return toDuration(function.apply(args, result));
    }

    /**
     * 按比例缩短（early_ttl / soft_ttl 的默认值）
     */
    public Ttl scaled(double ratio) {
        if (function == null) {
            return fixed == null ? this : new Ttl(Duration.ofMillis((long) (fixed.toMillis() * ratio)), null);
        }
        return new Ttl(null, (args, result) -> {
            Duration base = toDuration(function.apply(args, result));
            return base == null ? null : Duration.ofMillis((long) (base.toMillis() * ratio));
        });
    }

    public static Duration toDuration(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration duration) {
            return duration;
        }
        if (value instanceof Integer || value instanceof Long) {
            return Duration.ofSeconds(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        }
        if (value instanceof String text) {
            return parse(text);
        }
        throw new IllegalArgumentException("Unsupported ttl value: " + value);
    }

    /**
     * 解析时长字符串：由 数字+单位(d/h/m/s) 组成，纯数字表示秒数
     */
    public static Duration parse(String text) {
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("ttl '" + text + "' has wrong string representation");
        }
        long seconds = 0;
        boolean hasUnit = false;
        StringBuilder digits = new StringBuilder();
        for (char c : normalized.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
                continue;
            }
            long unit = switch (c) {
                case 'd' -> 86_400;
                case 'h' -> 3_600;
                case 'm' -> 60;
                case 's' -> 1;
                default -> throw new IllegalArgumentException("ttl '" + text + "' has wrong string representation");
            };
            if (digits.length() == 0) {
                throw new IllegalArgumentException("ttl '" + text + "' has wrong string representation");
            }
            seconds += Long.parseLong(digits.toString()) * unit;
            digits.setLength(0);
            hasUnit = true;
        }
        if (digits.length() > 0) {
            if (hasUnit) {
                throw new IllegalArgumentException("ttl '" + text + "' has wrong string representation");
            }
            seconds = Long.parseLong(digits.toString());
        }
        return Duration.ofSeconds(seconds);
    }

    @Override
    public String toString() {
        return function == null ? String.valueOf(fixed) : "Ttl(dynamic)";
    }

    /**
     * 动态过期时间
     */
    @FunctionalInterface
    public interface TtlFunction {

        Object apply(CallArgs args, Object result);
    }
}
