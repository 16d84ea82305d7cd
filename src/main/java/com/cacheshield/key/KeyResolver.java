package com.cacheshield.key;

/**
 * 由调用参数推导缓存 Key，结果必须是确定的
 */
@FunctionalInterface
public interface KeyResolver {

    String resolve(CallArgs args);

    /**
     * 未指定 Key 模板时的默认 Key：{@code <name>:<参数名>:<参数值>...}，按参数顺序
     */
    static KeyResolver defaultFor(String name) {
        return args -> {
            StringBuilder key = new StringBuilder(name);
            args.asMap().forEach((argName, value) ->
                key.append(':').append(argName).append(':').append(KeyTemplate.formatValue(value)));
            return key.toString();
        };
    }
}
