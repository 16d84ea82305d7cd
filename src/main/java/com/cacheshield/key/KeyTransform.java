package com.cacheshield.key;

import java.util.List;

/**
 * Key 模板中的具名转换函数
 */
@FunctionalInterface
public interface KeyTransform {

    /**
     * @param raw       参数原始值
     * @param formatted 参数格式化后的字符串
     * @param params    模板中括号内的参数，如 {@code hash(sha1)} 中的 sha1
     */
    String apply(Object raw, String formatted, List<String> params);
}
