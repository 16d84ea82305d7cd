package com.cacheshield.key;

import com.cacheshield.exception.KeyTemplateException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Key 模板
 *
 * <p>模板是字面量与参数引用交替组成的有序列表，例如 {@code user:{id}:{name:lower}}。
 * 参数引用形如 {@code {name}}、{@code {name:transform}}、{@code {name:hash(sha1)}}，
 * 点号路径 {@code {user.id}} 从 Map 类型参数中逐级取值。
 *
 * <p>渲染时缺失的参数替换为空串；渲染为匹配模式时替换为 {@code *}。
 */
public final class KeyTemplate implements KeyResolver {

    private final String source;
    private final List<Segment> segments;

    private KeyTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = segments;
    }

    public static KeyTemplate parse(String source) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '}') {
                throw new KeyTemplateException("Unmatched '}' at " + i + " in key template: " + source);
            }
            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }
            int end = source.indexOf('}', i);
            if (end < 0) {
                throw new KeyTemplateException("Unclosed '{' at " + i + " in key template: " + source);
            }
            if (literal.length() > 0) {
                segments.add(new Literal(literal.toString()));
                literal.setLength(0);
            }
            segments.add(Reference.parse(source.substring(i + 1, end), source));
            i = end + 1;
        }
        if (literal.length() > 0) {
            segments.add(new Literal(literal.toString()));
        }
        return new KeyTemplate(source, List.copyOf(segments));
    }

    public String source() {
        return source;
    }

    @Override
    public String resolve(CallArgs args) {
        return render(args);
    }

    public String render(CallArgs args) {
        return render(args, "");
    }

    /**
     * 渲染为通配模式，缺失参数替换为 {@code *}
     */
    public String renderPattern(CallArgs args) {
        return render(args, "*");
    }

    public KeyTemplate withPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return this;
        }
        return parse(prefix + ":" + source);
    }

    /**
     * 模板引用的参数名（点号路径取第一段）
     */
    public Set<String> argumentNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment instanceof Reference reference) {
                names.add(reference.path().get(0));
            }
        }
        return names;
    }

    /**
     * 校验模板只引用已声明的参数
     */
    public void validate(Collection<String> declared) {
        for (String name : argumentNames()) {
            if (!declared.contains(name)) {
                throw new KeyTemplateException("Wrong parameter placeholder '" + name + "' in the key: " + source);
            }
        }
    }

    public boolean hasReferences() {
        return segments.stream().anyMatch(Reference.class::isInstance);
    }

    private String render(CallArgs args, String missing) {
        StringBuilder key = new StringBuilder();
        for (Segment segment : segments) {
            if (segment instanceof Literal literal) {
                key.append(literal.text());
            } else {
                key.append(((Reference) segment).render(args, missing));
            }
        }
        return key.toString();
    }

    /**
     * 参数值格式化规则：null 为空串，布尔小写，集合与数组以 ':' 连接，Map 按键排序后以 k:v 连接，
     * 字节数组按 UTF-8 解码（非法时转十六进制），异常为 类名:消息
     */
    public static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Boolean bool) {
            return bool.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof byte[] bytes) {
            return decodeBytes(bytes);
        }
        if (value instanceof Throwable error) {
            return error.getClass().getSimpleName() + ":" + (error.getMessage() == null ? "" : error.getMessage());
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(KeyTemplate::formatValue).collect(Collectors.joining(":"));
        }
        if (value instanceof Object[] items) {
            return Arrays.stream(items).map(KeyTemplate::formatValue).collect(Collectors.joining(":"));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
            return sorted.entrySet().stream()
                .map(entry -> entry.getKey() + ":" + formatValue(entry.getValue()))
                .collect(Collectors.joining(":"));
        }
        return value.toString();
    }

    private static String decodeBytes(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return HexFormat.of().formatHex(bytes);
        }
    }

    @Override
    public String toString() {
        return source;
    }

    private interface Segment {
    }

    private record Literal(String text) implements Segment {
    }

    private record Reference(List<String> path, String transform, List<String> params) implements Segment {

        static Reference parse(String body, String source) {
            if (body.isBlank()) {
                throw new KeyTemplateException("Empty placeholder in key template: " + source);
            }
            String field = body;
            String transform = null;
            List<String> params = List.of();
            int colon = body.indexOf(':');
            if (colon >= 0) {
                field = body.substring(0, colon);
                String suffix = body.substring(colon + 1);
                int paren = suffix.indexOf('(');
                if (paren >= 0) {
                    transform = suffix.substring(0, paren);
                    String inner = suffix.substring(paren + 1).replace(")", "");
                    params = inner.isEmpty() ? List.of() : List.of(inner.split(","));
                } else {
                    transform = suffix;
                }
                // 提前校验，未注册的转换在解析时报错
                KeyTransforms.lookup(transform);
            }
            return new Reference(List.of(field.trim().split("\\.")), transform, params);
        }

        String render(CallArgs args, String missing) {
            String name = path.get(0);
            if (!args.contains(name)) {
                return missing;
            }
            Object value = args.get(name);
            for (int i = 1; i < path.size(); i++) {
                if (!(value instanceof Map<?, ?> map) || !map.containsKey(path.get(i))) {
                    return missing;
                }
                value = map.get(path.get(i));
            }
            String formatted = formatValue(value);
            if (transform == null) {
                return formatted;
            }
            return KeyTransforms.lookup(transform).apply(value, formatted, params);
        }
    }
}
