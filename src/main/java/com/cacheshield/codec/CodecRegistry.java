package com.cacheshield.codec;

import com.cacheshield.exception.CodecException;
import com.cacheshield.strategy.CachedFailure;
import com.cacheshield.strategy.EarlyEntry;
import com.cacheshield.strategy.SoftEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 缓存值编解码注册表
 *
 * <p>编码格式：{@code <tag>|<payload>}。整数不带标签直接编码为十进制文本，
 * 这样网络存储上的原子自增（INCR）与普通读写可以作用在同一个 Key 上。
 * 未注册的类型使用默认结构化编码：按声明字段序列化为 JSON，标签为 {@code j|<类名>}。
 */
public class CodecRegistry {

    private static final Logger log = LoggerFactory.getLogger(CodecRegistry.class);

    private static final char SEPARATOR = '|';
    private static final String STRUCTURAL_TAG = "j";
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,19}");

    private final Map<String, Registration<?>> byTag = new ConcurrentHashMap<>();
    private final Map<Class<?>, Registration<?>> byType = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public CodecRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 注册内置类型：字符串、布尔、浮点、策略条目、缓存的异常
     */
    public static CodecRegistry withDefaults() {
        return withDefaults(defaultObjectMapper());
    }

    public static CodecRegistry withDefaults(ObjectMapper objectMapper) {
        CodecRegistry registry = new CodecRegistry(objectMapper);
        registry.register("s", String.class, ValueCodec.of(value -> value, payload -> payload));
        registry.register("b", Boolean.class, ValueCodec.of(String::valueOf, Boolean::valueOf));
        registry.register("d", Double.class, ValueCodec.of(String::valueOf, Double::valueOf));
        registry.register("early", EarlyEntry.class, ValueCodec.of(
            entry -> entry.earlyExpireAt() + String.valueOf(SEPARATOR) + registry.encode(entry.value()),
            payload -> {
                int split = payload.indexOf(SEPARATOR);
                return new EarlyEntry(registry.decode(payload.substring(split + 1)),
                    Long.parseLong(payload.substring(0, split)));
            }));
        registry.register("soft", SoftEntry.class, ValueCodec.of(
            entry -> entry.softExpireAt() + String.valueOf(SEPARATOR) + registry.encode(entry.value()),
            payload -> {
                int split = payload.indexOf(SEPARATOR);
                return new SoftEntry(registry.decode(payload.substring(split + 1)),
                    Long.parseLong(payload.substring(0, split)));
            }));
        registry.register("failure", CachedFailure.class, ValueCodec.of(
            failure -> failure.error().getClass().getName() + SEPARATOR
                + (failure.error().getMessage() == null ? "" : failure.error().getMessage()),
            payload -> {
                int split = payload.indexOf(SEPARATOR);
                return new CachedFailure(restoreException(payload.substring(0, split), payload.substring(split + 1)));
            }));
        return registry;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    /**
     * 注册类型编解码器
     *
     * @param tag 类型标签，不能包含 '|'
     */
    public <T> CodecRegistry register(String tag, Class<T> type, ValueCodec<T> codec) {
        if (tag.indexOf(SEPARATOR) >= 0 || STRUCTURAL_TAG.equals(tag)) {
            throw new IllegalArgumentException("Illegal codec tag: " + tag);
        }
        Registration<T> registration = new Registration<>(tag, type, codec);
        byTag.put(tag, registration);
        byType.put(type, registration);
        return this;
    }

    public String encode(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return value.toString();
        }
        Registration<?> registration = lookup(value.getClass());
        if (registration != null) {
            return registration.tag() + SEPARATOR + registration.encode(value);
        }
        try {
            return STRUCTURAL_TAG + SEPARATOR + value.getClass().getName() + SEPARATOR
                + objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("Cannot encode value of type " + value.getClass().getName(), e);
        }
    }

    public Object decode(String raw) {
        if (raw == null) {
            return null;
        }
        if (INTEGER.matcher(raw).matches()) {
            return Long.parseLong(raw);
        }
        int split = raw.indexOf(SEPARATOR);
        if (split < 0) {
            throw new CodecException("Missing codec tag in stored value");
        }
        String tag = raw.substring(0, split);
        String payload = raw.substring(split + 1);
        if (STRUCTURAL_TAG.equals(tag)) {
            return decodeStructural(payload);
        }
        Registration<?> registration = byTag.get(tag);
        if (registration == null) {
            throw new CodecException("Unknown codec tag: " + tag);
        }
        return registration.codec().decode(payload);
    }

    private Registration<?> lookup(Class<?> type) {
        Registration<?> registration = byType.get(type);
        if (registration != null) {
            return registration;
        }
        for (Registration<?> candidate : byType.values()) {
            if (candidate.type().isAssignableFrom(type)) {
                byType.put(type, candidate);
                return candidate;
            }
        }
        return null;
    }

    private Object decodeStructural(String payload) {
        int split = payload.indexOf(SEPARATOR);
        if (split < 0) {
            throw new CodecException("Malformed structural payload");
        }
        String className = payload.substring(0, split);
        try {
            Class<?> type = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
            return objectMapper.readValue(payload.substring(split + 1), type);
        } catch (ClassNotFoundException | JsonProcessingException e) {
            throw new CodecException("Cannot decode value of type " + className, e);
        }
    }

    private static RuntimeException restoreException(String className, String message) {
        try {
            Class<?> type = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
            if (RuntimeException.class.isAssignableFrom(type)) {
                Constructor<?> constructor = type.getConstructor(String.class);
                return (RuntimeException) constructor.newInstance(message);
            }
        } catch (ReflectiveOperationException e) {
            log.debug("Cannot restore cached exception {}, falling back to CodecException", className);
        }
        return new CodecException(className + ": " + message);
    }

    private record Registration<T>(String tag, Class<T> type, ValueCodec<T> codec) {

        String encode(Object value) {
            return codec.encode(type.cast(value));
        }
    }
}
