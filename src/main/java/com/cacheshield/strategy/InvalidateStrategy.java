package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.key.CallArgs;
import com.cacheshield.key.KeyTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 写操作后的缓存失效
 *
 * <p>目标操作成功返回后，按目标 Key 模板删除对应缓存：目标模板中的参数先取重命名映射中的调用参数，
 * 再取同名调用参数，最后取默认值，仍未绑定的参数替换为 {@code *} 并按模式删除。
 * 同时删除配置的 Tag。目标操作抛出异常时不做任何失效。
 */
public class InvalidateStrategy<R> implements CachedOperation<R> {

    private static final Logger log = LoggerFactory.getLogger(InvalidateStrategy.class);

    private final Cache cache;
    private final CachedOperation<R> operation;
    private final KeyTemplate target;
    private final Map<String, String> argsMap;
    private final Map<String, Object> defaults;
    private final List<KeyTemplate> tags;

    InvalidateStrategy(Cache cache, CachedOperation<R> operation, KeyTemplate target,
                       Map<String, String> argsMap, Map<String, Object> defaults, List<KeyTemplate> tags) {
        this.cache = cache;
        this.operation = operation;
        this.target = target;
        this.argsMap = argsMap;
        this.defaults = defaults;
        this.tags = tags;
    }

    @Override
    public R apply(CallArgs args) {
        R result = operation.apply(args);
        CallArgs targetArgs = targetArgs(args);
        if (target != null) {
            String pattern = target.renderPattern(targetArgs);
            if (pattern.contains("*")) {
                long deleted = cache.deleteMatch(pattern);
                log.info("Invalidated by pattern: {}, deleted: {}", pattern, deleted);
            } else {
                cache.delete(pattern);
                log.info("Invalidated key: {}", pattern);
            }
        }
        for (KeyTemplate tag : tags) {
            cache.deleteTags(tag.render(targetArgs));
        }
        return result;
    }

    /**
     * 目标模板使用的参数
     */
    CallArgs targetArgs(CallArgs args) {
        Map<String, Object> values = new LinkedHashMap<>(defaults);
        for (String name : args.names()) {
            values.put(name, args.get(name));
        }
        argsMap.forEach((targetName, sourceName) -> {
            if (args.contains(sourceName)) {
                values.put(targetName, args.get(sourceName));
            }
        });
        return CallArgs.fromMap(values);
    }

    public static class Builder {

        private final Cache cache;
        private KeyTemplate target;
        private final Map<String, String> argsMap = new LinkedHashMap<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private final List<KeyTemplate> tags = new ArrayList<>();

        public Builder(Cache cache) {
            this.cache = cache;
        }

        /**
         * 目标 Key 模板（含目标策略的前缀），如 {@code "user:{id}"}
         */
        public Builder target(String template) {
            this.target = KeyTemplate.parse(template);
            return this;
        }

        public Builder target(String prefix, String template) {
            this.target = KeyTemplate.parse(template).withPrefix(prefix);
            return this;
        }

        /**
         * 参数重命名：目标模板参数名 -> 调用参数名
         */
        public Builder argsMap(Map<String, String> argsMap) {
            this.argsMap.putAll(argsMap);
            return this;
        }

        public Builder mapArg(String targetName, String sourceName) {
            this.argsMap.put(targetName, sourceName);
            return this;
        }

        public Builder defaults(Map<String, ?> defaults) {
            this.defaults.putAll(defaults);
            return this;
        }

        public Builder defaultValue(String name, Object value) {
            this.defaults.put(name, value);
            return this;
        }

        public Builder tags(String... templates) {
            for (String template : templates) {
                this.tags.add(KeyTemplate.parse(template));
            }
            return this;
        }

        public <R> InvalidateStrategy<R> build(CachedOperation<R> operation) {
            if (target == null && tags.isEmpty()) {
                throw new IllegalStateException("Invalidate requires a target key template or tags");
            }
            return new InvalidateStrategy<>(cache, operation, target,
                Map.copyOf(argsMap), new LinkedHashMap<>(defaults), List.copyOf(tags));
        }
    }
}
