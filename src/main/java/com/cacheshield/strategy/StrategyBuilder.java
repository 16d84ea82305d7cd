package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.key.KeyResolver;
import com.cacheshield.key.KeyTemplate;
import com.cacheshield.ttl.Ttl;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 策略构建器基类
 *
 * @param <B> 具体构建器类型
 */
public abstract class StrategyBuilder<B extends StrategyBuilder<B>> {

    protected final Cache cache;
    private String name;
    private KeyTemplate keyTemplate;
    private KeyResolver keyResolver;
    private String prefix;
    protected Ttl ttl;
    private CacheCondition condition = CacheCondition.notNull();
    private Duration timeCondition;
    private final List<KeyTemplate> tags = new ArrayList<>();

    protected StrategyBuilder(Cache cache, String defaultPrefix) {
        this.cache = cache;
        this.prefix = defaultPrefix;
    }

    protected abstract B self();

    public B name(String name) {
        this.name = name;
        return self();
    }

    /**
     * Key 模板，如 {@code "user:{id}"}
     */
    public B key(String template) {
        this.keyTemplate = KeyTemplate.parse(template);
        this.keyResolver = null;
        return self();
    }

    public B key(KeyResolver resolver) {
        this.keyResolver = resolver;
        this.keyTemplate = null;
        return self();
    }

    public B prefix(String prefix) {
        this.prefix = prefix;
        return self();
    }

    public B ttl(long seconds) {
        return ttl(Ttl.ofSeconds(seconds));
    }

    public B ttl(Duration ttl) {
        return ttl(Ttl.of(ttl));
    }

    /**
     * 时长字符串，如 {@code "1d2h3m"}
     */
    public B ttl(String ttl) {
        return ttl(Ttl.of(ttl));
    }

    public B ttl(Ttl.TtlFunction function) {
        return ttl(Ttl.of(function));
    }

    public B ttl(Ttl ttl) {
        this.ttl = ttl;
        return self();
    }

    public B condition(CacheCondition condition) {
        this.condition = condition;
        return self();
    }

    public B timeCondition(Duration minimumLatency) {
        this.timeCondition = minimumLatency;
        return self();
    }

    public B tags(String... templates) {
        for (String template : templates) {
            this.tags.add(KeyTemplate.parse(template));
        }
        return self();
    }

    protected String prefix() {
        return prefix;
    }

    protected StrategySettings settings() {
        if (keyTemplate != null && !tags.isEmpty()) {
            tags.forEach(tag -> tag.validate(keyTemplate.argumentNames()));
        }
        return new StrategySettings(name, resolveKey(), ttl, condition, timeCondition, List.copyOf(tags));
    }

    /**
     * 计算 Key 推导函数：模板 / 自定义函数 / 默认 Key，非空前缀以 ':' 连接
     */
    private KeyResolver resolveKey() {
        if (keyTemplate != null) {
            return keyTemplate.withPrefix(prefix);
        }
        KeyResolver base = keyResolver;
        if (base == null) {
            if (name == null) {
                throw new IllegalStateException("Strategy requires a name or a key");
            }
            base = KeyResolver.defaultFor(name);
        }
        if (prefix == null || prefix.isEmpty()) {
            return base;
        }
        KeyResolver unprefixed = base;
        return args -> prefix + ":" + unprefixed.resolve(args);
    }
}
