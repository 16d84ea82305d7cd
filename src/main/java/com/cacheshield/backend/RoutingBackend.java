package com.cacheshield.backend;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * 按 Key 前缀路由到多个后端
 *
 * <p>每个 Key 路由到前缀匹配最长的后端，默认前缀为空串。批量命令按后端分组执行，
 * 结果按输入顺序合并；通配模式按其字面量前缀路由，前缀无法确定归属时广播到所有可能匹配的后端。
 */
public class RoutingBackend implements CacheBackend {

    private final String name;
    private final TreeMap<String, CacheBackend> routes;

    public RoutingBackend(String name, Map<String, CacheBackend> routes) {
        if (!routes.containsKey("")) {
            throw new IllegalArgumentException("A default backend (prefix \"\") is required");
        }
        this.name = name;
        this.routes = new TreeMap<>(routes);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Key 所属的后端
     */
    public CacheBackend route(String key) {
        CacheBackend best = routes.get("");
        int bestLength = 0;
        for (Map.Entry<String, CacheBackend> entry : routes.entrySet()) {
            String prefix = entry.getKey();
            if (prefix.length() > bestLength && key.startsWith(prefix)) {
                best = entry.getValue();
                bestLength = prefix.length();
            }
        }
        return best;
    }

    /**
     * 去重后的后端列表（同一个后端可以注册在多个前缀下）
     */
    public List<CacheBackend> backends() {
        return routes.values().stream().distinct().toList();
    }

    @Override
    public Object get(String key) {
        return route(key).get(key);
    }

    @Override
    public List<Object> getMany(List<String> keys) {
        Map<CacheBackend, List<Integer>> groups = groupIndexes(keys);
        Object[] values = new Object[keys.size()];
        groups.forEach((backend, indexes) -> {
            List<String> groupKeys = new ArrayList<>(indexes.size());
            indexes.forEach(i -> groupKeys.add(keys.get(i)));
            List<Object> groupValues = backend.getMany(groupKeys);
            for (int i = 0; i < indexes.size(); i++) {
                values[indexes.get(i)] = groupValues.get(i);
            }
        });
        List<Object> result = new ArrayList<>(keys.size());
        for (Object value : values) {
            result.add(value);
        }
        return result;
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, ExistCondition exist) {
        return route(key).set(key, value, ttl, exist);
    }

    @Override
    public void setMany(Map<String, Object> pairs, Duration ttl) {
        Map<CacheBackend, Map<String, Object>> groups = new LinkedHashMap<>();
        pairs.forEach((key, value) ->
            groups.computeIfAbsent(route(key), backend -> new LinkedHashMap<>()).put(key, value));
        groups.forEach((backend, group) -> backend.setMany(group, ttl));
    }

    @Override
    public long incr(String key, long delta, Duration ttl) {
        return route(key).incr(key, delta, ttl);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return route(key).expire(key, ttl);
    }

    @Override
    public long getExpire(String key) {
        return route(key).getExpire(key);
    }

    @Override
    public boolean delete(String key) {
        return route(key).delete(key);
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        Map<CacheBackend, List<String>> groups = new LinkedHashMap<>();
        for (String key : keys) {
            groups.computeIfAbsent(route(key), backend -> new ArrayList<>()).add(key);
        }
        long deleted = 0;
        for (Map.Entry<CacheBackend, List<String>> group : groups.entrySet()) {
            deleted += group.getKey().deleteMany(group.getValue());
        }
        return deleted;
    }

    @Override
    public long deleteMatch(String pattern) {
        long deleted = 0;
        for (CacheBackend backend : patternBackends(pattern)) {
            deleted += backend.deleteMatch(pattern);
        }
        return deleted;
    }

    @Override
    public boolean deleteIfValue(String key, Object expected) {
        return route(key).deleteIfValue(key, expected);
    }

    @Override
    public boolean replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        return route(key).replaceIfValue(key, expected, value, ttl);
    }

    @Override
    public Stream<String> scan(String pattern) {
        List<CacheBackend> targets = patternBackends(pattern);
        Stream<String> result = Stream.empty();
        for (CacheBackend backend : targets) {
            // 惰性拼接，真正消费时才打开每个后端的游标
            Stream<String> next = Stream.of(backend).flatMap(b -> b.scan(pattern).filter(key -> route(key) == b));
            result = Stream.concat(result, next);
        }
        return result;
    }

    @Override
    public boolean exists(String key) {
        return route(key).exists(key);
    }

    @Override
    public long getKeysCount() {
        long count = 0;
        for (CacheBackend backend : backends()) {
            count += backend.getKeysCount();
        }
        return count;
    }

    @Override
    public String ping(String message) {
        return routes.get("").ping(message);
    }

    @Override
    public void clear() {
        backends().forEach(CacheBackend::clear);
    }

    @Override
    public boolean[] getBits(String key, long... offsets) {
        return route(key).getBits(key, offsets);
    }

    @Override
    public void setBits(String key, long... offsets) {
        route(key).setBits(key, offsets);
    }

    @Override
    public void setAdd(String key, Duration ttl, Collection<String> members) {
        route(key).setAdd(key, ttl, members);
    }

    @Override
    public void setRemove(String key, Collection<String> members) {
        route(key).setRemove(key, members);
    }

    @Override
    public Set<String> setPop(String key, int count) {
        return route(key).setPop(key, count);
    }

    @Override
    public void close() {
        backends().forEach(CacheBackend::close);
    }

    private Map<CacheBackend, List<Integer>> groupIndexes(List<String> keys) {
        Map<CacheBackend, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            groups.computeIfAbsent(route(keys.get(i)), backend -> new ArrayList<>()).add(i);
        }
        return groups;
    }

    /**
     * 可能包含匹配 Key 的后端：字面量前缀落在某个路由内，或某个路由前缀以字面量前缀开头
     */
    private List<CacheBackend> patternBackends(String pattern) {
        String literal = GlobPattern.literalPrefix(pattern);
        List<CacheBackend> targets = new ArrayList<>();
        CacheBackend owner = route(literal);
        targets.add(owner);
        for (Map.Entry<String, CacheBackend> entry : routes.entrySet()) {
            CacheBackend backend = entry.getValue();
            if (!targets.contains(backend) && entry.getKey().startsWith(literal)) {
                targets.add(backend);
            }
        }
        return targets;
    }
}
