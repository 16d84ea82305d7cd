package com.cacheshield.backend;

import com.cacheshield.constant.CacheConstants;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 进程内有界存储
 * 基于 Caffeine 实现，W-TinyLFU 淘汰 + 每个条目独立的过期时间
 *
 * <p>所有条件写入、自增、比较删除都在 {@code asMap().compute} 内完成，对单个 Key 原子。
 * 过期判断使用注入的 {@link Clock}，Caffeine 的 ticker 与之对齐，便于测试控制时间。
 */
public class MemoryBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(MemoryBackend.class);

    private static final long NO_EXPIRE = -1;

    private final String name;
    private final Clock clock;
    private final Cache<String, StoredValue> store;

    public MemoryBackend() {
        this("memory", CacheConstants.DEFAULT_MEMORY_MAX_SIZE, Clock.systemUTC());
    }

    public MemoryBackend(String name, long maximumSize, Clock clock) {
        this.name = name;
        this.clock = clock;
        this.store = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new StoredValueExpiry(clock))
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            // 同步执行维护任务，淘汰结果可预期
            .executor(Runnable::run)
            .removalListener((String key, StoredValue value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Memory backend evicted due to size: key={}", key);
                }
            })
            .build();
        log.info("Memory backend initialized: name={}, maximumSize={}", name, maximumSize);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object get(String key) {
        StoredValue value = alive(store.getIfPresent(key), clock.millis());
        return value == null ? null : value.value();
    }

    @Override
    public List<Object> getMany(List<String> keys) {
        List<Object> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(get(key));
        }
        return values;
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, ExistCondition exist) {
        Objects.requireNonNull(value, "value");
        long now = clock.millis();
        AtomicBoolean written = new AtomicBoolean(false);
        store.asMap().compute(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (!exist.permits(current != null)) {
                return current;
            }
            written.set(true);
            return new StoredValue(value, expireAt(ttl, now));
        });
        return written.get();
    }

    @Override
    public void setMany(Map<String, Object> pairs, Duration ttl) {
        pairs.forEach((key, value) -> set(key, value, ttl, ExistCondition.ANY));
    }

    @Override
    public long incr(String key, long delta, Duration ttl) {
        long now = clock.millis();
        AtomicLong result = new AtomicLong();
        store.asMap().compute(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (current == null) {
                result.set(delta);
                return new StoredValue(delta, expireAt(ttl, now));
            }
            long next = toLong(key, current.value()) + delta;
            result.set(next);
            return new StoredValue(next, current.expireAt());
        });
        return result.get();
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        long now = clock.millis();
        AtomicBoolean found = new AtomicBoolean(false);
        store.asMap().computeIfPresent(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (current == null) {
                return null;
            }
            found.set(true);
            return new StoredValue(current.value(), expireAt(ttl, now));
        });
        return found.get();
    }

    @Override
    public long getExpire(String key) {
        long now = clock.millis();
        StoredValue value = alive(store.getIfPresent(key), now);
        if (value == null) {
            return CacheConstants.NOT_EXIST;
        }
        if (value.expireAt() == NO_EXPIRE) {
            return CacheConstants.UNLIMITED;
        }
        return value.expireAt() - now;
    }

    @Override
    public boolean delete(String key) {
        StoredValue removed = store.asMap().remove(key);
        return alive(removed, clock.millis()) != null;
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        long count = 0;
        for (String key : keys) {
            if (delete(key)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public long deleteMatch(String pattern) {
        List<String> keys;
        try (Stream<String> stream = scan(pattern)) {
            keys = stream.toList();
        }
        return deleteMany(keys);
    }

    @Override
    public boolean deleteIfValue(String key, Object expected) {
        long now = clock.millis();
        AtomicBoolean removed = new AtomicBoolean(false);
        store.asMap().computeIfPresent(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (current != null && Objects.equals(current.value(), expected)) {
                removed.set(true);
                return null;
            }
            return current;
        });
        return removed.get();
    }

    @Override
    public boolean replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        long now = clock.millis();
        AtomicBoolean replaced = new AtomicBoolean(false);
        store.asMap().computeIfPresent(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (current != null && Objects.equals(current.value(), expected)) {
                replaced.set(true);
                return new StoredValue(value, expireAt(ttl, now));
            }
            return current;
        });
        return replaced.get();
    }

    @Override
    public Stream<String> scan(String pattern) {
        Pattern regex = GlobPattern.compile(pattern);
        // 对 Key 集合做快照，扫描期间的写入不影响本次遍历
        List<String> snapshot = List.copyOf(store.asMap().keySet());
        return snapshot.stream()
            .filter(key -> regex.matcher(key).matches())
            .filter(this::exists);
    }

    @Override
    public boolean exists(String key) {
        return alive(store.getIfPresent(key), clock.millis()) != null;
    }

    @Override
    public long getKeysCount() {
        store.cleanUp();
        long now = clock.millis();
        return store.asMap().values().stream()
            .filter(value -> alive(value, now) != null)
            .count();
    }

    @Override
    public String ping(String message) {
        if (message == null || "PING".equalsIgnoreCase(message)) {
            return "PONG";
        }
        return message;
    }

    @Override
    public void clear() {
        store.invalidateAll();
        log.info("Memory backend cleared: name={}", name);
    }

    @Override
    public boolean[] getBits(String key, long... offsets) {
        boolean[] result = new boolean[offsets.length];
        StoredValue value = alive(store.getIfPresent(key), clock.millis());
        if (value == null) {
            return result;
        }
        BitArray bits = typed(key, value.value(), BitArray.class);
        for (int i = 0; i < offsets.length; i++) {
            result[i] = bits.get(offsets[i]);
        }
        return result;
    }

    @Override
    public void setBits(String key, long... offsets) {
        long now = clock.millis();
        store.asMap().compute(key, (k, old) -> {
            StoredValue current = alive(old, now);
            BitArray bits = current == null ? new BitArray() : typed(key, current.value(), BitArray.class);
            for (long offset : offsets) {
                bits.set(offset);
            }
            return current == null ? new StoredValue(bits, NO_EXPIRE) : current;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public void setAdd(String key, Duration ttl, Collection<String> members) {
        long now = clock.millis();
        store.asMap().compute(key, (k, old) -> {
            StoredValue current = alive(old, now);
            Set<String> set = current == null
                ? ConcurrentHashMap.newKeySet()
                : typed(key, current.value(), Set.class);
            set.addAll(members);
            long expireAt = ttl != null ? expireAt(ttl, now)
                : current == null ? NO_EXPIRE : current.expireAt();
            return new StoredValue(set, expireAt);
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public void setRemove(String key, Collection<String> members) {
        long now = clock.millis();
        store.asMap().computeIfPresent(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (current == null) {
                return null;
            }
            Set<String> set = typed(key, current.value(), Set.class);
            set.removeAll(members);
            return set.isEmpty() ? null : current;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public Set<String> setPop(String key, int count) {
        long now = clock.millis();
        Set<String> popped = new LinkedHashSet<>();
        store.asMap().computeIfPresent(key, (k, old) -> {
            StoredValue current = alive(old, now);
            if (current == null) {
                return null;
            }
            Set<String> set = typed(key, current.value(), Set.class);
            Iterator<String> it = set.iterator();
            while (it.hasNext() && popped.size() < count) {
                popped.add(it.next());
                it.remove();
            }
            return set.isEmpty() ? null : current;
        });
        return popped;
    }

    @Override
    public void close() {
        store.invalidateAll();
        store.cleanUp();
        log.info("Memory backend closed: name={}", name);
    }

    /**
     * 当前条目数（含尚未清理的过期条目），供监控使用
     */
    public long estimatedSize() {
        return store.estimatedSize();
    }

    private static StoredValue alive(StoredValue value, long now) {
        if (value == null || value.isExpired(now)) {
            return null;
        }
        return value;
    }

    private static long expireAt(Duration ttl, long now) {
        if (ttl == null) {
            return NO_EXPIRE;
        }
        return now + ttl.toMillis();
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Value of key " + key + " is not an integer", e);
            }
        }
        throw new IllegalStateException("Value of key " + key + " is not an integer");
    }

    private static <T> T typed(String key, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new IllegalStateException("WRONGTYPE key " + key + " holds " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    /**
     * 按段分配的位数组，偏移量支持 long 范围，只为置过位的段分配内存
     */
    private static final class BitArray {

        private static final int SEGMENT_SHIFT = 20;
        private static final long SEGMENT_MASK = (1L << SEGMENT_SHIFT) - 1;

        private final Map<Long, BitSet> segments = new HashMap<>();

        synchronized boolean get(long offset) {
            checkOffset(offset);
            BitSet segment = segments.get(offset >>> SEGMENT_SHIFT);
            return segment != null && segment.get((int) (offset & SEGMENT_MASK));
        }

        synchronized void set(long offset) {
            checkOffset(offset);
            segments.computeIfAbsent(offset >>> SEGMENT_SHIFT, index -> new BitSet())
                .set((int) (offset & SEGMENT_MASK));
        }

        private static void checkOffset(long offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("Bit offset must not be negative: " + offset);
            }
        }
    }

    private record StoredValue(Object value, long expireAt) {

        boolean isExpired(long now) {
            return expireAt != NO_EXPIRE && expireAt <= now;
        }
    }

    /**
     * 按条目自身的 expireAt 计算 Caffeine 的剩余存活时间
     */
    private static final class StoredValueExpiry implements Expiry<String, StoredValue> {

        private final Clock clock;

        StoredValueExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, StoredValue value, long currentTime) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
            return remainingNanos(value);
        }

        @Override
        public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(StoredValue value) {
            if (value.expireAt() == NO_EXPIRE) {
                return Long.MAX_VALUE;
            }
            long remaining = Math.max(0, value.expireAt() - clock.millis());
            return TimeUnit.MILLISECONDS.toNanos(remaining);
        }
    }
}
