package com.cacheshield.backend;

import com.cacheshield.codec.CodecRegistry;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Redis 网络存储后端
 * 基于 StringRedisTemplate（Lettuce），值经 {@link CodecRegistry} 编码为字符串
 *
 * <p>自增与比较删除使用 Lua 脚本保证原子性；按模式删除使用 SCAN 分批进行，不阻塞 Redis。
 * 所有 Spring {@link DataAccessException} 统一转换为 {@link BackendUnavailableException}。
 */
public class RedisBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisBackend.class);

    /**
     * 原子自增，仅当本次自增创建了 Key 时设置过期时间
     * KEYS[1]: key
     * ARGV[1]: 增量
     * ARGV[2]: 过期时间（毫秒，0 表示不过期）
     */
    private static final String INCR_SCRIPT = """
        local created = redis.call('EXISTS', KEYS[1]) == 0
        local value = redis.call('INCRBY', KEYS[1], ARGV[1])
        if created and tonumber(ARGV[2]) > 0 then
            redis.call('PEXPIRE', KEYS[1], ARGV[2])
        end
        return value
        """;

    /**
     * 比较删除（锁释放）
     * KEYS[1]: key
     * ARGV[1]: 期望值
     */
    private static final String DELETE_IF_VALUE_SCRIPT = """
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('DEL', KEYS[1])
        end
        return 0
        """;

    /**
     * 比较替换（事务回滚）
     * KEYS[1]: key
     * ARGV[1]: 期望值
     * ARGV[2]: 新值
     * ARGV[3]: 过期时间（毫秒，0 表示不过期）
     */
    private static final String REPLACE_IF_VALUE_SCRIPT = """
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            if tonumber(ARGV[3]) > 0 then
                redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
            else
                redis.call('SET', KEYS[1], ARGV[2])
            end
            return 1
        end
        return 0
        """;

    private static final RedisScript<Long> INCR = RedisScript.of(INCR_SCRIPT, Long.class);
    private static final RedisScript<Long> DELETE_IF_VALUE = RedisScript.of(DELETE_IF_VALUE_SCRIPT, Long.class);
    private static final RedisScript<Long> REPLACE_IF_VALUE = RedisScript.of(REPLACE_IF_VALUE_SCRIPT, Long.class);

    private final String name;
    private final StringRedisTemplate redisTemplate;
    private final CodecRegistry codecs;

    public RedisBackend(String name, StringRedisTemplate redisTemplate, CodecRegistry codecs) {
        this.name = name;
        this.redisTemplate = redisTemplate;
        this.codecs = codecs;
        log.info("Redis backend initialized: name={}", name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object get(String key) {
        return call(Command.GET, key, () -> codecs.decode(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public List<Object> getMany(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        return call(Command.GET_MANY, keys.get(0), () -> {
            List<String> raw = redisTemplate.opsForValue().multiGet(keys);
            List<Object> values = new ArrayList<>(keys.size());
            for (int i = 0; i < keys.size(); i++) {
                values.add(raw == null ? null : codecs.decode(raw.get(i)));
            }
            return values;
        });
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, ExistCondition exist) {
        String encoded = codecs.encode(value);
        return call(Command.SET, key, () -> switch (exist) {
            case ANY -> {
                if (ttl == null) {
                    redisTemplate.opsForValue().set(key, encoded);
                } else {
                    redisTemplate.opsForValue().set(key, encoded, ttl);
                }
                yield true;
            }
            case MUST_NOT_EXIST -> Boolean.TRUE.equals(ttl == null
                ? redisTemplate.opsForValue().setIfAbsent(key, encoded)
                : redisTemplate.opsForValue().setIfAbsent(key, encoded, ttl));
            case MUST_EXIST -> Boolean.TRUE.equals(ttl == null
                ? redisTemplate.opsForValue().setIfPresent(key, encoded)
                : redisTemplate.opsForValue().setIfPresent(key, encoded, ttl));
        });
    }

    @Override
    public void setMany(Map<String, Object> pairs, Duration ttl) {
        if (pairs.isEmpty()) {
            return;
        }
        Map<String, String> encoded = new LinkedHashMap<>();
        pairs.forEach((key, value) -> encoded.put(key, codecs.encode(value)));
        call(Command.SET_MANY, pairs.keySet().iterator().next(), () -> {
            if (ttl == null) {
                redisTemplate.opsForValue().multiSet(encoded);
                return null;
            }
            // Pipeline 写入，每个 Key 带过期时间
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                Expiration expiration = Expiration.milliseconds(ttl.toMillis());
                encoded.forEach((key, value) -> connection.stringCommands()
                    .set(bytes(key), bytes(value), expiration, SetOption.upsert()));
                return null;
            });
            return null;
        });
    }

    @Override
    public long incr(String key, long delta, Duration ttl) {
        long ttlMillis = ttl == null ? 0 : ttl.toMillis();
        Long value = call(Command.INCR, key, () -> redisTemplate.execute(
            INCR,
            Collections.singletonList(key),
            String.valueOf(delta),
            String.valueOf(ttlMillis)));
        return value == null ? 0 : value;
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return call(Command.EXPIRE, key, () -> ttl == null
            ? Boolean.TRUE.equals(redisTemplate.persist(key)) || Boolean.TRUE.equals(redisTemplate.hasKey(key))
            : Boolean.TRUE.equals(redisTemplate.expire(key, ttl)));
    }

    @Override
    public long getExpire(String key) {
        Long expire = call(Command.GET_EXPIRE, key, () -> redisTemplate.getExpire(key, TimeUnit.MILLISECONDS));
        return expire == null ? CacheConstants.NOT_EXIST : expire;
    }

    @Override
    public boolean delete(String key) {
        return call(Command.DELETE, key, () -> Boolean.TRUE.equals(redisTemplate.delete(key)));
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = call(Command.DELETE_MANY, keys.iterator().next(), () -> redisTemplate.delete(keys));
        return deleted == null ? 0 : deleted;
    }

    @Override
    public long deleteMatch(String pattern) {
        long deleted = 0;
        List<String> batch = new ArrayList<>(CacheConstants.SCAN_BATCH);
        try (Stream<String> keys = scan(pattern)) {
            for (String key : (Iterable<String>) keys::iterator) {
                batch.add(key);
                if (batch.size() >= CacheConstants.SCAN_BATCH) {
                    deleted += deleteMany(batch);
                    batch.clear();
                }
            }
        }
        deleted += deleteMany(batch);
        log.debug("Redis deleteMatch: pattern={}, deleted={}", pattern, deleted);
        return deleted;
    }

    @Override
    public boolean deleteIfValue(String key, Object expected) {
        String encoded = codecs.encode(expected);
        Long removed = call(Command.DELETE_IF_VALUE, key, () -> redisTemplate.execute(
            DELETE_IF_VALUE,
            Collections.singletonList(key),
            encoded));
        return removed != null && removed > 0;
    }

    @Override
    public boolean replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        String encodedExpected = codecs.encode(expected);
        String encodedValue = codecs.encode(value);
        long ttlMillis = ttl == null ? 0 : Math.max(1, ttl.toMillis());
        Long replaced = call(Command.REPLACE_IF_VALUE, key, () -> redisTemplate.execute(
            REPLACE_IF_VALUE,
            Collections.singletonList(key),
            encodedExpected,
            encodedValue,
            String.valueOf(ttlMillis)));
        return replaced != null && replaced > 0;
    }

    @Override
    public Stream<String> scan(String pattern) {
        ScanOptions options = ScanOptions.scanOptions()
            .match(pattern)
            .count(CacheConstants.SCAN_BATCH)
            .build();
        Cursor<String> cursor = call(Command.SCAN, pattern, () -> redisTemplate.scan(options));
        // 游标翻页时才会访问 Redis，每次翻页同样需要转换异常
        Iterator<String> keys = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return call(Command.SCAN, pattern, cursor::hasNext);
            }

            @Override
            public String next() {
                return call(Command.SCAN, pattern, cursor::next);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(keys, Spliterator.ORDERED), false)
            .onClose(() -> call(Command.SCAN, pattern, () -> {
                cursor.close();
                return null;
            }));
    }

    @Override
    public boolean exists(String key) {
        return call(Command.EXISTS, key, () -> Boolean.TRUE.equals(redisTemplate.hasKey(key)));
    }

    @Override
    public long getKeysCount() {
        Long size = call(Command.GET_KEYS_COUNT, "", () ->
            redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize()));
        return size == null ? 0 : size;
    }

    @Override
    public String ping(String message) {
        return call(Command.PING, "", () -> redisTemplate.execute((RedisCallback<String>) connection -> {
            if (message == null || "PING".equalsIgnoreCase(message)) {
                return connection.ping();
            }
            byte[] echo = connection.echo(bytes(message));
            return echo == null ? null : new String(echo, StandardCharsets.UTF_8);
        }));
    }

    @Override
    public void clear() {
        call(Command.CLEAR, "", () -> redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        }));
        log.info("Redis backend cleared: name={}", name);
    }

    @Override
    public boolean[] getBits(String key, long... offsets) {
        List<Object> raw = call(Command.GET_BITS, key, () ->
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                byte[] rawKey = bytes(key);
                for (long offset : offsets) {
                    connection.stringCommands().getBit(rawKey, offset);
                }
                return null;
            }));
        boolean[] result = new boolean[offsets.length];
        for (int i = 0; i < offsets.length && i < raw.size(); i++) {
            result[i] = Boolean.TRUE.equals(raw.get(i));
        }
        return result;
    }

    @Override
    public void setBits(String key, long... offsets) {
        call(Command.SET_BITS, key, () -> redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            byte[] rawKey = bytes(key);
            for (long offset : offsets) {
                connection.stringCommands().setBit(rawKey, offset, true);
            }
            return null;
        }));
    }

    @Override
    public void setAdd(String key, Duration ttl, Collection<String> members) {
        if (members.isEmpty()) {
            return;
        }
        call(Command.SET_ADD, key, () -> {
            redisTemplate.opsForSet().add(key, members.toArray(new String[0]));
            if (ttl != null) {
                redisTemplate.expire(key, ttl);
            }
            return null;
        });
    }

    @Override
    public void setRemove(String key, Collection<String> members) {
        if (members.isEmpty()) {
            return;
        }
        call(Command.SET_REMOVE, key, () -> redisTemplate.opsForSet().remove(key, members.toArray()));
    }

    @Override
    public Set<String> setPop(String key, int count) {
        List<String> popped = call(Command.SET_POP, key, () -> redisTemplate.opsForSet().pop(key, count));
        return popped == null ? Set.of() : new LinkedHashSet<>(popped);
    }

    @Override
    public void close() {
        // 连接工厂由宿主应用管理，这里只记录生命周期
        log.info("Redis backend closed: name={}", name);
    }

    private <T> T call(Command command, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("Redis {} failed, key: {}, error: {}", command.getCode(), key, e.getMessage());
            throw new BackendUnavailableException(name,
                "Redis " + command.getCode() + " failed for key: " + key, e);
        }
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
