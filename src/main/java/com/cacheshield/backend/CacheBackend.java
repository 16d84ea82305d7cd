package com.cacheshield.backend;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 存储后端契约
 *
 * <p>所有策略、锁、计数器、事务都只依赖本接口。实现类可以是进程内存储、网络存储或文件存储，
 * 任一方法在存储不可达时抛出 {@link com.cacheshield.exception.BackendUnavailableException}。
 *
 * <p>约定：
 * <ul>
 *   <li>ttl 为 {@code null} 表示不过期</li>
 *   <li>值不能为 {@code null}，读取返回 {@code null} 表示不存在</li>
 *   <li>已过期的条目永远不会被读到</li>
 * </ul>
 */
public interface CacheBackend extends AutoCloseable {

    /**
     * 后端名称（用于观测记录与日志）
     */
    String name();

    Object get(String key);

    /**
     * 批量读取，结果与 keys 顺序一致，不存在的位置为 {@code null}
     */
    List<Object> getMany(List<String> keys);

    /**
     * 条件写入
     *
     * @return 是否实际写入
     */
    boolean set(String key, Object value, Duration ttl, ExistCondition exist);

    default boolean set(String key, Object value, Duration ttl) {
        return set(key, value, ttl, ExistCondition.ANY);
    }

    default boolean set(String key, Object value) {
        return set(key, value, null, ExistCondition.ANY);
    }

    void setMany(Map<String, Object> pairs, Duration ttl);

    /**
     * 原子自增；仅当本次自增创建了该 Key 时设置 ttl，后续自增不改变过期时间
     *
     * @return 自增后的值
     */
    long incr(String key, long delta, Duration ttl);

    default long incr(String key) {
        return incr(key, 1, null);
    }

    /**
     * 重设过期时间，ttl 为 {@code null} 时移除过期时间
     *
     * @return Key 是否存在
     */
    boolean expire(String key, Duration ttl);

    /**
     * 剩余过期时间（毫秒）
     *
     * @return {@link com.cacheshield.constant.CacheConstants#NOT_EXIST} 表示不存在，
     *         {@link com.cacheshield.constant.CacheConstants#UNLIMITED} 表示永不过期
     */
    long getExpire(String key);

    boolean delete(String key);

    long deleteMany(Collection<String> keys);

    long deleteMatch(String pattern);

    /**
     * 仅当当前值等于 expected 时删除（锁释放使用）
     */
    boolean deleteIfValue(String key, Object expected);

    /**
     * 仅当当前值等于 expected 时替换为 value 并重设过期时间（事务回滚使用）
     *
     * @return 是否实际写入
     */
    boolean replaceIfValue(String key, Object expected, Object value, Duration ttl);

    /**
     * 按通配符扫描 Key；返回的流是惰性、有限的，可以重复调用重新扫描。
     * 调用方负责关闭流。
     */
    Stream<String> scan(String pattern);

    boolean exists(String key);

    long getKeysCount();

    String ping(String message);

    void clear();

    // ==================== 位图（布隆过滤器） ====================

    boolean[] getBits(String key, long... offsets);

    void setBits(String key, long... offsets);

    // ==================== 集合（Tag 成员） ====================

    void setAdd(String key, Duration ttl, Collection<String> members);

    void setRemove(String key, Collection<String> members);

    /**
     * 随机弹出最多 count 个成员
     */
    Set<String> setPop(String key, int count);

    @Override
    void close();
}
