package com.cacheshield.tag;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.constant.CacheConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Tag 成员维护
 *
 * <p>每个 Tag 对应一个集合 Key {@code _tag:<tag>}，写入缓存时登记成员；
 * 删除 Tag 时分批弹出成员并删除对应的 Key，不需要扫描整个键空间。
 * 集合 Key 的过期时间不短于其中最长存活的成员，成员全部过期后集合随之过期。
 */
public class TagRegistry {

    private static final Logger log = LoggerFactory.getLogger(TagRegistry.class);

    private final CacheBackend backend;
    private final CacheBackend membership;

    /**
     * @param backend    删除成员 Key 使用的后端
     * @param membership 读写集合 Key 使用的后端，不参与事务回滚
     */
    public TagRegistry(CacheBackend backend, CacheBackend membership) {
        this.backend = backend;
        this.membership = membership;
    }

    public static String tagKey(String tag) {
        return CacheConstants.TAG_PREFIX + tag;
    }

    /**
     * 登记成员并把集合的过期时间延长到不短于成员的 ttl
     *
     * @param ttl 成员的过期时间，null 表示永不过期
     */
    public void register(String key, Collection<String> tags, Duration ttl) {
        for (String tag : tags) {
            String tagKey = tagKey(tag);
            long remaining = membership.getExpire(tagKey);
            membership.setAdd(tagKey, null, List.of(key));
            if (remaining == CacheConstants.UNLIMITED) {
                continue;
            }
            if (ttl == null) {
                membership.expire(tagKey, null);
            } else if (remaining == CacheConstants.NOT_EXIST || remaining < ttl.toMillis()) {
                membership.expire(tagKey, ttl);
            }
        }
    }

    public void unregister(String key, Collection<String> tags) {
        for (String tag : tags) {
            membership.setRemove(tagKey(tag), List.of(key));
        }
    }

    /**
     * 删除 Tag 下的所有 Key 并清空成员集合
     *
     * @return 删除的 Key 数量
     */
    public long deleteTag(String tag) {
        String tagKey = tagKey(tag);
        long deleted = 0;
        while (true) {
            Set<String> members = membership.setPop(tagKey, CacheConstants.TAG_POP_BATCH);
            if (members.isEmpty()) {
                break;
            }
            deleted += backend.deleteMany(members);
        }
        membership.delete(tagKey);
        log.info("Tag deleted: tag={}, keys={}", tag, deleted);
        return deleted;
    }
}
