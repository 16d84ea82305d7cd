package com.cacheshield.transaction;

import com.cacheshield.Cache;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 缓存事务单元测试
 */
class TransactionManagerTest {

    private MutableClock clock;
    private Cache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = Cache.builder()
            .clock(clock)
            .backend(new MemoryBackend("memory", 1000, clock))
            .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("正常返回时提交")
    void testCommit() {
        String result = cache.transaction(tx -> {
            cache.set("stock:1", 10L);
            cache.incr("stock:1", -1, null);
            return "done";
        });

        assertEquals("done", result);
        assertEquals(9L, cache.get("stock:1"));
        assertNull(cache.transactions().current());
    }

    @Test
    @DisplayName("异常时回滚：恢复原值与剩余过期时间，删除新建的 Key")
    void testRollbackRestoresPreImage() {
        cache.set("price:1", "100", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(20));

        assertThrows(IllegalStateException.class, () -> cache.transaction(tx -> {
            cache.set("price:1", "80", Duration.ofMinutes(10));
            cache.set("price:1", "70", Duration.ofMinutes(10));
            cache.set("price:2", "50");
            cache.delete("missing");
            throw new IllegalStateException("payment failed");
        }));

        assertEquals("100", cache.get("price:1"));
        assertEquals(40_000, cache.getExpire("price:1"));
        assertNull(cache.get("price:2"));
        assertNull(cache.transactions().current());
    }

    @Test
    @DisplayName("回滚按事务期间流逝的时间扣减剩余过期时间")
    void testRollbackDeductsElapsedTime() {
        cache.set("price:1", "100", Duration.ofSeconds(60));

        assertThrows(IllegalStateException.class, () -> cache.transaction(TransactionMode.LOCKED, tx -> {
            cache.set("price:1", "80", Duration.ofMinutes(10));
            clock.advance(Duration.ofSeconds(50));
            throw new IllegalStateException("payment failed");
        }));

        assertEquals("100", cache.get("price:1"));
        assertEquals(10_000, cache.getExpire("price:1"));
        clock.advance(Duration.ofSeconds(20));
        assertNull(cache.get("price:1"));
    }

    @Test
    @DisplayName("事务期间原值已到期时回滚删除该 Key")
    void testRollbackDropsExpiredPreImage() {
        cache.set("price:1", "100", Duration.ofSeconds(30));

        assertThrows(IllegalStateException.class, () -> cache.transaction(tx -> {
            cache.set("price:1", "80", Duration.ofMinutes(10));
            clock.advance(Duration.ofSeconds(45));
            throw new IllegalStateException("payment failed");
        }));

        assertNull(cache.get("price:1"));
        assertEquals(CacheConstants.NOT_EXIST, cache.getExpire("price:1"));
    }

    @Test
    @DisplayName("FAST 回滚不覆盖事务外写入方的修改")
    void testFastRollbackKeepsConcurrentWrite() throws Exception {
        cache.set("stock:1", "origin");
        cache.set("stock:2", "origin");

        Transaction tx = cache.beginTransaction(TransactionMode.FAST);
        cache.set("stock:1", "mine");
        cache.delete("stock:2");
        cache.set("stock:3", "mine");
        CompletableFuture.runAsync(() -> {
            cache.set("stock:1", "other");
            cache.set("stock:2", "other");
            cache.set("stock:3", "other");
        }).get(5, TimeUnit.SECONDS);
        tx.rollback();

        assertEquals("other", cache.get("stock:1"));
        assertEquals("other", cache.get("stock:2"));
        assertEquals("other", cache.get("stock:3"));
    }

    @Test
    @DisplayName("FAST 回滚在无并发写入时恢复原值")
    void testFastRollbackRestoresUntouchedKeys() {
        cache.set("stock:1", "origin", Duration.ofSeconds(60));
        cache.set("stock:2", "origin");

        Transaction tx = cache.beginTransaction(TransactionMode.FAST);
        cache.set("stock:1", "first");
        cache.set("stock:1", "mine");
        cache.delete("stock:2");
        cache.set("stock:3", "mine");
        clock.advance(Duration.ofSeconds(15));
        tx.rollback();

        assertEquals("origin", cache.get("stock:1"));
        assertEquals(45_000, cache.getExpire("stock:1"));
        assertEquals("origin", cache.get("stock:2"));
        assertNull(cache.get("stock:3"));
    }

    @Test
    @DisplayName("回滚恢复被删除的 Key")
    void testRollbackRestoresDeleted() {
        cache.set("cart:1", "items");

        Transaction tx = cache.beginTransaction(TransactionMode.FAST);
        cache.delete("cart:1");
        assertNull(cache.get("cart:1"));
        assertEquals(List.of("cart:1"), tx.touchedKeys());
        tx.rollback();

        assertEquals("items", cache.get("cart:1"));
        assertEquals(CacheConstants.UNLIMITED, cache.getExpire("cart:1"));
        assertFalse(tx.isActive());
        assertThrows(IllegalStateException.class, tx::commit);
    }

    @Test
    @DisplayName("嵌套作用域加入外层事务，外层回滚撤销内层修改")
    void testNestedJoinsOuter() {
        assertThrows(IllegalArgumentException.class, () -> cache.transaction(outer -> {
            cache.set("a", "1");
            String inner = cache.transaction(tx -> {
                assertSame(outer, tx);
                cache.set("b", "2");
                return "inner";
            });
            assertEquals("inner", inner);
            throw new IllegalArgumentException("abort");
        }));

        assertNull(cache.get("a"));
        assertNull(cache.get("b"));
    }

    @Test
    @DisplayName("setRollbackOnly 后正常返回也回滚")
    void testRollbackOnly() {
        String result = cache.transaction(tx -> {
            cache.set("a", "1");
            tx.setRollbackOnly();
            return "dry-run";
        });

        assertEquals("dry-run", result);
        assertNull(cache.get("a"));
    }

    @Test
    @DisplayName("同一线程不能重复开启事务")
    void testBeginTwice() {
        Transaction tx = cache.beginTransaction(TransactionMode.FAST);
        assertThrows(IllegalStateException.class, () -> cache.beginTransaction(TransactionMode.FAST));
        tx.commit();
    }

    @Test
    @DisplayName("LOCKED 模式下修改同一 Key 的事务串行执行")
    void testLockedSerializesWriters() throws Exception {
        CountDownLatch firstWrote = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        CompletableFuture<Void> first = CompletableFuture.runAsync(() -> cache.transaction(TransactionMode.LOCKED, tx -> {
            cache.set("order:1", "first");
            firstWrote.countDown();
            await(releaseFirst);
            return null;
        }));
        assertTrue(firstWrote.await(5, TimeUnit.SECONDS));

        CompletableFuture<String> second = CompletableFuture.supplyAsync(() -> cache.transaction(TransactionMode.LOCKED, tx -> {
            cache.set("order:1", "second");
            return "second";
        }));
        Thread.sleep(100);
        assertFalse(second.isDone());
        assertEquals("first", cache.get("order:1"));

        releaseFirst.countDown();
        first.get(5, TimeUnit.SECONDS);
        assertEquals("second", second.get(5, TimeUnit.SECONDS));
        assertEquals("second", cache.get("order:1"));
    }

    @Test
    @DisplayName("SERIALIZABLE 模式持有全局锁")
    void testSerializableHoldsGlobalLock() {
        cache.transaction(TransactionMode.SERIALIZABLE, tx -> {
            assertTrue(cache.exists(CacheConstants.TX_GLOBAL_LOCK_KEY));
            cache.set("a", "1");
            return null;
        });

        assertFalse(cache.exists(CacheConstants.TX_GLOBAL_LOCK_KEY));
        assertEquals("1", cache.get("a"));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
