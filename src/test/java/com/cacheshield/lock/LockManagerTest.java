package com.cacheshield.lock;

import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.exception.LockLostException;
import com.cacheshield.exception.LockTimeoutException;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 分布式锁管理单元测试
 */
class LockManagerTest {

    private MemoryBackend backend;
    private LockManager lockManager;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend();
        lockManager = new LockManager(backend, Duration.ofSeconds(2), IntervalFunction.ofExponentialBackoff(5, 1.5, 50));
    }

    @Test
    @DisplayName("获取与释放")
    void testAcquireAndRelease() {
        LockHandle handle = lockManager.acquire("lock:spu", Duration.ofSeconds(10));

        assertEquals(handle.getToken(), backend.get("lock:spu"));
        assertTrue(lockManager.tryAcquire("lock:spu", Duration.ofSeconds(10)).isEmpty());

        handle.release();
        assertFalse(backend.exists("lock:spu"));
    }

    @Test
    @DisplayName("只有持有者的令牌能释放锁")
    void testReleaseRequiresToken() {
        LockHandle handle = lockManager.acquire("lock:spu", Duration.ofSeconds(10));

        assertFalse(lockManager.release("lock:spu", "someone-else"));
        assertTrue(backend.exists("lock:spu"));
        assertTrue(lockManager.release("lock:spu", handle.getToken()));
    }

    @Test
    @DisplayName("锁被他人重新获取后释放抛出 LockLostException")
    void testLockLost() {
        LockHandle handle = lockManager.acquire("lock:spu", Duration.ofSeconds(10));
        backend.delete("lock:spu");
        Optional<LockHandle> other = lockManager.tryAcquire("lock:spu", Duration.ofSeconds(10));

        assertTrue(other.isPresent());
        assertThrows(LockLostException.class, handle::release);
        assertTrue(backend.exists("lock:spu"));
    }

    @Test
    @DisplayName("等待超时抛出 LockTimeoutException")
    void testAcquireTimeout() {
        lockManager.acquire("lock:spu", Duration.ofSeconds(10));

        assertThrows(LockTimeoutException.class,
            () -> lockManager.acquire("lock:spu", Duration.ofSeconds(10), Duration.ofMillis(100)));
    }

    @Test
    @DisplayName("等待期间锁释放后获取成功")
    void testAcquireAfterRelease() throws Exception {
        LockHandle first = lockManager.acquire("lock:spu", Duration.ofSeconds(10));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LockHandle> waiting = executor.submit(() -> lockManager.acquire("lock:spu", Duration.ofSeconds(10)));
            Thread.sleep(50);
            first.close();

            LockHandle second = waiting.get(2, TimeUnit.SECONDS);
            assertNotEquals(first.getToken(), second.getToken());
            second.close();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("并发互斥 - 任一时刻最多一个持有者")
    void testMutualExclusion() throws Exception {
        int threads = 8;
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try (LockHandle ignored = lockManager.acquire("lock:spu", Duration.ofSeconds(10))) {
                        maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                        Thread.sleep(5);
                        holders.decrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxHolders.get());
        assertFalse(backend.exists("lock:spu"));
    }

    @Test
    @DisplayName("等待解锁 - 超时后仍被锁定")
    void testIsLocked() {
        assertFalse(lockManager.isLocked("lock:spu", Duration.ofMillis(10)));

        lockManager.acquire("lock:spu", Duration.ofSeconds(10));
        assertTrue(lockManager.isLocked("lock:spu", Duration.ofMillis(30)));
    }
}
