package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.exception.LockTimeoutException;
import com.cacheshield.key.CallArgs;
import com.cacheshield.lock.LockHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 互斥执行策略单元测试
 */
class LockedStrategyTest {

    private Cache cache;
    private final CallArgs args = CallArgs.of("id", 1);

    @BeforeEach
    void setUp() {
        cache = Cache.builder().backend(new MemoryBackend()).build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("并发调用串行执行")
    void testSerializedExecution() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        LockedStrategy<Integer> job = cache.locked()
            .key("job:{id}")
            .waitTimeout(Duration.ofSeconds(5))
            .build(a -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return inFlight.decrementAndGet();
            });

        int callers = 10;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return job.apply(args);
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertEquals(0, result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
    }

    @Test
    @DisplayName("目标操作抛出异常时仍释放锁")
    void testReleaseOnException() {
        LockedStrategy<String> job = cache.locked()
            .key("job:{id}")
            .build(a -> {
                throw new IllegalStateException("failed");
            });

        assertThrows(IllegalStateException.class, () -> job.apply(args));
        assertFalse(cache.exists("lock:job:1"));
    }

    @Test
    @DisplayName("waitForLock=false - 锁被占用立即失败")
    void testNoWait() {
        LockedStrategy<String> job = cache.locked()
            .key("job:{id}")
            .waitForLock(false)
            .build(a -> "done");

        try (LockHandle ignored = cache.locks().acquire("lock:job:1", Duration.ofSeconds(10))) {
            assertThrows(LockTimeoutException.class, () -> job.apply(args));
        }
        assertEquals("done", job.apply(args));
    }
}
