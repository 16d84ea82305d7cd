package com.cacheshield.backend.intercept;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.backend.Command;
import com.cacheshield.backend.ExistCondition;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.exception.BackendUnavailableException;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 拦截器链单元测试
 */
@ExtendWith(MockitoExtension.class)
class InterceptingBackendTest {

    @Mock
    private CacheBackend failing;

    private static BackendUnavailableException unavailable() {
        return new BackendUnavailableException("redis", "connection refused", null);
    }

    @Test
    @DisplayName("拦截器按注册顺序执行")
    void testInterceptorOrder() {
        List<String> calls = new ArrayList<>();
        CommandInterceptor first = (command, args, next) -> {
            calls.add("first:" + command.getCode());
            return next.proceed(command, args);
        };
        CommandInterceptor second = (command, args, next) -> {
            calls.add("second:" + command.getCode());
            return next.proceed(command, args);
        };
        InterceptingBackend backend = new InterceptingBackend(new MemoryBackend(), List.of(first, second));

        backend.set("k", "v", null);

        assertEquals(List.of("first:set", "second:set"), calls);
        assertEquals("v", backend.get("k"));
    }

    @Test
    @DisplayName("安全模式 - 读取故障返回缺省结果")
    void testSafeMode_suppressesReads() {
        when(failing.get("k")).thenThrow(unavailable());
        when(failing.name()).thenReturn("redis");
        InterceptingBackend backend = new InterceptingBackend(failing, List.of(new SafeModeInterceptor()));

        assertNull(backend.get("k"));
    }

    @Test
    @DisplayName("安全模式 - 条件写入与自增故障仍然抛出")
    void testSafeMode_neverSuppressesLocksAndCounters() {
        when(failing.set(eq("lock"), any(), any(), eq(ExistCondition.MUST_NOT_EXIST))).thenThrow(unavailable());
        when(failing.incr(eq("counter"), anyLong(), any())).thenThrow(unavailable());
        InterceptingBackend backend = new InterceptingBackend(failing, List.of(new SafeModeInterceptor()));

        assertThrows(BackendUnavailableException.class,
            () -> backend.set("lock", "token", Duration.ofSeconds(1), ExistCondition.MUST_NOT_EXIST));
        assertThrows(BackendUnavailableException.class,
            () -> backend.incr("counter", 1, Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("禁用控制 - 作用域内命令不访问后端")
    void testDisableControl_scoped() {
        DisableControlInterceptor disableControl = new DisableControlInterceptor();
        MemoryBackend memory = new MemoryBackend();
        InterceptingBackend backend = new InterceptingBackend(memory, List.of(disableControl));
        memory.set("k", "v", null);

        try (DisableControlInterceptor.Scope ignored = disableControl.disable(Command.GET)) {
            assertNull(backend.get("k"));
            assertTrue(backend.exists("k"));
        }

        assertEquals("v", backend.get("k"));
    }

    @Test
    @DisplayName("禁用控制 - 禁用写入时返回 false")
    void testDisableControl_setReturnsFalse() {
        DisableControlInterceptor disableControl = new DisableControlInterceptor();
        MemoryBackend memory = new MemoryBackend();
        InterceptingBackend backend = new InterceptingBackend(memory, List.of(disableControl));

        disableControl.disableGlobally(Command.SET);
        assertFalse(backend.set("k", "v", null));
        assertNull(memory.get("k"));

        disableControl.enableGlobally(Command.SET);
        assertTrue(backend.set("k", "v", null));
    }

    @Test
    @DisplayName("指标 - 按命令与结果记录耗时")
    void testMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        InterceptingBackend backend = new InterceptingBackend(new MemoryBackend(),
            List.of(new MetricsInterceptor(registry)));

        backend.get("missing");
        backend.set("k", "v", null);
        backend.get("k");

        Timer miss = registry.find(MetricsInterceptor.METRIC_NAME).tags("command", "get", "outcome", "miss").timer();
        Timer hit = registry.find(MetricsInterceptor.METRIC_NAME).tags("command", "get", "outcome", "hit").timer();
        assertNotNull(miss);
        assertNotNull(hit);
        assertEquals(1, hit.count());
        assertEquals("memory", hit.getId().getTag("backend"));
    }
}
