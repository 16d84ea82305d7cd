package com.cacheshield.backend.intercept;

import com.cacheshield.backend.Command;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * 后端命令耗时指标
 * 指标名 cache.shield.command，标签：command / backend / outcome（hit、miss、success、error）
 */
public class MetricsInterceptor implements CommandInterceptor {

    public static final String METRIC_NAME = "cache.shield.command";

    private final MeterRegistry meterRegistry;

    public MetricsInterceptor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Object intercept(Command command, Object[] args, CommandChain next) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            Object result = next.proceed(command, args);
            outcome = outcomeOf(command, result);
            return result;
        } finally {
            sample.stop(Timer.builder(METRIC_NAME)
                .tag("command", command.getCode())
                .tag("backend", next.backend())
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }

    private static String outcomeOf(Command command, Object result) {
        if (command == Command.GET) {
            return result == null ? "miss" : "hit";
        }
        return "success";
    }
}
