package com.cacheshield.backend.intercept;

import com.cacheshield.backend.Command;
import com.cacheshield.backend.ExistCondition;
import com.cacheshield.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * 安全模式：后端不可达时返回默认结果而不是抛出异常
 *
 * <p>只作用于普通读写删除。条件写入（加锁）、比较删除（解锁）与自增（计数器）
 * 的失败会破坏锁和限流的正确性，始终向上传播。
 */
public class SafeModeInterceptor implements CommandInterceptor {

    private static final Logger log = LoggerFactory.getLogger(SafeModeInterceptor.class);

    private static final Set<Command> SUPPRESSIBLE = EnumSet.of(
        Command.GET, Command.GET_MANY, Command.GET_EXPIRE, Command.EXISTS, Command.SCAN,
        Command.GET_KEYS_COUNT, Command.GET_BITS, Command.PING,
        Command.SET, Command.SET_MANY, Command.EXPIRE,
        Command.DELETE, Command.DELETE_MANY, Command.DELETE_MATCH,
        Command.SET_ADD, Command.SET_REMOVE, Command.SET_POP);

    @Override
    public Object intercept(Command command, Object[] args, CommandChain next) {
        if (!isSuppressible(command, args)) {
            return next.proceed(command, args);
        }
        try {
            return next.proceed(command, args);
        } catch (BackendUnavailableException e) {
            log.warn("Backend {} unavailable, {} suppressed: {}", next.backend(), command.getCode(), e.getMessage());
            return CommandDefaults.absent(command, args);
        }
    }

    static boolean isSuppressible(Command command, Object[] args) {
        if (command == Command.SET) {
            return args[3] == ExistCondition.ANY;
        }
        return SUPPRESSIBLE.contains(command);
    }
}
