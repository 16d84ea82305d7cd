package com.cacheshield.backend.intercept;

import com.cacheshield.backend.Command;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 命令禁用控制
 *
 * <p>支持两级：全局禁用（所有线程）与作用域禁用（当前线程，退出作用域后恢复）。
 * 被禁用的命令不访问后端，直接返回 {@link CommandDefaults} 中的默认结果。
 */
public class DisableControlInterceptor implements CommandInterceptor {

    private final ThreadLocal<Set<Command>> scoped = ThreadLocal.withInitial(() -> EnumSet.noneOf(Command.class));
    private volatile Set<Command> global = EnumSet.noneOf(Command.class);

    @Override
    public Object intercept(Command command, Object[] args, CommandChain next) {
        if (isDisabled(command)) {
            return CommandDefaults.absent(command, args);
        }
        return next.proceed(command, args);
    }

    public boolean isDisabled(Command command) {
        return global.contains(command) || scoped.get().contains(command);
    }

    /**
     * 在当前线程禁用给定命令，未指定命令时禁用全部
     */
    public Scope disable(Command... commands) {
        Set<Command> previous = EnumSet.copyOf(withEmpty(scoped.get()));
        Set<Command> current = EnumSet.copyOf(previous);
        current.addAll(toSet(commands));
        scoped.set(current);
        return () -> {
            if (previous.isEmpty()) {
                scoped.remove();
            } else {
                scoped.set(previous);
            }
        };
    }

    public synchronized void disableGlobally(Command... commands) {
        Set<Command> next = EnumSet.copyOf(withEmpty(global));
        next.addAll(toSet(commands));
        global = next;
    }

    public synchronized void enableGlobally(Command... commands) {
        Set<Command> next = EnumSet.copyOf(withEmpty(global));
        next.removeAll(toSet(commands));
        global = next;
    }

    private static Set<Command> toSet(Command... commands) {
        if (commands.length == 0) {
            return EnumSet.allOf(Command.class);
        }
        return EnumSet.copyOf(Arrays.asList(commands));
    }

    private static Set<Command> withEmpty(Set<Command> commands) {
        return commands.isEmpty() ? EnumSet.noneOf(Command.class) : commands;
    }

    /**
     * 禁用作用域，关闭时恢复进入前的状态
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }
}
