package com.cacheshield.backend.intercept;

import com.cacheshield.backend.CacheBackend;
import com.cacheshield.backend.Command;
import com.cacheshield.backend.ExistCondition;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 在后端外包裹一条拦截器链
 *
 * <p>参数数组布局（与 {@link CacheBackend} 方法参数一一对应）：
 * <pre>
 * GET [key]                      GET_MANY [keys]
 * SET [key, value, ttl, exist]   SET_MANY [pairs, ttl]
 * INCR [key, delta, ttl]         EXPIRE [key, ttl]
 * DELETE_MANY [keys]             DELETE_MATCH / SCAN [pattern]
 * DELETE_IF_VALUE [key, value]   PING [message]
 * REPLACE_IF_VALUE [key, expected, value, ttl]
 * GET_BITS / SET_BITS [key, offsets]
 * SET_ADD [key, ttl, members]    SET_REMOVE [key, members]    SET_POP [key, count]
 * </pre>
 * 其余单 Key 命令为 [key]，GET_KEYS_COUNT、CLEAR 为空数组。
 */
public class InterceptingBackend implements CacheBackend {

    private static final Object[] NO_ARGS = new Object[0];

    private final CacheBackend target;
    private final CommandChain chain;

    public InterceptingBackend(CacheBackend target, List<CommandInterceptor> interceptors) {
        this.target = target;
        CommandChain current = new Terminal();
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            current = new Link(interceptors.get(i), current);
        }
        this.chain = current;
    }

    public CacheBackend target() {
        return target;
    }

    @Override
    public String name() {
        return target.name();
    }

    @Override
    public Object get(String key) {
        return chain.proceed(Command.GET, new Object[]{key});
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Object> getMany(List<String> keys) {
        return (List<Object>) chain.proceed(Command.GET_MANY, new Object[]{keys});
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, ExistCondition exist) {
        return (Boolean) chain.proceed(Command.SET, new Object[]{key, value, ttl, exist});
    }

    @Override
    public void setMany(Map<String, Object> pairs, Duration ttl) {
        chain.proceed(Command.SET_MANY, new Object[]{pairs, ttl});
    }

    @Override
    public long incr(String key, long delta, Duration ttl) {
        return (Long) chain.proceed(Command.INCR, new Object[]{key, delta, ttl});
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return (Boolean) chain.proceed(Command.EXPIRE, new Object[]{key, ttl});
    }

    @Override
    public long getExpire(String key) {
        return (Long) chain.proceed(Command.GET_EXPIRE, new Object[]{key});
    }

    @Override
    public boolean delete(String key) {
        return (Boolean) chain.proceed(Command.DELETE, new Object[]{key});
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        return (Long) chain.proceed(Command.DELETE_MANY, new Object[]{keys});
    }

    @Override
    public long deleteMatch(String pattern) {
        return (Long) chain.proceed(Command.DELETE_MATCH, new Object[]{pattern});
    }

    @Override
    public boolean deleteIfValue(String key, Object expected) {
        return (Boolean) chain.proceed(Command.DELETE_IF_VALUE, new Object[]{key, expected});
    }

    @Override
    public boolean replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        return (Boolean) chain.proceed(Command.REPLACE_IF_VALUE, new Object[]{key, expected, value, ttl});
    }

    @Override
    @SuppressWarnings("unchecked")
    public Stream<String> scan(String pattern) {
        return (Stream<String>) chain.proceed(Command.SCAN, new Object[]{pattern});
    }

    @Override
    public boolean exists(String key) {
        return (Boolean) chain.proceed(Command.EXISTS, new Object[]{key});
    }

    @Override
    public long getKeysCount() {
        return (Long) chain.proceed(Command.GET_KEYS_COUNT, NO_ARGS);
    }

    @Override
    public String ping(String message) {
        return (String) chain.proceed(Command.PING, new Object[]{message});
    }

    @Override
    public void clear() {
        chain.proceed(Command.CLEAR, NO_ARGS);
    }

    @Override
    public boolean[] getBits(String key, long... offsets) {
        return (boolean[]) chain.proceed(Command.GET_BITS, new Object[]{key, offsets});
    }

    @Override
    public void setBits(String key, long... offsets) {
        chain.proceed(Command.SET_BITS, new Object[]{key, offsets});
    }

    @Override
    public void setAdd(String key, Duration ttl, Collection<String> members) {
        chain.proceed(Command.SET_ADD, new Object[]{key, ttl, members});
    }

    @Override
    public void setRemove(String key, Collection<String> members) {
        chain.proceed(Command.SET_REMOVE, new Object[]{key, members});
    }

    @Override
    @SuppressWarnings("unchecked")
    public Set<String> setPop(String key, int count) {
        return (Set<String>) chain.proceed(Command.SET_POP, new Object[]{key, count});
    }

    @Override
    public void close() {
        target.close();
    }

    private final class Link implements CommandChain {

        private final CommandInterceptor interceptor;
        private final CommandChain next;

        Link(CommandInterceptor interceptor, CommandChain next) {
            this.interceptor = interceptor;
            this.next = next;
        }

        @Override
        public Object proceed(Command command, Object[] args) {
            return interceptor.intercept(command, args, next);
        }

        @Override
        public String backend() {
            return target.name();
        }
    }

    /**
     * 链尾：把命令分发到真实后端
     */
    private final class Terminal implements CommandChain {

        @Override
        @SuppressWarnings("unchecked")
        public Object proceed(Command command, Object[] args) {
            return switch (command) {
                case GET -> target.get((String) args[0]);
                case GET_MANY -> target.getMany((List<String>) args[0]);
                case SET -> target.set((String) args[0], args[1], (Duration) args[2], (ExistCondition) args[3]);
                case SET_MANY -> {
                    target.setMany((Map<String, Object>) args[0], (Duration) args[1]);
                    yield null;
                }
                case INCR -> target.incr((String) args[0], (Long) args[1], (Duration) args[2]);
                case EXPIRE -> target.expire((String) args[0], (Duration) args[1]);
                case GET_EXPIRE -> target.getExpire((String) args[0]);
                case DELETE -> target.delete((String) args[0]);
                case DELETE_MANY -> target.deleteMany((Collection<String>) args[0]);
                case DELETE_MATCH -> target.deleteMatch((String) args[0]);
                case DELETE_IF_VALUE -> target.deleteIfValue((String) args[0], args[1]);
                case REPLACE_IF_VALUE -> target.replaceIfValue((String) args[0], args[1], args[2], (Duration) args[3]);
                case SCAN -> target.scan((String) args[0]);
                case EXISTS -> target.exists((String) args[0]);
                case GET_KEYS_COUNT -> target.getKeysCount();
                case PING -> target.ping((String) args[0]);
                case CLEAR -> {
                    target.clear();
                    yield null;
                }
                case GET_BITS -> target.getBits((String) args[0], (long[]) args[1]);
                case SET_BITS -> {
                    target.setBits((String) args[0], (long[]) args[1]);
                    yield null;
                }
                case SET_ADD -> {
                    target.setAdd((String) args[0], (Duration) args[1], (Collection<String>) args[2]);
                    yield null;
                }
                case SET_REMOVE -> {
                    target.setRemove((String) args[0], (Collection<String>) args[1]);
                    yield null;
                }
                case SET_POP -> target.setPop((String) args[0], (Integer) args[1]);
            };
        }

        @Override
        public String backend() {
            return target.name();
        }
    }
}
