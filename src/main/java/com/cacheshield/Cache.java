package com.cacheshield;

import com.cacheshield.backend.AsyncCacheBackend;
import com.cacheshield.backend.CacheBackend;
import com.cacheshield.backend.Command;
import com.cacheshield.backend.ExistCondition;
import com.cacheshield.backend.MemoryBackend;
import com.cacheshield.backend.RoutingBackend;
import com.cacheshield.backend.intercept.CommandInterceptor;
import com.cacheshield.backend.intercept.DisableControlInterceptor;
import com.cacheshield.backend.intercept.InterceptingBackend;
import com.cacheshield.backend.intercept.MetricsInterceptor;
import com.cacheshield.backend.intercept.SafeModeInterceptor;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.exception.BackendUnavailableException;
import com.cacheshield.lock.LockManager;
import com.cacheshield.strategy.BloomFilterStrategy;
import com.cacheshield.strategy.CircuitBreakerStrategy;
import com.cacheshield.strategy.EarlyStrategy;
import com.cacheshield.strategy.FailoverStrategy;
import com.cacheshield.strategy.HitStrategy;
import com.cacheshield.strategy.InvalidateStrategy;
import com.cacheshield.strategy.LockedStrategy;
import com.cacheshield.strategy.RateLimitStrategy;
import com.cacheshield.strategy.SimpleStrategy;
import com.cacheshield.strategy.SliceRateLimitStrategy;
import com.cacheshield.strategy.SoftStrategy;
import com.cacheshield.tag.TagRegistry;
import com.cacheshield.transaction.Transaction;
import com.cacheshield.transaction.TransactionCallback;
import com.cacheshield.transaction.TransactionManager;
import com.cacheshield.transaction.TransactionMode;
import com.cacheshield.transaction.TransactionalBackend;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * 缓存实例
 *
 * <p>由宿主应用创建并持有，注入到各个策略中。每个注册的后端按以下顺序包装：
 * 原始后端 -> 拦截器链（禁用控制、安全模式、指标、自定义拦截器）-> 事务视图，
 * 再按 Key 前缀路由。策略使用的锁走拦截器链但不进入事务日志；
 * 事务的前镜像、回滚写入和行级锁直接访问原始后端。
 *
 * <pre>{@code
 * Cache cache = Cache.builder().backend(new MemoryBackend()).build();
 * CachedOperation<User> loader = cache.early()
 *     .key("user:{id}").ttl("10m").earlyTtl("7m")
 *     .build(args -> userRepository.load((Long) args.get("id")));
 * }</pre>
 */
public class Cache implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(Cache.class);

    private final String name;
    private final RoutingBackend routing;
    private final List<CacheBackend> rawBackends;
    private final LockManager locks;
    private final TagRegistry tags;
    private final TransactionManager transactions;
    private final DisableControlInterceptor disableControl;
    private final ExecutorService executor;
    private final Clock clock;
    private final List<Class<? extends Throwable>> defaultFailoverExceptions;

    private Cache(Builder builder) {
        this.name = builder.name;
        this.clock = builder.clock;
        this.disableControl = new DisableControlInterceptor();
        this.defaultFailoverExceptions = List.copyOf(builder.failoverExceptions);
        this.executor = builder.executor != null ? builder.executor : newRefreshExecutor(builder.refreshThreads);

        Map<String, CacheBackend> backends = new LinkedHashMap<>(builder.backends);
        if (!backends.containsKey("")) {
            backends.put("", new MemoryBackend("memory", CacheConstants.DEFAULT_MEMORY_MAX_SIZE, clock));
        }
        List<CommandInterceptor> interceptors = new ArrayList<>();
        interceptors.add(disableControl);
        if (builder.safeMode) {
            interceptors.add(new SafeModeInterceptor());
        }
        if (builder.meterRegistry != null) {
            interceptors.add(new MetricsInterceptor(builder.meterRegistry));
        }
        interceptors.addAll(builder.interceptors);

        this.transactions = new TransactionManager(backends.get(""), builder.transactionMode,
            builder.transactionTimeout, builder.lockBackoff, clock);

        // 同一个原始后端注册在多个前缀下时共用一套包装
        Map<CacheBackend, InterceptingBackend> intercepted = new LinkedHashMap<>();
        Map<CacheBackend, CacheBackend> transactional = new LinkedHashMap<>();
        Map<String, CacheBackend> directRoutes = new LinkedHashMap<>();
        Map<String, CacheBackend> dataRoutes = new LinkedHashMap<>();
        backends.forEach((prefix, raw) -> {
            InterceptingBackend chain = intercepted.computeIfAbsent(raw,
                b -> new InterceptingBackend(b, interceptors));
            directRoutes.put(prefix, chain);
            dataRoutes.put(prefix, transactional.computeIfAbsent(raw,
                b -> new TransactionalBackend(chain, b, transactions)));
        });
        this.rawBackends = List.copyOf(intercepted.keySet());
        this.routing = new RoutingBackend(name, dataRoutes);
        // 锁与 Tag 成员集合不记录事务前镜像
        RoutingBackend direct = new RoutingBackend(name + "-direct", directRoutes);
        this.locks = new LockManager(direct, builder.lockWait, builder.lockBackoff);
        this.tags = new TagRegistry(routing, direct);
        log.info("Cache initialized: name={}, backends={}, safeMode={}", name, backends.keySet(), builder.safeMode);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== 策略工厂 ====================

    public SimpleStrategy.Builder simple() {
        return new SimpleStrategy.Builder(this);
    }

    public FailoverStrategy.Builder failover() {
        return new FailoverStrategy.Builder(this);
    }

    public HitStrategy.Builder hit() {
        return new HitStrategy.Builder(this);
    }

    public EarlyStrategy.Builder early() {
        return new EarlyStrategy.Builder(this);
    }

    public SoftStrategy.Builder soft() {
        return new SoftStrategy.Builder(this);
    }

    public LockedStrategy.Builder locked() {
        return new LockedStrategy.Builder(this);
    }

    public RateLimitStrategy.Builder rateLimit() {
        return new RateLimitStrategy.Builder(this);
    }

    public SliceRateLimitStrategy.Builder sliceRateLimit() {
        return new SliceRateLimitStrategy.Builder(this);
    }

    public CircuitBreakerStrategy.Builder circuitBreaker() {
        return new CircuitBreakerStrategy.Builder(this);
    }

    public BloomFilterStrategy.Builder bloom() {
        return new BloomFilterStrategy.Builder(this);
    }

    public InvalidateStrategy.Builder invalidate() {
        return new InvalidateStrategy.Builder(this);
    }

    // ==================== 组件 ====================

    public LockManager locks() {
        return locks;
    }

    public TagRegistry tags() {
        return tags;
    }

    public TransactionManager transactions() {
        return transactions;
    }

    public ExecutorService executor() {
        return executor;
    }

    public Clock clock() {
        return clock;
    }

    public List<Class<? extends Throwable>> defaultFailoverExceptions() {
        return defaultFailoverExceptions;
    }

    /**
     * Key 所路由到的后端名称
     */
    public String backendName(String key) {
        return routing.route(key).name();
    }

    public AsyncCacheBackend async() {
        return new AsyncCacheBackend(this, executor);
    }

    // ==================== 事务 ====================

    public <T> T transaction(TransactionCallback<T> callback) {
        return transactions.execute(callback);
    }

    public <T> T transaction(TransactionMode mode, TransactionCallback<T> callback) {
        return transactions.execute(mode, callback);
    }

    /**
     * 手动开启事务，调用方负责 commit 或 rollback
     */
    public Transaction beginTransaction(TransactionMode mode) {
        return transactions.begin(mode);
    }

    // ==================== 禁用控制 ====================

    /**
     * 在当前线程禁用给定命令（未指定时禁用全部），关闭返回的作用域后恢复
     */
    public DisableControlInterceptor.Scope disabling(Command... commands) {
        return disableControl.disable(commands);
    }

    public void disable(Command... commands) {
        disableControl.disableGlobally(commands);
        log.info("Cache commands disabled: {}", commands.length == 0 ? "ALL" : List.of(commands));
    }

    public void enable(Command... commands) {
        disableControl.enableGlobally(commands);
        log.info("Cache commands enabled: {}", commands.length == 0 ? "ALL" : List.of(commands));
    }

    public boolean isDisabled(Command command) {
        return disableControl.isDisabled(command);
    }

    // ==================== Tag ====================

    public long deleteTags(String... tagNames) {
        long deleted = 0;
        for (String tag : tagNames) {
            deleted += tags.deleteTag(tag);
        }
        return deleted;
    }

    // ==================== 后端契约 ====================

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object get(String key) {
        return routing.get(key);
    }

    @Override
    public List<Object> getMany(List<String> keys) {
        return routing.getMany(keys);
    }

    @Override
    public boolean set(String key, Object value, Duration ttl, ExistCondition exist) {
        return routing.set(key, value, ttl, exist);
    }

    @Override
    public void setMany(Map<String, Object> pairs, Duration ttl) {
        routing.setMany(pairs, ttl);
    }

    @Override
    public long incr(String key, long delta, Duration ttl) {
        return routing.incr(key, delta, ttl);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return routing.expire(key, ttl);
    }

    @Override
    public long getExpire(String key) {
        return routing.getExpire(key);
    }

    @Override
    public boolean delete(String key) {
        return routing.delete(key);
    }

    @Override
    public long deleteMany(Collection<String> keys) {
        return routing.deleteMany(keys);
    }

    @Override
    public long deleteMatch(String pattern) {
        return routing.deleteMatch(pattern);
    }

    @Override
    public boolean deleteIfValue(String key, Object expected) {
        return routing.deleteIfValue(key, expected);
    }

    @Override
    public boolean replaceIfValue(String key, Object expected, Object value, Duration ttl) {
        return routing.replaceIfValue(key, expected, value, ttl);
    }

    @Override
    public Stream<String> scan(String pattern) {
        return routing.scan(pattern);
    }

    @Override
    public boolean exists(String key) {
        return routing.exists(key);
    }

    @Override
    public long getKeysCount() {
        return routing.getKeysCount();
    }

    @Override
    public String ping(String message) {
        return routing.ping(message);
    }

    @Override
    public void clear() {
        routing.clear();
    }

    @Override
    public boolean[] getBits(String key, long... offsets) {
        return routing.getBits(key, offsets);
    }

    @Override
    public void setBits(String key, long... offsets) {
        routing.setBits(key, offsets);
    }

    @Override
    public void setAdd(String key, Duration ttl, Collection<String> members) {
        routing.setAdd(key, ttl, members);
    }

    @Override
    public void setRemove(String key, Collection<String> members) {
        routing.setRemove(key, members);
    }

    @Override
    public Set<String> setPop(String key, int count) {
        return routing.setPop(key, count);
    }

    /**
     * 停止后台刷新线程并关闭所有后端
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (CacheBackend backend : rawBackends) {
            try {
                backend.close();
            } catch (RuntimeException e) {
                log.error("Failed to close backend: {}", backend.name(), e);
            }
        }
        log.info("Cache closed: name={}", name);
    }

    private static ExecutorService newRefreshExecutor(int threads) {
        AtomicInteger index = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "cache-shield-refresh-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static class Builder {

        private String name = "cache-shield";
        private final Map<String, CacheBackend> backends = new LinkedHashMap<>();
        private final List<CommandInterceptor> interceptors = new ArrayList<>();
        private final List<Class<? extends Throwable>> failoverExceptions = new ArrayList<>(
            List.of(BackendUnavailableException.class));
        private boolean safeMode;
        private MeterRegistry meterRegistry;
        private Clock clock = Clock.systemUTC();
        private ExecutorService executor;
        private int refreshThreads = CacheConstants.DEFAULT_REFRESH_THREADS;
        private Duration lockWait = Duration.ofMillis(CacheConstants.LOCK_WAIT_TIME_MS);
        private IntervalFunction lockBackoff = IntervalFunction.ofExponentialBackoff(
            CacheConstants.LOCK_POLL_INITIAL_MS,
            CacheConstants.LOCK_POLL_MULTIPLIER,
            CacheConstants.LOCK_POLL_MAX_MS);
        private TransactionMode transactionMode = TransactionMode.LOCKED;
        private Duration transactionTimeout = Duration.ofSeconds(CacheConstants.TX_TIMEOUT_SECONDS);

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * 默认后端（前缀为空串）
         */
        public Builder backend(CacheBackend backend) {
            return backend("", backend);
        }

        public Builder backend(String prefix, CacheBackend backend) {
            this.backends.put(prefix, backend);
            return this;
        }

        /**
         * 安全模式：普通读写删除的后端故障被吞掉并返回缺省结果
         */
        public Builder safeMode(boolean safeMode) {
            this.safeMode = safeMode;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder interceptor(CommandInterceptor interceptor) {
            this.interceptors.add(interceptor);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * 后台刷新线程池，由调用方提供时 close 也会将其关闭
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder refreshThreads(int refreshThreads) {
            this.refreshThreads = refreshThreads;
            return this;
        }

        public Builder lockWait(Duration lockWait) {
            this.lockWait = lockWait;
            return this;
        }

        public Builder lockBackoff(IntervalFunction lockBackoff) {
            this.lockBackoff = lockBackoff;
            return this;
        }

        public Builder transactionMode(TransactionMode transactionMode) {
            this.transactionMode = transactionMode;
            return this;
        }

        public Builder transactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
            return this;
        }

        /**
         * 替换默认的故障转移异常集合
         */
        @SafeVarargs
        public final Builder failoverExceptions(Class<? extends Throwable>... exceptions) {
            this.failoverExceptions.clear();
            this.failoverExceptions.addAll(List.of(exceptions));
            return this;
        }

        public Cache build() {
            return new Cache(this);
        }
    }
}
