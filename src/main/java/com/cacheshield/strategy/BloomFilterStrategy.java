package com.cacheshield.strategy;

import com.cacheshield.Cache;
import com.cacheshield.constant.CacheConstants;
import com.cacheshield.key.CallArgs;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * 布隆过滤器
 *
 * <p>位数组保存在后端（{@code <prefix>:<name>:<m>}），多个实例共享同一个过滤器。
 * 成员检查先读 k 个位：任一位未置位说明一定不存在，直接返回 false；全部置位时
 * 开启 checkFalsePositive 则调用真实检查，否则返回 true。不会漏报，误判率受参数约束。
 * k 个位置由 murmur3_128 的两个 64 位半值做双重哈希得到。
 */
public class BloomFilterStrategy extends AbstractStrategy<Boolean> {

    private static final Logger log = LoggerFactory.getLogger(BloomFilterStrategy.class);

    private static final HashFunction MURMUR = Hashing.murmur3_128();

    private final BloomParameters parameters;
    private final boolean checkFalsePositive;
    private final String filterKey;

    BloomFilterStrategy(Cache cache, CachedOperation<Boolean> operation, StrategySettings settings,
                        BloomParameters parameters, boolean checkFalsePositive, String filterKey) {
        super(cache, operation, settings, "bloom");
        this.parameters = parameters;
        this.checkFalsePositive = checkFalsePositive;
        this.filterKey = filterKey;
    }

    @Override
    public Boolean apply(CallArgs args) {
        String item = key(args);
        boolean[] bits = cache.getBits(filterKey, offsets(item));
        for (boolean bit : bits) {
            if (!bit) {
                log.debug("Bloom filter definite miss, item: {}", item);
                return false;
            }
        }
        observe(filterKey, null, null);
        if (checkFalsePositive) {
            return operation.apply(args);
        }
        return true;
    }

    /**
     * 登记元素：置位 k 个位
     */
    public void set(CallArgs args) {
        cache.setBits(filterKey, offsets(key(args)));
    }

    public BloomParameters getParameters() {
        return parameters;
    }

    public String getFilterKey() {
        return filterKey;
    }

    long[] offsets(String item) {
        HashCode hash = MURMUR.hashString(item, StandardCharsets.UTF_8);
        ByteBuffer buffer = ByteBuffer.wrap(hash.asBytes()).order(ByteOrder.LITTLE_ENDIAN);
        long h1 = buffer.getLong();
        long h2 = buffer.getLong();
        long[] offsets = new long[parameters.hashes()];
        long combined = h1;
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] = (combined & Long.MAX_VALUE) % parameters.bits();
            combined += h2;
        }
        return offsets;
    }

    public static class Builder extends StrategyBuilder<Builder> {

        private BloomParameters parameters;
        private boolean checkFalsePositive = true;
        private String filterName;

        public Builder(Cache cache) {
            super(cache, CacheConstants.PREFIX_BLOOM);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Builder name(String name) {
            this.filterName = name;
            return super.name(name);
        }

        public Builder capacity(long capacity, double falsePositiveRate) {
            this.parameters = BloomParameters.forCapacity(capacity, falsePositiveRate);
            return this;
        }

        public Builder parameters(BloomParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        /**
         * 全部位已置位时是否调用真实检查排除误判
         */
        public Builder checkFalsePositive(boolean checkFalsePositive) {
            this.checkFalsePositive = checkFalsePositive;
            return this;
        }

        public BloomFilterStrategy build(CachedOperation<Boolean> operation) {
            if (filterName == null) {
                throw new IllegalStateException("Bloom filter requires a name");
            }
            if (parameters == null) {
                throw new IllegalStateException("Bloom filter requires capacity or parameters");
            }
            String filterKey = (prefix() == null || prefix().isEmpty() ? "" : prefix() + ":")
                + filterName + ":" + parameters.bits();
            return new BloomFilterStrategy(cache, operation, settings(), parameters, checkFalsePositive, filterKey);
        }
    }
}
