package com.cacheshield.strategy;

/**
 * 布隆过滤器参数
 *
 * @param bits   位数组长度 m
 * @param hashes 哈希函数个数 k
 */
public record BloomParameters(long bits, int hashes) {

    public BloomParameters {
        if (bits <= 0 || hashes <= 0) {
            throw new IllegalArgumentException("Bloom filter bits and hashes must be positive");
        }
    }

    /**
     * 按容量 n 与目标误判率 p 计算最优参数：
     * m = ceil(-n * ln(p) / ln(2)^2)，k = round(m / n * ln(2))
     */
    public static BloomParameters forCapacity(long capacity, double falsePositiveRate) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (falsePositiveRate <= 0 || falsePositiveRate >= 1) {
            throw new IllegalArgumentException("falsePositiveRate must be between 0 and 1 (exclusive)");
        }
        double ln2 = Math.log(2);
        long bits = (long) Math.ceil(-capacity * Math.log(falsePositiveRate) / (ln2 * ln2));
        int hashes = (int) Math.max(1, Math.round((double) bits / capacity * ln2));
        return new BloomParameters(bits, hashes);
    }

    /**
     * 已插入 inserted 个元素时的估计误判率：(1 - e^(-k * n / m))^k
     */
    public double falsePositiveRate(long inserted) {
        return Math.pow(1 - Math.exp(-(double) hashes * inserted / bits), hashes);
    }
}
