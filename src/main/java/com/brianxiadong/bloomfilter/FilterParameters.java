package com.brianxiadong.bloomfilter;

/**
 * 布隆过滤器尺寸参数
 * 根据期望容量和目标误判率计算位数组长度和哈希函数个数
 */
public final class FilterParameters {
    /** 哈希函数个数的搜索上限 */
    public static final int MAX_HASH_FUNCS = 100;

    private final int filterLength;
    private final int numHashFuncs;

    private FilterParameters(int filterLength, int numHashFuncs) {
        this.filterLength = filterLength;
        this.numHashFuncs = numHashFuncs;
    }

    /**
     * 计算最优参数
     * 对 k = 1..100 逐个计算 m(k) = -k * n / ln(1 - p^(1/k))，取最小的 m 及对应的 k
     *
     * @param numKeys   期望插入的键数量，必须大于0
     * @param errorRate 目标误判率，必须在 (0, 1) 之间
     * @return 位数组长度 floor(min_m) + 1 以及对应的哈希函数个数
     * @throws InvalidParametersException 参数非法或在搜索范围内找不到可行解
     */
    public static FilterParameters calculate(int numKeys, double errorRate) {
        if (numKeys <= 0) {
            throw new InvalidParametersException("capacity must be > 0, got " + numKeys);
        }
        if (Double.isNaN(errorRate) || errorRate <= 0 || errorRate >= 1) {
            throw new InvalidParametersException("errorRate must be between 0 and 1, got " + errorRate);
        }

        double lowestM = Double.NaN;
        int bestK = 0;
        for (int k = 1; k <= MAX_HASH_FUNCS; k++) {
            // log1p 避免极小误判率时 1 - p^(1/k) 被舍入为 1.0
            double m = (-k * (double) numKeys) / Math.log1p(-Math.pow(errorRate, 1.0 / k));
            if (Double.isInfinite(m) || Double.isNaN(m) || m <= 0) {
                continue;
            }
            if (bestK == 0 || m < lowestM) {
                lowestM = m;
                bestK = k;
            }
        }

        if (bestK == 0) {
            throw new InvalidParametersException(String.format(
                    "no feasible filter size for capacity=%d, errorRate=%s", numKeys, errorRate));
        }
        if (bestK == MAX_HASH_FUNCS) {
            throw new InvalidParametersException(String.format(
                    "errorRate=%s needs more than %d hash functions", errorRate, MAX_HASH_FUNCS));
        }
        double length = Math.floor(lowestM) + 1;
        if (length > Integer.MAX_VALUE) {
            throw new InvalidParametersException(String.format(
                    "filter length %.0f exceeds the maximum bit vector size %d", length, Integer.MAX_VALUE));
        }
        return new FilterParameters((int) length, bestK);
    }

    public int getFilterLength() {
        return filterLength;
    }

    public int getNumHashFuncs() {
        return numHashFuncs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterParameters)) return false;
        FilterParameters that = (FilterParameters) o;
        return filterLength == that.filterLength && numHashFuncs == that.numHashFuncs;
    }

    @Override
    public int hashCode() {
        return 31 * filterLength + numHashFuncs;
    }

    @Override
    public String toString() {
        return String.format("FilterParameters{filterLength=%d, numHashFuncs=%d}", filterLength, numHashFuncs);
    }
}
