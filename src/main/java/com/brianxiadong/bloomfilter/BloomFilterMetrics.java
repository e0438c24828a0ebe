package com.brianxiadong.bloomfilter;

public interface BloomFilterMetrics {
    void recordAdd(long latencyNanos);
    void recordCheck(long latencyNanos, boolean positive);
    void recordCapacityExceeded();

    /**
     * 由 BloomFilter 构造函数在最后一步调用，此时所有字段均已赋值。
     * 实现只登记惰性读取的指标（如 Gauge），不要在 bind 内修改过滤器。
     */
    void bind(BloomFilter filter);
}
