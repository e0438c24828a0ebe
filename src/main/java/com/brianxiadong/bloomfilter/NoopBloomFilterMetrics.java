package com.brianxiadong.bloomfilter;

public class NoopBloomFilterMetrics implements BloomFilterMetrics {
    public static final NoopBloomFilterMetrics INSTANCE = new NoopBloomFilterMetrics();

    @Override
    public void recordAdd(long latencyNanos) {}

    @Override
    public void recordCheck(long latencyNanos, boolean positive) {}

    @Override
    public void recordCapacityExceeded() {}

    @Override
    public void bind(BloomFilter filter) {}
}
