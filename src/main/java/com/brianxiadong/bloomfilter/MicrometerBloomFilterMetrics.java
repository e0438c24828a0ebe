package com.brianxiadong.bloomfilter;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class MicrometerBloomFilterMetrics implements BloomFilterMetrics {
    private static final AtomicLong INSTANCE_IDS = new AtomicLong();

    private final String name;
    private final MeterRegistry registry;
    private final Timer addTimer;
    private final Timer checkTimer;
    private final Counter positiveChecks;
    private final Counter negativeChecks;
    private final Counter capacityExceeded;
    private volatile String instance;

    public MicrometerBloomFilterMetrics(String name) {
        this(name, MetricsRegistry.get());
    }

    public MicrometerBloomFilterMetrics(String name, MeterRegistry registry) {
        this.name = name;
        this.registry = registry;
        this.addTimer = Timer.builder("bloom.add.latency").tag("name", name).register(registry);
        this.checkTimer = Timer.builder("bloom.check.latency").tag("name", name).register(registry);
        this.positiveChecks = Counter.builder("bloom.check.results").tag("name", name).tag("result", "positive")
                .register(registry);
        this.negativeChecks = Counter.builder("bloom.check.results").tag("name", name).tag("result", "negative")
                .register(registry);
        this.capacityExceeded = Counter.builder("bloom.capacity.exceeded").tag("name", name).register(registry);
    }

    @Override
    public void recordAdd(long latencyNanos) {
        addTimer.record(latencyNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordCheck(long latencyNanos, boolean positive) {
        checkTimer.record(latencyNanos, TimeUnit.NANOSECONDS);
        if (positive) {
            positiveChecks.increment();
        } else {
            negativeChecks.increment();
        }
    }

    @Override
    public void recordCapacityExceeded() {
        capacityExceeded.increment();
    }

    /**
     * Gauge 按 name + instance 区分，同名的多个过滤器各自有一组 Gauge；
     * 计时器和计数器只按 name 聚合
     */
    @Override
    public synchronized void bind(BloomFilter filter) {
        if (instance != null) {
            throw new IllegalStateException("metrics '" + name + "' already bound to filter instance " + instance);
        }
        String id = String.valueOf(INSTANCE_IDS.incrementAndGet());
        Gauge.builder("bloom.key.count", filter, f -> f.getKeyCount())
                .tag("name", name).tag("instance", id).register(registry);
        Gauge.builder("bloom.fill.ratio", filter, BloomFilter::getFillRatio)
                .tag("name", name).tag("instance", id).register(registry);
        instance = id;
    }

    /** bind 之后分配的 instance 标签值，未绑定时为 null */
    public String getInstance() {
        return instance;
    }
}
