package com.brianxiadong.bloomfilter;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

/**
 * 进程内共享的 Prometheus 指标注册表
 */
public class MetricsRegistry {
    private static final PrometheusMeterRegistry REGISTRY = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

    public static MeterRegistry get() {
        return REGISTRY;
    }

    /**
     * Prometheus 文本格式的当前指标
     */
    public static String scrape() {
        return REGISTRY.scrape();
    }
}
