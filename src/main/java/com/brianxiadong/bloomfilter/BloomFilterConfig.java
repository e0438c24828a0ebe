package com.brianxiadong.bloomfilter;

/**
 * 默认配置，通过系统属性传递
 * <ul>
 *   <li>bloom.digest：sha1（默认）或 xxhash64</li>
 *   <li>bloom.metrics.enabled：是否注册 Micrometer 指标，默认 false</li>
 *   <li>bloom.metrics.name：指标的 name 标签，默认 default</li>
 * </ul>
 */
public class BloomFilterConfig {
    public static final String DIGEST_PROPERTY = "bloom.digest";
    public static final String METRICS_ENABLED_PROPERTY = "bloom.metrics.enabled";
    public static final String METRICS_NAME_PROPERTY = "bloom.metrics.name";

    public static final String DEFAULT_DIGEST = "sha1";
    public static final String DEFAULT_METRICS_NAME = "default";

    private final String digest;
    private final boolean metricsEnabled;
    private final String metricsName;

    public BloomFilterConfig(String digest, boolean metricsEnabled, String metricsName) {
        this.digest = digest;
        this.metricsEnabled = metricsEnabled;
        this.metricsName = metricsName;
    }

    public static BloomFilterConfig fromSystemProperties() {
        String digest = System.getProperty(DIGEST_PROPERTY, DEFAULT_DIGEST);
        boolean metrics = "true".equalsIgnoreCase(System.getProperty(METRICS_ENABLED_PROPERTY, "false"));
        String name = System.getProperty(METRICS_NAME_PROPERTY, DEFAULT_METRICS_NAME);
        return new BloomFilterConfig(digest, metrics, name);
    }

    /**
     * 按名称创建摘要策略
     */
    public static DigestStrategy digestStrategy(String name) {
        if (name == null) {
            throw new IllegalArgumentException("digest name cannot be null");
        }
        switch (name.trim().toLowerCase()) {
            case "sha1":
            case "sha-1":
                return new Sha1DigestStrategy();
            case "xxhash64":
                return new XXHash64DigestStrategy();
            default:
                throw new IllegalArgumentException("Unknown digest: " + name + " (expected sha1 or xxhash64)");
        }
    }

    public DigestStrategy createDigestStrategy() {
        return digestStrategy(digest);
    }

    public BloomFilterMetrics createMetrics() {
        if (!metricsEnabled) {
            return NoopBloomFilterMetrics.INSTANCE;
        }
        return new MicrometerBloomFilterMetrics(metricsName);
    }

    public String getDigest() {
        return digest;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public String getMetricsName() {
        return metricsName;
    }
}
