package com.brianxiadong.bloomfilter;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class BloomFilterConfigTest {
    @After
    public void tearDown() {
        System.clearProperty(BloomFilterConfig.DIGEST_PROPERTY);
        System.clearProperty(BloomFilterConfig.METRICS_ENABLED_PROPERTY);
        System.clearProperty(BloomFilterConfig.METRICS_NAME_PROPERTY);
    }

    @Test
    public void testDefaults() {
        BloomFilterConfig config = BloomFilterConfig.fromSystemProperties();
        Assert.assertEquals("sha1", config.getDigest());
        Assert.assertFalse(config.isMetricsEnabled());
        Assert.assertEquals("default", config.getMetricsName());
        Assert.assertTrue(config.createDigestStrategy() instanceof Sha1DigestStrategy);
        Assert.assertSame(NoopBloomFilterMetrics.INSTANCE, config.createMetrics());
    }

    @Test
    public void testSystemProperties() {
        System.setProperty(BloomFilterConfig.DIGEST_PROPERTY, "xxhash64");
        System.setProperty(BloomFilterConfig.METRICS_ENABLED_PROPERTY, "true");
        System.setProperty(BloomFilterConfig.METRICS_NAME_PROPERTY, "config-test");
        BloomFilterConfig config = BloomFilterConfig.fromSystemProperties();
        Assert.assertTrue(config.createDigestStrategy() instanceof XXHash64DigestStrategy);
        Assert.assertTrue(config.createMetrics() instanceof MicrometerBloomFilterMetrics);

        BloomFilter bf = new BloomFilter(10, 0.1, new Random(3));
        Assert.assertEquals("XXHASH64", bf.getDigestType());
    }

    @Test
    public void testDigestNames() {
        Assert.assertTrue(BloomFilterConfig.digestStrategy("SHA-1") instanceof Sha1DigestStrategy);
        Assert.assertTrue(BloomFilterConfig.digestStrategy(" XXHash64 ") instanceof XXHash64DigestStrategy);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownDigest() {
        BloomFilterConfig.digestStrategy("md5");
    }
}
