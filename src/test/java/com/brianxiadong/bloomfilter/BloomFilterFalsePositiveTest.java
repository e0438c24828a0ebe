package com.brianxiadong.bloomfilter;

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class BloomFilterFalsePositiveTest {

    private static double measure(int capacity, double errorRate, int probes, long seed, DigestStrategy digest) {
        BloomFilter bf = new BloomFilter(capacity, errorRate, new Random(seed), digest, NoopBloomFilterMetrics.INSTANCE);
        for (int i = 0; i < capacity; i++) {
            bf.add("member:" + seed + ":" + i);
        }
        for (int i = 0; i < capacity; i++) {
            Assert.assertTrue(bf.check("member:" + seed + ":" + i));
        }
        int fp = 0;
        for (int i = 0; i < probes; i++) {
            if (bf.check("probe:" + seed + ":" + i)) {
                fp++;
            }
        }
        return fp / (double) probes;
    }

    @Test
    public void testRateBoundedWithSha1() {
        int[] capacities = {500, 1000, 2000};
        double[] rates = {0.05, 0.01, 0.001};
        int[] probes = {10000, 20000, 50000};
        for (int i = 0; i < capacities.length; i++) {
            for (long seed = 1; seed <= 3; seed++) {
                double actual = measure(capacities[i], rates[i], probes[i], seed, new Sha1DigestStrategy());
                Assert.assertTrue(String.format("capacity=%d p=%s actual=%s", capacities[i], rates[i], actual),
                        actual <= rates[i] * 2.5);
            }
        }
    }

    @Test
    public void testRateBoundedWithXXHash64() {
        double actual = measure(1000, 0.01, 20000, 11, new XXHash64DigestStrategy());
        Assert.assertTrue("actual=" + actual, actual <= 0.025);
    }
}
