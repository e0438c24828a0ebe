package com.brianxiadong.bloomfilter;

import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

public class CellMapperTest {
    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testFoldXorsBigEndianWords() {
        byte[] digest = {0, 0, 0, 5, 0, 0, 0, 3};
        Assert.assertEquals(6L, CellMapper.fold(digest, 0L));
    }

    @Test
    public void testFoldTreatsWordsAsUnsigned() {
        byte[] digest = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
        Assert.assertEquals(0xFFFFFFFFL, CellMapper.fold(digest, 0L));
    }

    @Test
    public void testFoldOfSha1() {
        // SHA-1("abc") = a9993e36 4706816a ba3e2571 7850c26c 9cd0d89d
        byte[] digest = new Sha1DigestStrategy().digest(utf8("abc"));
        Assert.assertEquals(0xb02180dcL, CellMapper.fold(digest, 0L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsDigestNotMultipleOfFourBytes() {
        CellMapper.fold(new byte[]{1, 2, 3}, 0L);
    }

    @Test
    public void testKnownSha1Cells() {
        CellMapper mapper = new CellMapper(new Sha1DigestStrategy());
        int[] cells = mapper.getCells(utf8("foo-bar"), 960, 0L, Arrays.asList(0.5, 0.25));
        Assert.assertArrayEquals(new int[]{820, 117}, cells);
    }

    @Test
    public void testSaltIsAppendedAsText() {
        DigestStrategy recording = new DigestStrategy() {
            @Override
            public byte[] digest(byte[] data) {
                Assert.assertEquals("key0.5", new String(data, StandardCharsets.UTF_8));
                return new byte[]{0, 0, 0, 9};
            }

            @Override
            public String getType() {
                return "RECORDING";
            }
        };
        int[] cells = new CellMapper(recording).getCells(utf8("key"), 4, 0L, Arrays.asList(0.5));
        Assert.assertArrayEquals(new int[]{1}, cells);
    }

    @Test
    public void testCellsDeterministicAndInRange() {
        CellMapper mapper = new CellMapper(new XXHash64DigestStrategy());
        List<Double> salts = Arrays.asList(0.1, 0.2, 0.3, 0.4, 0.5);
        for (int i = 0; i < 200; i++) {
            byte[] key = utf8("k" + i);
            int[] a = mapper.getCells(key, 97, 0L, salts);
            int[] b = mapper.getCells(key, 97, 0L, salts);
            Assert.assertArrayEquals(a, b);
            Assert.assertEquals(salts.size(), a.length);
            for (int cell : a) {
                Assert.assertTrue(cell >= 0 && cell < 97);
            }
        }
    }

    @Test
    public void testDifferentSaltsDisperseKey() {
        CellMapper mapper = new CellMapper(new Sha1DigestStrategy());
        int[] cells = mapper.getCells(utf8("dispersed"), 1_000_000, 0L,
                Arrays.asList(0.11, 0.22, 0.33, 0.44, 0.55, 0.66));
        long distinct = Arrays.stream(cells).distinct().count();
        Assert.assertTrue(distinct > 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullKey() {
        new CellMapper(new Sha1DigestStrategy()).getCells(null, 10, 0L, Arrays.asList(0.5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveLength() {
        new CellMapper(new Sha1DigestStrategy()).getCells(utf8("a"), 0, 0L, Arrays.asList(0.5));
    }
}
