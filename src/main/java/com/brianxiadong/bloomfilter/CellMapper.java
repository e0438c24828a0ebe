package com.brianxiadong.bloomfilter;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 位置映射器
 * 把一个键映射为每个盐值对应的位下标
 */
public class CellMapper {
    private final DigestStrategy digestStrategy;

    public CellMapper(DigestStrategy digestStrategy) {
        if (digestStrategy == null) {
            throw new IllegalArgumentException("digestStrategy cannot be null");
        }
        this.digestStrategy = digestStrategy;
    }

    /**
     * 计算键在位数组中的位置
     * 对每个盐值：键字节 + 盐值文本 -> 摘要 -> 按 big-endian 无符号32位整数异或折叠 -> 对长度取模
     *
     * @return 与 salts 一一对应的位下标，不同盐值可能落在同一位置
     */
    public int[] getCells(byte[] key, int filterLength, long blankVector, List<Double> salts) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (filterLength <= 0) {
            throw new IllegalArgumentException("filterLength must be > 0, got " + filterLength);
        }
        int[] cells = new int[salts.size()];
        int i = 0;
        for (Double salt : salts) {
            byte[] digest = digestStrategy.digest(salted(key, salt));
            cells[i++] = (int) Math.floorMod(fold(digest, blankVector), (long) filterLength);
        }
        return cells;
    }

    public String getDigestType() {
        return digestStrategy.getType();
    }

    private static byte[] salted(byte[] key, double salt) {
        byte[] saltBytes = Double.toString(salt).getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[key.length + saltBytes.length];
        System.arraycopy(key, 0, data, 0, key.length);
        System.arraycopy(saltBytes, 0, data, key.length, saltBytes.length);
        return data;
    }

    static long fold(byte[] digest, long blankVector) {
        if (digest.length == 0 || digest.length % 4 != 0) {
            throw new IllegalArgumentException(
                    "digest length must be a positive multiple of 4 bytes, got " + digest.length);
        }
        long acc = blankVector;
        for (int off = 0; off < digest.length; off += 4) {
            long word = ((digest[off] & 0xFFL) << 24) | ((digest[off + 1] & 0xFFL) << 16)
                    | ((digest[off + 2] & 0xFFL) << 8) | (digest[off + 3] & 0xFFL);
            acc ^= word;
        }
        return acc;
    }
}
