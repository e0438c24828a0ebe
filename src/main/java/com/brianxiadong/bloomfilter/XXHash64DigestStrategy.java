package com.brianxiadong.bloomfilter;

import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

public class XXHash64DigestStrategy implements DigestStrategy {
    public static final String TYPE = "XXHASH64";

    private final XXHash64 hash = XXHashFactory.fastestInstance().hash64();
    private final long seed;

    public XXHash64DigestStrategy() {
        this(0L);
    }

    public XXHash64DigestStrategy(long seed) {
        this.seed = seed;
    }

    @Override
    public byte[] digest(byte[] data) {
        long h = hash.hash(data, 0, data.length, seed);
        // big-endian，与 CellMapper 的读取顺序一致
        byte[] out = new byte[8];
        for (int i = 7; i >= 0; i--) {
            out[i] = (byte) (h & 0xFF);
            h >>>= 8;
        }
        return out;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
