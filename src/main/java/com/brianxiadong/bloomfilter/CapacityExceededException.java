package com.brianxiadong.bloomfilter;

/**
 * 过滤器已写满，拒绝继续添加
 */
public class CapacityExceededException extends IllegalStateException {
    private final int capacity;

    public CapacityExceededException(int capacity) {
        super("Bloom filter is at capacity (" + capacity + " keys)");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
