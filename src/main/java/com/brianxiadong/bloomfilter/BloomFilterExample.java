package com.brianxiadong.bloomfilter;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * 布隆过滤器使用示例
 */
public class BloomFilterExample {
    public static void main(String[] args) {
        System.out.println("=== 布隆过滤器基本操作示例 ===");

        BloomFilter filter = new BloomFilter(1000, 0.01, new Random(42));
        System.out.println("创建: " + filter);

        filter.add("user:1");
        filter.add("user:2");
        filter.add("user:3".getBytes(StandardCharsets.UTF_8));
        filter.add(() -> new byte[]{0x01, 0x02, 0x03});

        System.out.println("user:1 可能存在 = " + filter.check("user:1"));
        System.out.println("user:3 可能存在 = " + filter.check("user:3"));
        System.out.println("user:404 可能存在 = " + filter.check("user:404"));

        System.out.println("\n=== 写满过滤器 ===");
        int i = 0;
        while (!filter.isFull()) {
            filter.add("key:" + i++);
        }
        System.out.printf("键数量: %d / %d, 填充率: %.2f%%, 估算误判率: %.4f%n",
                filter.getKeyCount(), filter.getCapacity(),
                filter.getFillRatio() * 100, filter.getEstimatedFalsePositiveRate());

        try {
            filter.add("one-more");
        } catch (CapacityExceededException e) {
            System.out.println("添加失败: " + e.getMessage());
        }
    }
}
