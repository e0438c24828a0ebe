package com.brianxiadong.bloomfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 盐值生成器
 * 为每个哈希函数生成一个互不相同的 [0, 1) 随机数，用于扰动哈希输入
 */
public class SaltGenerator {
    private final Random random;

    public SaltGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    /**
     * 生成 count 个互不相同的盐值，顺序即生成顺序
     * 碰撞时直接重新抽取
     */
    public List<Double> createSalts(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("salt count must be > 0, got " + count);
        }
        Set<Double> salts = new LinkedHashSet<>();
        while (salts.size() < count) {
            salts.add(random.nextDouble());
        }
        return Collections.unmodifiableList(new ArrayList<>(salts));
    }
}
