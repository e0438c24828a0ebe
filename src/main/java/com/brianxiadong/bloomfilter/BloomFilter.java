package com.brianxiadong.bloomfilter;

import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

/**
 * 布隆过滤器实现
 * 用于快速判断键是否可能已经添加过：返回false表示一定没有，返回true表示可能有
 *
 * 构造时按容量和误判率确定位数组长度与哈希函数个数，并为每个哈希函数生成一个盐值，
 * 之后这些参数不再变化。只支持添加，不支持删除，位一旦置1不会被清除。
 * add 非线程安全，并发写入需要调用方自行同步；在没有写入时，多个线程可以同时调用 check。
 */
public class BloomFilter {
    private static final long BLANK_VECTOR = 0L;

    private final int capacity;
    private final double errorRate;
    private final int filterLength;
    private final int numHashFuncs;
    private final List<Double> salts;
    private final BitSet filter;
    private final CellMapper cellMapper;
    private final BloomFilterMetrics metrics;
    // 指标 Gauge 可能在其他线程读取
    private volatile int keyCount;

    /**
     * 使用系统属性中的默认配置和系统随机源创建过滤器
     */
    public BloomFilter(int capacity, double errorRate) {
        this(capacity, errorRate, new Random());
    }

    public BloomFilter(int capacity, double errorRate, Random random) {
        this(capacity, errorRate, random, BloomFilterConfig.fromSystemProperties());
    }

    private BloomFilter(int capacity, double errorRate, Random random, BloomFilterConfig config) {
        this(capacity, errorRate, random, config.createDigestStrategy(), config.createMetrics());
    }

    /**
     * @param capacity       最多可添加的键数量
     * @param errorRate      写满时的目标误判率，(0, 1)
     * @param random         盐值随机源，测试时可传入固定种子
     * @param digestStrategy 摘要算法，add 和 check 使用同一个
     * @param metrics        指标记录器
     * @throws InvalidParametersException 容量或误判率非法
     */
    public BloomFilter(int capacity, double errorRate, Random random,
                       DigestStrategy digestStrategy, BloomFilterMetrics metrics) {
        FilterParameters params = FilterParameters.calculate(capacity, errorRate);
        this.capacity = capacity;
        this.errorRate = errorRate;
        this.filterLength = params.getFilterLength();
        this.numHashFuncs = params.getNumHashFuncs();
        this.salts = new SaltGenerator(random).createSalts(numHashFuncs);
        this.filter = new BitSet(filterLength);
        this.cellMapper = new CellMapper(digestStrategy);
        this.metrics = metrics == null ? NoopBloomFilterMetrics.INSTANCE : metrics;
        this.keyCount = 0;
        // 必须是最后一步，bind 时所有字段已赋值
        this.metrics.bind(this);
    }

    /**
     * 添加一个键
     *
     * @throws IllegalArgumentException key 为 null，此时过滤器不做任何修改
     * @throws CapacityExceededException 已达到容量上限，此时过滤器不做任何修改
     */
    public void add(ByteConvertible key) {
        long start = System.nanoTime();
        if (keyCount >= capacity) {
            metrics.recordCapacityExceeded();
            throw new CapacityExceededException(capacity);
        }
        int[] cells = cellsOf(key);
        keyCount++;
        for (int cell : cells) {
            filter.set(cell);
        }
        metrics.recordAdd(System.nanoTime() - start);
    }

    public void add(String key) {
        add(bytesOf(key));
    }

    public void add(byte[] key) {
        add(wrap(key));
    }

    /**
     * 检查键是否可能存在，不消耗容量，也不修改状态
     * 对任何非 null 的键都返回确定的结果，从不失败
     *
     * @throws IllegalArgumentException key 为 null
     */
    public boolean check(ByteConvertible key) {
        long start = System.nanoTime();
        boolean result = true;
        for (int cell : cellsOf(key)) {
            if (!filter.get(cell)) {
                result = false;
                break;
            }
        }
        metrics.recordCheck(System.nanoTime() - start, result);
        return result;
    }

    public boolean check(String key) {
        return check(bytesOf(key));
    }

    public boolean check(byte[] key) {
        return check(wrap(key));
    }

    /**
     * 键对应的位下标，同一实例对同一键总是返回相同结果
     */
    public int[] getCells(ByteConvertible key) {
        return cellsOf(key);
    }

    public int[] getCells(String key) {
        return cellsOf(wrap(bytesOf(key)));
    }

    private int[] cellsOf(ByteConvertible key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        return cellMapper.getCells(key.toBytes(), filterLength, BLANK_VECTOR, salts);
    }

    private static byte[] bytesOf(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        return key.getBytes(StandardCharsets.UTF_8);
    }

    private static ByteConvertible wrap(byte[] key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        return () -> key;
    }

    public int getCapacity() {
        return capacity;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public int getKeyCount() {
        return keyCount;
    }

    public int getFilterLength() {
        return filterLength;
    }

    public int getNumHashFuncs() {
        return numHashFuncs;
    }

    public List<Double> getSalts() {
        return salts;
    }

    public long getBlankVector() {
        return BLANK_VECTOR;
    }

    public String getDigestType() {
        return cellMapper.getDigestType();
    }

    public boolean isFull() {
        return keyCount >= capacity;
    }

    /** 已置1的位数 */
    public int getBitCount() {
        return filter.cardinality();
    }

    public double getFillRatio() {
        return filter.cardinality() / (double) filterLength;
    }

    /**
     * 按当前键数量估算的误判率 (1 - e^(-k*n/m))^k
     */
    public double getEstimatedFalsePositiveRate() {
        return Math.pow(1 - Math.exp(-(double) numHashFuncs * keyCount / filterLength), numHashFuncs);
    }

    @Override
    public String toString() {
        return String.format("BloomFilter{capacity=%d, errorRate=%s, keyCount=%d, filterLength=%d, numHashFuncs=%d, digest=%s}",
                capacity, errorRate, keyCount, filterLength, numHashFuncs, getDigestType());
    }
}
