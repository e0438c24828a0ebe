package com.brianxiadong.bloomfilter.tools;

import com.brianxiadong.bloomfilter.BloomFilter;
import com.brianxiadong.bloomfilter.BloomFilterConfig;
import com.brianxiadong.bloomfilter.DigestStrategy;
import com.brianxiadong.bloomfilter.NoopBloomFilterMetrics;

import java.util.Random;

/**
 * 布隆过滤器误判率基准测试工具
 *
 * 把过滤器写满到容量上限，然后用一批从未添加过的键探测，
 * 统计实际误判率以及 add / check 吞吐量。
 */
public class FalsePositiveBenchmark {

    public static class BenchmarkConfig {
        public final int capacity;
        public final double errorRate;
        public final int probes;
        public final long randomSeed;
        public final String digest;

        public BenchmarkConfig() {
            this(100000, 0.01, 100000, System.currentTimeMillis(), BloomFilterConfig.DEFAULT_DIGEST);
        }

        public BenchmarkConfig(int capacity, double errorRate, int probes, long randomSeed, String digest) {
            this.capacity = capacity;
            this.errorRate = errorRate;
            this.probes = probes;
            this.randomSeed = randomSeed;
            this.digest = digest;
        }
    }

    /**
     * 一次运行的结果
     */
    public static class BenchmarkResult {
        public final int filterLength;
        public final int numHashFuncs;
        public final int falsePositives;
        public final int probes;
        public final double addOpsPerSec;
        public final double checkOpsPerSec;

        BenchmarkResult(int filterLength, int numHashFuncs, int falsePositives, int probes,
                        double addOpsPerSec, double checkOpsPerSec) {
            this.filterLength = filterLength;
            this.numHashFuncs = numHashFuncs;
            this.falsePositives = falsePositives;
            this.probes = probes;
            this.addOpsPerSec = addOpsPerSec;
            this.checkOpsPerSec = checkOpsPerSec;
        }

        public double getFalsePositiveRate() {
            return probes == 0 ? 0.0 : falsePositives / (double) probes;
        }
    }

    private final BenchmarkConfig config;

    public FalsePositiveBenchmark(BenchmarkConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        try {
            BenchmarkConfig config = parseArgs(args);
            new FalsePositiveBenchmark(config).run();
        } catch (Exception e) {
            System.err.println("基准测试执行失败: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static BenchmarkConfig parseArgs(String[] args) {
        if (args.length == 0) {
            return new BenchmarkConfig();
        }

        int capacity = 100000;
        double errorRate = 0.01;
        int probes = 100000;
        long seed = System.currentTimeMillis();
        String digest = BloomFilterConfig.DEFAULT_DIGEST;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            try {
                if ("--capacity".equals(arg) && i + 1 < args.length) {
                    capacity = Integer.parseInt(args[++i]);
                } else if ("--error-rate".equals(arg) && i + 1 < args.length) {
                    errorRate = Double.parseDouble(args[++i]);
                } else if ("--probes".equals(arg) && i + 1 < args.length) {
                    probes = Integer.parseInt(args[++i]);
                } else if ("--seed".equals(arg) && i + 1 < args.length) {
                    seed = Long.parseLong(args[++i]);
                } else if ("--digest".equals(arg) && i + 1 < args.length) {
                    digest = args[++i];
                } else if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    System.exit(0);
                } else {
                    System.err.println("未知参数: " + arg);
                    printUsage();
                    System.exit(1);
                }
            } catch (NumberFormatException e) {
                System.err.println("参数格式错误: " + arg + " = " + args[i]);
                printUsage();
                System.exit(1);
            }
        }

        return new BenchmarkConfig(capacity, errorRate, probes, seed, digest);
    }

    private static void printUsage() {
        System.out.println("布隆过滤器误判率基准测试工具");
        System.out.println("用法: java FalsePositiveBenchmark [选项]");
        System.out.println("选项:");
        System.out.println("  --capacity <数量>      过滤器容量 (默认: 100000)");
        System.out.println("  --error-rate <比例>    目标误判率 (默认: 0.01)");
        System.out.println("  --probes <数量>        探测键数量 (默认: 100000)");
        System.out.println("  --seed <数字>          随机种子 (默认: 当前时间)");
        System.out.println("  --digest <算法>        sha1 或 xxhash64 (默认: sha1)");
        System.out.println("  --help, -h             显示此帮助信息");
        System.out.println();
        System.out.println("示例:");
        System.out.println("  java FalsePositiveBenchmark --capacity 50000 --error-rate 0.001 --digest xxhash64");
    }

    public BenchmarkResult run() {
        System.out.println("开始布隆过滤器误判率基准测试...");
        System.out.printf("配置: 容量=%d, 目标误判率=%s, 探测数=%d, 摘要=%s, 种子=%d%n",
                config.capacity, config.errorRate, config.probes, config.digest, config.randomSeed);

        DigestStrategy digest = BloomFilterConfig.digestStrategy(config.digest);
        BloomFilter filter = new BloomFilter(config.capacity, config.errorRate,
                new Random(config.randomSeed), digest, NoopBloomFilterMetrics.INSTANCE);

        long start = System.nanoTime();
        for (int i = 0; i < config.capacity; i++) {
            filter.add("member:" + i);
        }
        long addNanos = System.nanoTime() - start;

        // 探测键与已添加键的前缀不同，保证从未添加过
        int falsePositives = 0;
        start = System.nanoTime();
        for (int i = 0; i < config.probes; i++) {
            if (filter.check("probe:" + i)) {
                falsePositives++;
            }
        }
        long checkNanos = System.nanoTime() - start;

        BenchmarkResult result = new BenchmarkResult(filter.getFilterLength(), filter.getNumHashFuncs(),
                falsePositives, config.probes, opsPerSec(config.capacity, addNanos),
                opsPerSec(config.probes, checkNanos));
        printReport(filter, result);
        return result;
    }

    private static double opsPerSec(int ops, long nanos) {
        if (nanos <= 0) return 0.0;
        return ops / (nanos / 1_000_000_000.0);
    }

    private void printReport(BloomFilter filter, BenchmarkResult result) {
        System.out.println("\n=== 基准测试结果 ===");
        System.out.printf("位数组长度: %d 位 (%.2f KB)%n", result.filterLength, result.filterLength / 8.0 / 1024.0);
        System.out.printf("哈希函数个数: %d%n", result.numHashFuncs);
        System.out.printf("填充率: %.2f%%%n", filter.getFillRatio() * 100);
        System.out.printf("误判数: %d / %d%n", result.falsePositives, result.probes);
        System.out.printf("实际误判率: %.5f (目标: %s, 估算: %.5f)%n",
                result.getFalsePositiveRate(), config.errorRate, filter.getEstimatedFalsePositiveRate());
        System.out.printf("add 吞吐量: %.2f ops/sec%n", result.addOpsPerSec);
        System.out.printf("check 吞吐量: %.2f ops/sec%n", result.checkOpsPerSec);
    }
}
