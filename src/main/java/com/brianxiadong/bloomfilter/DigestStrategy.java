package com.brianxiadong.bloomfilter;

/**
 * 摘要策略：对 "键 + 盐" 字节串求一个稳定且分布均匀的摘要
 * 输出长度必须是4字节的正整数倍；实现必须允许多个线程同时调用 digest
 */
public interface DigestStrategy {
    byte[] digest(byte[] data);
    String getType();
}
