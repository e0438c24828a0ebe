package com.brianxiadong.bloomfilter;

/**
 * 可以转换为字节序列的键
 */
@FunctionalInterface
public interface ByteConvertible {
    byte[] toBytes();
}
