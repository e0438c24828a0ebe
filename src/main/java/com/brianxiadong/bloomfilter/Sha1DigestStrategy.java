package com.brianxiadong.bloomfilter;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class Sha1DigestStrategy implements DigestStrategy {
    public static final String TYPE = "SHA-1";

    // MessageDigest 非线程安全，每个线程各持有一个实例，并发 check 互不干扰
    private final ThreadLocal<MessageDigest> messageDigest = ThreadLocal.withInitial(Sha1DigestStrategy::newDigest);

    public Sha1DigestStrategy() {
        // 提前在构造线程上创建一次，JDK 缺少算法时立即失败
        messageDigest.get();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(TYPE);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JDK does not provide " + TYPE, e);
        }
    }

    @Override
    public byte[] digest(byte[] data) {
        return messageDigest.get().digest(data);
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
