package com.brianxiadong.bloomfilter;

/**
 * 构造参数非法：误判率不在 (0, 1)、容量非正，或找不到可行的 (m, k)
 */
public class InvalidParametersException extends IllegalArgumentException {
    public InvalidParametersException(String message) {
        super(message);
    }
}
