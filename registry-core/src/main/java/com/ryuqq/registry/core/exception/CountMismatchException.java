package com.ryuqq.registry.core.exception;

/**
 * 배치 replace의 키 개수와 값 개수가 다른 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class CountMismatchException extends RegistryException {

    private final int keyCount;
    private final int valueCount;

    public CountMismatchException(int keyCount, int valueCount) {
        super("Number of keys and values must match (keys: " + keyCount + ", values: " + valueCount + ")");
        this.keyCount = keyCount;
        this.valueCount = valueCount;
    }

    public int keyCount() {
        return keyCount;
    }

    public int valueCount() {
        return valueCount;
    }
}
