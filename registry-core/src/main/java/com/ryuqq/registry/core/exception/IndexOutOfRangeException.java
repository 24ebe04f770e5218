package com.ryuqq.registry.core.exception;

/**
 * 위치 키가 범위를 벗어난 경우 ({@code 0 <= index < size} 위반).
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class IndexOutOfRangeException extends RegistryException {

    private final int index;
    private final int size;

    public IndexOutOfRangeException(int index, int size) {
        super("Index " + index + " out of range (size: " + size + ")");
        this.index = index;
        this.size = size;
    }

    public int index() {
        return index;
    }

    public int size() {
        return size;
    }
}
