package com.ryuqq.registry.core.exception;

/**
 * 키 값 조회 결과가 둘 이상인 경우.
 *
 * <p>유일성 검증에서 면제된 식별자 키에서 발생할 수 있습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class AmbiguousKeyException extends RegistryException {

    private final transient Object value;
    private final String projectionName;
    private final int matchCount;

    public AmbiguousKeyException(Object value, String projectionName, int matchCount) {
        super("Ambiguous key value " + value + " for key '" + projectionName + "'; "
            + matchCount + " records found");
        this.value = value;
        this.projectionName = projectionName;
        this.matchCount = matchCount;
    }

    public Object value() {
        return value;
    }

    public String projectionName() {
        return projectionName;
    }

    public int matchCount() {
        return matchCount;
    }
}
