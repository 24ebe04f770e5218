package com.ryuqq.registry.core.exception;

/**
 * 유일성 불변식 위반.
 *
 * <p>쓰기 대상 레코드의 키 값이 기존 레코드와 충돌하는 경우 발생하며,
 * 해당 레코드는 저장되지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class DuplicateKeyException extends RegistryException {

    private final String projectionName;
    private final transient Object value;

    public DuplicateKeyException(String projectionName, Object value) {
        super("Duplicate value for key '" + projectionName + "': " + value);
        this.projectionName = projectionName;
        this.value = value;
    }

    /**
     * 충돌한 키 선언의 projection 이름.
     *
     * @return projection 이름
     */
    public String projectionName() {
        return projectionName;
    }

    /**
     * 충돌한 값.
     *
     * @return 값 (null 가능)
     */
    public Object value() {
        return value;
    }
}
