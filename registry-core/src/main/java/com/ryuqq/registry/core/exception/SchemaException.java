package com.ryuqq.registry.core.exception;

/**
 * 키 스키마 검증 실패.
 *
 * <p>유효하지 않은 projection 이름, 중복된 비식별자 매칭 타입,
 * 레코드 타입에 없는 속성을 참조하는 선언 등으로 발생합니다. 생성 시점에만 발생합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class SchemaException extends RegistryException {

    public SchemaException(String message) {
        super(message);
    }
}
