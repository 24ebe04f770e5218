package com.ryuqq.registry.core.exception;

/**
 * 레지스트리 도메인 오류의 최상위 예외.
 *
 * <p>모든 하위 예외는 호출자에게 동기적으로 전파되며, 내부에서 재시도하거나 무시하지 않습니다.
 * 배치 연산(append, replace, delete)은 롤백하지 않으므로 실패 이전에 처리된 항목은 그대로 반영됩니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class RegistryException extends RuntimeException {

    protected RegistryException(String message) {
        super(message);
    }
}
