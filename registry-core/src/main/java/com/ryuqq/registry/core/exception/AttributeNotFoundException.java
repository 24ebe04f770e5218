package com.ryuqq.registry.core.exception;

/**
 * 인식할 수 없는 속성 또는 projection 이름으로 접근한 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class AttributeNotFoundException extends RegistryException {

    private final String name;

    public AttributeNotFoundException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
