package com.ryuqq.registry.core.exception;

/**
 * 키 값에 해당하는 레코드가 없는 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class KeyNotFoundException extends RegistryException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key " + key + " not found");
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
