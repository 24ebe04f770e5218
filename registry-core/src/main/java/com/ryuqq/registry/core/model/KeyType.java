package com.ryuqq.registry.core.model;

import java.math.BigInteger;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 키 선언의 매칭 타입 태그.
 *
 * <p>조회 키 값이 어떤 {@link KeyDeclaration}을 통해 해석될지 결정합니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>TEXT, NUMBER: 스키마 내 타입당 최대 1개의 선언, 값 유일성 강제</li>
 *   <li>IDENTIFIER: 여러 선언 허용, 유일성 검증 면제 (전역 고유값 가정)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum KeyType {

    /**
     * 문자열 키.
     */
    TEXT(String.class),

    /**
     * 정수형 키 (모든 정수 {@link java.lang.Number}는 long으로 정규화).
     */
    NUMBER(Long.class),

    /**
     * 전역 고유 식별자 키.
     */
    IDENTIFIER(UUID.class);

    private final Class<?> valueType;

    KeyType(Class<?> valueType) {
        this.valueType = valueType;
    }

    /**
     * 이 타입이 매칭하는 값의 Java 타입.
     *
     * @return 값 타입
     */
    public Class<?> valueType() {
        return valueType;
    }

    /**
     * 식별자 타입인지 확인.
     *
     * <p>식별자 타입은 중복 타입 선언 규칙과 유일성 불변식에서 모두 면제됩니다.</p>
     *
     * @return IDENTIFIER인 경우 true
     */
    public boolean isIdentifier() {
        return this == IDENTIFIER;
    }

    /**
     * 레코드 속성값을 비교 가능한 형태로 정규화.
     *
     * <p>NUMBER 타입은 Byte, Short, Integer, Long, AtomicInteger, AtomicLong과
     * long 범위 안의 BigInteger를 long으로 변환합니다.
     * BigDecimal, 실수, long 범위를 넘는 BigInteger는 손실 없이 비교할 수 없으므로 그대로 반환합니다.</p>
     *
     * @param raw 속성값 (null 가능)
     * @return 정규화된 값
     */
    public Object normalize(Object raw) {
        if (this != NUMBER) {
            return raw;
        }
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer || raw instanceof Long
                || raw instanceof AtomicInteger || raw instanceof AtomicLong) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        return raw;
    }
}
