package com.ryuqq.registry.core.model;

/**
 * 키 스키마 항목.
 *
 * <p>KeyDeclaration은 projection 이름, 레코드 속성 이름, 매칭 타입을 하나로 묶습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * KeyDeclaration names = KeyDeclaration.of("names", "name", KeyType.TEXT);
 * KeyDeclaration ids = KeyDeclaration.of("ids", "id", KeyType.IDENTIFIER);
 * </pre>
 *
 * <p>projection 이름의 식별자 문법 검증은 {@link com.ryuqq.registry.core.schema.KeySchema}가 담당합니다.</p>
 *
 * @param projectionName 외부에 노출되는 이름 (컬럼 접근, 오류 메시지)
 * @param sourceAttribute 레코드에서 읽을 속성 이름
 * @param matchType 매칭 타입 태그
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record KeyDeclaration(
    String projectionName,
    String sourceAttribute,
    KeyType matchType
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 sourceAttribute가 빈 문자열인 경우
     */
    public KeyDeclaration {
        if (projectionName == null) {
            throw new IllegalArgumentException("projectionName cannot be null");
        }
        if (sourceAttribute == null || sourceAttribute.isBlank()) {
            throw new IllegalArgumentException("sourceAttribute cannot be null or blank");
        }
        if (matchType == null) {
            throw new IllegalArgumentException("matchType cannot be null");
        }
    }

    /**
     * KeyDeclaration 생성.
     *
     * @param projectionName projection 이름
     * @param sourceAttribute 속성 이름
     * @param matchType 매칭 타입
     * @return KeyDeclaration 인스턴스
     */
    public static KeyDeclaration of(String projectionName, String sourceAttribute, KeyType matchType) {
        return new KeyDeclaration(projectionName, sourceAttribute, matchType);
    }

    /**
     * 유일성 검증 대상인지 확인.
     *
     * @return 식별자 타입이 아닌 경우 true
     */
    public boolean enforcesUniqueness() {
        return !matchType.isIdentifier();
    }
}
