package com.ryuqq.registry.core.model;

import java.util.Optional;
import java.util.UUID;

/**
 * 레코드 조회 키.
 *
 * <p>Key는 위치 기반 키와 값 기반 키를 하나의 sealed 계층으로 표현합니다:</p>
 * <ul>
 *   <li>{@link Position}: 레코드 위치 (0부터 시작)</li>
 *   <li>{@link Text}: {@link KeyType#TEXT} 선언으로 해석되는 문자열 값</li>
 *   <li>{@link Numeric}: {@link KeyType#NUMBER} 선언으로 해석되는 정수 값</li>
 *   <li>{@link Identifier}: {@link KeyType#IDENTIFIER} 선언으로 해석되는 UUID 값</li>
 * </ul>
 *
 * <p>값 기반 키는 기본적으로 스키마 순서상 같은 타입의 <strong>첫 번째</strong> 선언만 검색합니다.
 * {@link ValueKey#via(String)}로 projection 이름을 지정하면 해당 선언만 검색합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Key byPosition = Key.at(0);
 * Key byName = Key.of("Alice");
 * Key byParent = Key.of(parentId).via("parentIds");
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface Key permits Key.Position, Key.ValueKey {

    /**
     * 위치 키 생성.
     *
     * @param index 레코드 위치
     * @return Position 인스턴스
     */
    static Position at(int index) {
        return new Position(index);
    }

    /**
     * 문자열 키 생성.
     *
     * @param value 문자열 값
     * @return Text 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static Text of(String value) {
        return new Text(value, null);
    }

    /**
     * 식별자 키 생성.
     *
     * @param value UUID 값
     * @return Identifier 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static Identifier of(UUID value) {
        return new Identifier(value, null);
    }

    /**
     * 정수 키 생성.
     *
     * @param value 정수 값
     * @return Numeric 인스턴스
     */
    static Numeric number(long value) {
        return new Numeric(value, null);
    }

    /**
     * 값 기반 키.
     *
     * <p>선언된 {@link KeyType}과 매칭되어 레코드 속성값과 비교됩니다.</p>
     */
    sealed interface ValueKey extends Key permits Text, Numeric, Identifier {

        /**
         * 이 키가 매칭하는 타입 태그.
         *
         * @return 키 타입
         */
        KeyType type();

        /**
         * 비교에 사용할 값.
         *
         * @return 키 값
         */
        Object value();

        /**
         * 검색 대상으로 지정된 projection 이름.
         *
         * @return projection 이름 (미지정 시 empty)
         */
        Optional<String> projection();

        /**
         * 특정 projection 선언으로만 검색하는 키 생성.
         *
         * @param projectionName 검색할 키 선언의 projection 이름
         * @return 같은 값을 가진 새 키
         */
        ValueKey via(String projectionName);
    }

    /**
     * 위치 키.
     *
     * @param index 레코드 위치
     */
    record Position(int index) implements Key {

        @Override
        public String toString() {
            return "Position{" + index + '}';
        }
    }

    /**
     * 문자열 키.
     *
     * @param value 문자열 값
     * @param projectionName 검색 대상 projection (null 허용)
     */
    record Text(String value, String projectionName) implements ValueKey {

        public Text {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public KeyType type() {
            return KeyType.TEXT;
        }

        @Override
        public Optional<String> projection() {
            return Optional.ofNullable(projectionName);
        }

        @Override
        public Text via(String projectionName) {
            return new Text(value, requireProjection(projectionName));
        }

        @Override
        public String toString() {
            return "Text{" + value + '}';
        }
    }

    /**
     * 정수 키.
     *
     * @param longValue 정수 값
     * @param projectionName 검색 대상 projection (null 허용)
     */
    record Numeric(long longValue, String projectionName) implements ValueKey {

        @Override
        public KeyType type() {
            return KeyType.NUMBER;
        }

        @Override
        public Object value() {
            return longValue;
        }

        @Override
        public Optional<String> projection() {
            return Optional.ofNullable(projectionName);
        }

        @Override
        public Numeric via(String projectionName) {
            return new Numeric(longValue, requireProjection(projectionName));
        }

        @Override
        public String toString() {
            return "Numeric{" + longValue + '}';
        }
    }

    /**
     * 식별자 키.
     *
     * @param value UUID 값
     * @param projectionName 검색 대상 projection (null 허용)
     */
    record Identifier(UUID value, String projectionName) implements ValueKey {

        public Identifier {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public KeyType type() {
            return KeyType.IDENTIFIER;
        }

        @Override
        public Optional<String> projection() {
            return Optional.ofNullable(projectionName);
        }

        @Override
        public Identifier via(String projectionName) {
            return new Identifier(value, requireProjection(projectionName));
        }

        @Override
        public String toString() {
            return "Identifier{" + value + '}';
        }
    }

    private static String requireProjection(String projectionName) {
        if (projectionName == null || projectionName.isBlank()) {
            throw new IllegalArgumentException("projectionName cannot be null or blank");
        }
        return projectionName;
    }
}
