package com.ryuqq.registry.core.schema;

import com.ryuqq.registry.core.exception.SchemaException;
import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.KeyType;
import com.ryuqq.registry.core.model.RecordType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 검증된 키 스키마.
 *
 * <p>KeySchema는 순서가 있는 {@link KeyDeclaration} 목록이며, 생성 후 변경할 수 없습니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>projection 이름은 유효한 식별자여야 함 (빈 문자열, 숫자만으로 된 이름 불가)</li>
 *   <li>projection 이름은 스키마 내에서 고유해야 함</li>
 *   <li>비식별자 매칭 타입은 스키마 내 최대 1개 선언</li>
 *   <li>{@link KeyType#IDENTIFIER}는 여러 선언 허용</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * KeySchema schema = KeySchema.of(
 *     KeyDeclaration.of("names", "name", KeyType.TEXT),
 *     KeyDeclaration.of("ids", "id", KeyType.IDENTIFIER)
 * );
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class KeySchema {

    private final List<KeyDeclaration> declarations;

    private KeySchema(List<KeyDeclaration> declarations) {
        this.declarations = declarations;
    }

    /**
     * KeySchema 생성 및 검증.
     *
     * @param declarations 키 선언 목록 (스키마 순서)
     * @return KeySchema 인스턴스
     * @throws IllegalArgumentException declarations가 null이거나 null 요소를 포함한 경우
     * @throws SchemaException 검증 규칙 위반 시
     */
    public static KeySchema of(List<KeyDeclaration> declarations) {
        if (declarations == null) {
            throw new IllegalArgumentException("declarations cannot be null");
        }
        if (declarations.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("declarations cannot contain null");
        }
        List<KeyDeclaration> copy = List.copyOf(declarations);
        validate(copy);
        return new KeySchema(copy);
    }

    /**
     * KeySchema 생성 및 검증.
     *
     * @param declarations 키 선언 (스키마 순서)
     * @return KeySchema 인스턴스
     * @throws SchemaException 검증 규칙 위반 시
     */
    public static KeySchema of(KeyDeclaration... declarations) {
        if (declarations == null) {
            throw new IllegalArgumentException("declarations cannot be null");
        }
        return of(Arrays.asList(declarations));
    }

    private static void validate(List<KeyDeclaration> declarations) {
        Set<String> names = new HashSet<>();
        Map<KeyType, String> seenTypes = new EnumMap<>(KeyType.class);

        for (KeyDeclaration declaration : declarations) {
            String name = declaration.projectionName();
            if (!Identifiers.isValid(name)) {
                throw new SchemaException(
                    "Invalid projection name '" + name + "'; must be a valid non-numeric identifier");
            }
            if (!names.add(name)) {
                throw new SchemaException("Duplicate projection name '" + name + "'");
            }
            if (declaration.matchType().isIdentifier()) {
                continue;
            }
            String previous = seenTypes.putIfAbsent(declaration.matchType(), name);
            if (previous != null) {
                throw new SchemaException(String.format(
                    "Duplicate match type %s used for '%s' and '%s'",
                    declaration.matchType(), previous, name));
            }
        }
    }

    /**
     * 레코드 타입에 대해 스키마를 검증.
     *
     * <p>모든 선언의 sourceAttribute가 레코드 타입에 존재해야 합니다.</p>
     *
     * @param recordType 요소 타입
     * @throws IllegalArgumentException recordType이 null인 경우
     * @throws SchemaException 존재하지 않는 속성을 참조하는 경우
     */
    public void bind(RecordType<?> recordType) {
        if (recordType == null) {
            throw new IllegalArgumentException("recordType cannot be null");
        }
        for (KeyDeclaration declaration : declarations) {
            if (!recordType.hasAttribute(declaration.sourceAttribute())) {
                throw new SchemaException(String.format(
                    "Key '%s' refers to unknown attribute '%s' of %s",
                    declaration.projectionName(), declaration.sourceAttribute(), recordType.name()));
            }
        }
    }

    /**
     * 스키마 순서의 키 선언 목록.
     *
     * @return 불변 목록
     */
    public List<KeyDeclaration> declarations() {
        return declarations;
    }

    /**
     * 유일성 검증 대상 선언 목록 (스키마 순서).
     *
     * @return 식별자 타입을 제외한 선언 목록
     */
    public List<KeyDeclaration> uniqueDeclarations() {
        return declarations.stream()
            .filter(KeyDeclaration::enforcesUniqueness)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 스키마 순서의 projection 이름 목록.
     *
     * @return 불변 목록
     */
    public List<String> projectionNames() {
        return declarations.stream()
            .map(KeyDeclaration::projectionName)
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * 주어진 타입과 매칭되는 첫 번째 선언 조회.
     *
     * <p>같은 타입의 선언이 여러 개여도 스키마 순서상 첫 번째만 반환합니다.</p>
     *
     * @param type 매칭 타입
     * @return 선언 (없으면 empty)
     */
    public Optional<KeyDeclaration> firstMatching(KeyType type) {
        return declarations.stream()
            .filter(declaration -> declaration.matchType() == type)
            .findFirst();
    }

    /**
     * projection 이름으로 선언 조회.
     *
     * @param projectionName projection 이름
     * @return 선언 (없으면 empty)
     */
    public Optional<KeyDeclaration> named(String projectionName) {
        return declarations.stream()
            .filter(declaration -> declaration.projectionName().equals(projectionName))
            .findFirst();
    }

    public int size() {
        return declarations.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeySchema that = (KeySchema) o;
        return declarations.equals(that.declarations);
    }

    @Override
    public int hashCode() {
        return declarations.hashCode();
    }

    @Override
    public String toString() {
        return "KeySchema{" + projectionNames() + '}';
    }
}
