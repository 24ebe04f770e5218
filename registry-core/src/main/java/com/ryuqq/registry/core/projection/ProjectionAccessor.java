package com.ryuqq.registry.core.projection;

import com.ryuqq.registry.core.exception.AttributeNotFoundException;
import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.schema.KeySchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 컬럼 projection 접근자.
 *
 * <p>요소 타입의 속성 이름으로부터 "projection 이름 → 속성 이름" 매핑을 한 번 생성합니다.
 * 매핑은 요소 타입과 스키마에만 의존하며 레코드 내용과 무관합니다.</p>
 *
 * <p><strong>이름 해석 순서:</strong></p>
 * <ol>
 *   <li>키 선언의 projection 이름 → 해당 선언의 sourceAttribute</li>
 *   <li>속성 이름의 복수형 ({@link Pluralizer}) → 해당 속성
 *       (두 속성의 복수형이 같으면 나중에 선언된 속성)</li>
 *   <li>그 외 → {@link AttributeNotFoundException}</li>
 * </ol>
 *
 * @param <T> 요소 타입
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class ProjectionAccessor<T> {

    private final RecordType<T> recordType;
    private final Map<String, String> attributeByProjection;

    /**
     * 생성자.
     *
     * @param recordType 요소 타입
     * @param schema 키 스키마 (recordType에 bind된 상태여야 함)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ProjectionAccessor(RecordType<T> recordType, KeySchema schema) {
        if (recordType == null) {
            throw new IllegalArgumentException("recordType cannot be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        this.recordType = recordType;

        Map<String, String> mapping = new LinkedHashMap<>();
        for (KeyDeclaration declaration : schema.declarations()) {
            mapping.put(declaration.projectionName(), declaration.sourceAttribute());
        }
        Set<String> keyProjections = Set.copyOf(mapping.keySet());
        for (String attribute : recordType.attributeNames()) {
            String plural = Pluralizer.pluralize(attribute);
            if (!keyProjections.contains(plural)) {
                mapping.put(plural, attribute);
            }
        }
        this.attributeByProjection = Collections.unmodifiableMap(mapping);
    }

    /**
     * 인식 가능한 projection 이름 목록 (키 projection 먼저, 이후 속성 선언 순서).
     *
     * @return 불변 이름 집합
     */
    public Set<String> projectionNames() {
        return attributeByProjection.keySet();
    }

    /**
     * projection 이름이 가리키는 속성 이름.
     *
     * @param projectionName projection 이름
     * @return 속성 이름
     * @throws AttributeNotFoundException 인식할 수 없는 이름인 경우
     */
    public String attributeFor(String projectionName) {
        String attribute = attributeByProjection.get(projectionName);
        if (attribute == null) {
            throw new AttributeNotFoundException(projectionName,
                "Registry<" + recordType.name() + "> has no attribute '" + projectionName + "'");
        }
        return attribute;
    }

    /**
     * 모든 레코드에서 속성값을 순서대로 수집.
     *
     * @param projectionName projection 이름
     * @param records 저장소 순서의 레코드
     * @return 속성값 목록 (레코드가 없으면 빈 목록, null 값 포함 가능)
     * @throws AttributeNotFoundException 인식할 수 없는 이름인 경우
     */
    public List<Object> project(String projectionName, List<T> records) {
        String attribute = attributeFor(projectionName);
        List<Object> values = new ArrayList<>(records.size());
        for (T record : records) {
            values.add(recordType.read(record, attribute));
        }
        return Collections.unmodifiableList(values);
    }
}
