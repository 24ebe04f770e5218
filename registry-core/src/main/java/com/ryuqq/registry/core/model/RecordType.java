package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.exception.AttributeNotFoundException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 레지스트리 요소 타입의 속성 계약.
 *
 * <p>RecordType은 요소 타입의 이름과 순서가 있는 속성 목록(이름 → 접근자)을 보관합니다.
 * 속성 목록은 생성 시 한 번 확정되며, 이후 조회마다 리플렉션을 수행하지 않습니다.</p>
 *
 * <p><strong>생성 방법:</strong></p>
 * <pre>
 * // 1. 명시적 선언
 * RecordType&lt;Person&gt; type = RecordType.&lt;Person&gt;builder("Person")
 *     .attribute("name", Person::name)
 *     .attribute("id", Person::id)
 *     .build();
 *
 * // 2. Java record 컴포넌트에서 도출
 * RecordType&lt;Person&gt; type = RecordType.ofRecord(Person.class);
 * </pre>
 *
 * @param <T> 요소 타입
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class RecordType<T> {

    private final String name;
    private final Map<String, Function<? super T, ?>> attributes;

    private RecordType(String name, Map<String, Function<? super T, ?>> attributes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (attributes.isEmpty()) {
            throw new IllegalArgumentException("RecordType '" + name + "' must declare at least one attribute");
        }
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * 명시적 선언용 Builder 생성.
     *
     * @param name 타입 이름 (요약 문자열에 사용)
     * @param <T> 요소 타입
     * @return Builder
     */
    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * Java record 클래스의 컴포넌트로부터 RecordType 생성.
     *
     * <p>컴포넌트 선언 순서가 속성 순서가 됩니다.</p>
     *
     * @param recordClass record 클래스
     * @param <R> record 타입
     * @return RecordType 인스턴스
     * @throws IllegalArgumentException recordClass가 null이거나 record가 아닌 경우
     */
    public static <R extends Record> RecordType<R> ofRecord(Class<R> recordClass) {
        if (recordClass == null) {
            throw new IllegalArgumentException("recordClass cannot be null");
        }
        if (!recordClass.isRecord()) {
            throw new IllegalArgumentException(recordClass.getName() + " is not a record class");
        }
        Builder<R> builder = new Builder<>(recordClass.getSimpleName());
        for (RecordComponent component : recordClass.getRecordComponents()) {
            Method accessor = component.getAccessor();
            accessor.setAccessible(true);
            builder.attribute(component.getName(), record -> invoke(accessor, record));
        }
        return builder.build();
    }

    private static Object invoke(Method accessor, Object record) {
        try {
            return accessor.invoke(record);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access record component " + accessor.getName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Record component " + accessor.getName() + " threw", e.getCause());
        }
    }

    /**
     * 타입 이름 조회.
     *
     * @return 타입 이름
     */
    public String name() {
        return name;
    }

    /**
     * 선언 순서대로 정렬된 속성 이름 목록.
     *
     * @return 불변 속성 이름 목록
     */
    public List<String> attributeNames() {
        return List.copyOf(attributes.keySet());
    }

    /**
     * 속성 존재 여부 확인.
     *
     * @param attribute 속성 이름
     * @return 선언된 속성이면 true
     */
    public boolean hasAttribute(String attribute) {
        return attributes.containsKey(attribute);
    }

    /**
     * 레코드에서 속성값 읽기.
     *
     * @param record 레코드
     * @param attribute 속성 이름
     * @return 속성값 (null 가능)
     * @throws AttributeNotFoundException 선언되지 않은 속성인 경우
     */
    public Object read(T record, String attribute) {
        Function<? super T, ?> accessor = attributes.get(attribute);
        if (accessor == null) {
            throw new AttributeNotFoundException(attribute,
                "RecordType '" + name + "' has no attribute '" + attribute + "'");
        }
        return accessor.apply(record);
    }

    @Override
    public String toString() {
        return "RecordType{" + name + ", attributes=" + attributes.keySet() + '}';
    }

    /**
     * RecordType Builder.
     *
     * @param <T> 요소 타입
     */
    public static final class Builder<T> {

        private final String name;
        private final Map<String, Function<? super T, ?>> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * 속성 추가.
         *
         * @param attribute 속성 이름
         * @param accessor 속성 접근자
         * @return this
         * @throws IllegalArgumentException 이름이 비었거나 접근자가 null, 또는 이미 선언된 이름인 경우
         */
        public Builder<T> attribute(String attribute, Function<? super T, ?> accessor) {
            if (attribute == null || attribute.isBlank()) {
                throw new IllegalArgumentException("attribute cannot be null or blank");
            }
            if (accessor == null) {
                throw new IllegalArgumentException("accessor cannot be null");
            }
            if (attributes.putIfAbsent(attribute, accessor) != null) {
                throw new IllegalArgumentException("attribute '" + attribute + "' already declared");
            }
            return this;
        }

        /**
         * RecordType 생성.
         *
         * @return RecordType 인스턴스
         * @throws IllegalArgumentException 이름이 비었거나 속성이 없는 경우
         */
        public RecordType<T> build() {
            return new RecordType<>(name, attributes);
        }
    }
}
