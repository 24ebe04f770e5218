package com.ryuqq.registry.core.registry;

import com.ryuqq.registry.core.exception.AmbiguousKeyException;
import com.ryuqq.registry.core.exception.AttributeNotFoundException;
import com.ryuqq.registry.core.exception.CountMismatchException;
import com.ryuqq.registry.core.exception.DuplicateKeyException;
import com.ryuqq.registry.core.exception.IndexOutOfRangeException;
import com.ryuqq.registry.core.exception.KeyNotFoundException;
import com.ryuqq.registry.core.exception.SchemaException;
import com.ryuqq.registry.core.model.Key;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.projection.ProjectionAccessor;
import com.ryuqq.registry.core.schema.KeySchema;
import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;
import com.ryuqq.registry.core.spi.noop.NoOpRegistryEventSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 다중 키 인덱스 레코드 저장소.
 *
 * <p>KeyedRegistry는 한 요소 타입의 레코드를 삽입 순서대로 보관하며,
 * {@link KeySchema}에 선언된 어떤 키로도 레코드를 조회할 수 있습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>식별자 타입이 아닌 모든 키에 대해, 어떤 두 레코드도 같은 속성값을 갖지 않음</li>
 *   <li>삽입 순서가 반복 순서이며, 삭제 후에도 나머지 레코드의 상대 순서 유지</li>
 *   <li>읽기 메서드는 내부 목록이 아닌 복사본을 반환</li>
 * </ul>
 *
 * <p><strong>배치 연산:</strong> append, replace, delete는 롤백하지 않습니다.
 * 배치 중간에 실패하면 이전 항목의 결과는 그대로 남습니다.</p>
 *
 * <p><strong>동시성:</strong> 내부 동기화 없음. 여러 스레드에서 공유할 경우 호출자가 접근을 직렬화해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * KeySchema schema = KeySchema.of(
 *     KeyDeclaration.of("names", "name", KeyType.TEXT),
 *     KeyDeclaration.of("ids", "id", KeyType.IDENTIFIER)
 * );
 * KeyedRegistry&lt;Person&gt; people = KeyedRegistry.create(RecordType.ofRecord(Person.class), schema);
 *
 * people.append(new Person("Alice", aliceId));
 * Person alice = people.get(Key.of("Alice"));
 * List&lt;Object&gt; names = people.project("names");
 * people.delete(Key.of(aliceId));
 * </pre>
 *
 * @param <T> 요소 타입
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class KeyedRegistry<T> implements Iterable<T> {

    private final RecordType<T> recordType;
    private final KeySchema schema;
    private final RegistryEventSink eventSink;
    private final UniquenessValidator<T> validator;
    private final IndexResolver<T> resolver;
    private final ProjectionAccessor<T> projections;
    private final List<T> records;

    private KeyedRegistry(RecordType<T> recordType, KeySchema schema, List<T> initialRecords,
                          RegistryEventSink eventSink) {
        if (recordType == null) {
            throw new IllegalArgumentException("recordType cannot be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        if (initialRecords == null) {
            throw new IllegalArgumentException("initialRecords cannot be null");
        }
        if (eventSink == null) {
            throw new IllegalArgumentException("eventSink cannot be null");
        }
        schema.bind(recordType);

        this.recordType = recordType;
        this.schema = schema;
        this.eventSink = eventSink;
        this.validator = new UniquenessValidator<>(recordType, schema, eventSink);
        this.resolver = new IndexResolver<>(recordType, schema, eventSink);
        this.projections = new ProjectionAccessor<>(recordType, schema);
        this.records = new ArrayList<>();

        // 초기 레코드도 append와 동일한 유일성 검증을 거친다
        for (T record : initialRecords) {
            requireRecord(record);
            validator.checkUnique(record, records, UniquenessValidator.NO_EXCLUSION);
            records.add(record);
        }
        eventSink.emit(new RegistryEvent.Initialized(recordType.name(), records.size(), schema.projectionNames()));
    }

    /**
     * 빈 레지스트리 생성.
     *
     * @param recordType 요소 타입
     * @param schema 키 스키마
     * @param <T> 요소 타입
     * @return KeyedRegistry 인스턴스
     * @throws SchemaException 스키마가 요소 타입에 없는 속성을 참조하는 경우
     */
    public static <T> KeyedRegistry<T> create(RecordType<T> recordType, KeySchema schema) {
        return new KeyedRegistry<>(recordType, schema, List.of(), NoOpRegistryEventSink.INSTANCE);
    }

    /**
     * 초기 레코드를 가진 레지스트리 생성.
     *
     * @param recordType 요소 타입
     * @param schema 키 스키마
     * @param initialRecords 초기 레코드 (순서대로 유일성 검증)
     * @param <T> 요소 타입
     * @return KeyedRegistry 인스턴스
     * @throws SchemaException 스키마가 요소 타입에 없는 속성을 참조하는 경우
     * @throws DuplicateKeyException 초기 레코드끼리 키가 충돌하는 경우
     */
    public static <T> KeyedRegistry<T> create(RecordType<T> recordType, KeySchema schema, List<T> initialRecords) {
        return new KeyedRegistry<>(recordType, schema, initialRecords, NoOpRegistryEventSink.INSTANCE);
    }

    /**
     * 이벤트 싱크를 지정한 레지스트리 생성.
     *
     * @param recordType 요소 타입
     * @param schema 키 스키마
     * @param initialRecords 초기 레코드
     * @param eventSink 이벤트 싱크
     * @param <T> 요소 타입
     * @return KeyedRegistry 인스턴스
     * @throws SchemaException 스키마가 요소 타입에 없는 속성을 참조하는 경우
     * @throws DuplicateKeyException 초기 레코드끼리 키가 충돌하는 경우
     */
    public static <T> KeyedRegistry<T> create(RecordType<T> recordType, KeySchema schema, List<T> initialRecords,
                                              RegistryEventSink eventSink) {
        return new KeyedRegistry<>(recordType, schema, initialRecords, eventSink);
    }

    // ============================================================
    // Mutation
    // ============================================================

    /**
     * 레코드 추가.
     *
     * @param record 추가할 레코드
     * @throws IllegalArgumentException record가 null인 경우
     * @throws DuplicateKeyException 키가 기존 레코드와 충돌하는 경우 (레코드는 추가되지 않음)
     */
    public void append(T record) {
        requireRecord(record);
        validator.checkUnique(record, records, UniquenessValidator.NO_EXCLUSION);
        records.add(record);
        eventSink.emit(new RegistryEvent.Appended(record, records.size() - 1, records.size()));
    }

    /**
     * 레코드 여러 건을 순서대로 추가.
     *
     * <p>첫 번째 충돌에서 중단하며, 그 이전에 추가된 레코드는 남습니다.</p>
     *
     * @param newRecords 추가할 레코드 목록
     * @throws IllegalArgumentException 목록 또는 요소가 null인 경우
     * @throws DuplicateKeyException 키가 충돌하는 경우
     */
    public void append(List<? extends T> newRecords) {
        if (newRecords == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        for (T record : newRecords) {
            append(record);
        }
    }

    /**
     * 키가 가리키는 레코드를 교체.
     *
     * @param key 위치 키 또는 값 키
     * @param value 새 레코드
     * @throws KeyNotFoundException 값 키와 일치하는 레코드가 없는 경우
     * @throws IndexOutOfRangeException 위치 키가 범위를 벗어난 경우
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     * @throws DuplicateKeyException 새 레코드가 다른 레코드와 충돌하는 경우
     */
    public void replace(Key key, T value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        replace(Collections.singletonList(key), Collections.singletonList(value));
    }

    /**
     * 키 목록이 가리키는 레코드들을 순서대로 교체.
     *
     * <p>각 쌍은 해당 위치를 제외하고 유일성 검증을 거칩니다. 중간에 실패하면 이전 교체는 남습니다.</p>
     *
     * @param keys 키 목록
     * @param values 새 레코드 목록 (keys와 같은 크기)
     * @throws CountMismatchException 크기가 다른 경우
     * @throws DuplicateKeyException 새 레코드가 다른 레코드와 충돌하는 경우
     */
    public void replace(List<? extends Key> keys, List<? extends T> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        List<Integer> indices = resolver.resolveIndices(keys, records);
        if (indices.size() != values.size()) {
            throw new CountMismatchException(indices.size(), values.size());
        }
        for (int i = 0; i < indices.size(); i++) {
            int index = indices.get(i);
            T value = values.get(i);
            requireRecord(value);
            validator.checkUnique(value, records, index);
            T previous = records.set(index, value);
            eventSink.emit(new RegistryEvent.Replaced(index, previous, value));
        }
    }

    /**
     * 키가 가리키는 레코드 삭제.
     *
     * @param key 위치 키 또는 값 키
     * @throws KeyNotFoundException 값 키와 일치하는 레코드가 없는 경우
     * @throws IndexOutOfRangeException 위치 키가 범위를 벗어난 경우
     */
    public void delete(Key key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        delete(Collections.singletonList(key));
    }

    /**
     * 키 목록이 가리키는 레코드들을 삭제.
     *
     * <p>모든 키를 먼저 현재 위치로 해석한 뒤, 큰 위치부터 제거하므로
     * 앞선 제거가 뒤의 위치를 무효화하지 않습니다. 같은 레코드를 여러 번 지정해도 한 번만 삭제됩니다.</p>
     *
     * @param keys 키 목록
     * @throws KeyNotFoundException 값 키와 일치하는 레코드가 없는 경우 (아무것도 삭제되지 않음)
     */
    public void delete(List<? extends Key> keys) {
        List<Integer> indices = resolver.resolveIndices(keys, records).stream()
            .distinct()
            .sorted(Comparator.reverseOrder())
            .collect(Collectors.toList());
        for (int index : indices) {
            T removed = records.remove(index);
            eventSink.emit(new RegistryEvent.Deleted(index, removed, records.size()));
        }
    }

    /**
     * 모든 레코드 삭제. 키 스키마는 유지됩니다.
     */
    public void clear() {
        int removed = records.size();
        records.clear();
        eventSink.emit(new RegistryEvent.Cleared(removed));
    }

    // ============================================================
    // Read
    // ============================================================

    /**
     * 키가 가리키는 레코드 조회.
     *
     * @param key 위치 키 또는 값 키
     * @return 레코드
     * @throws KeyNotFoundException 값 키와 일치하는 레코드가 없는 경우
     * @throws IndexOutOfRangeException 위치 키가 범위를 벗어난 경우
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     */
    public T get(Key key) {
        return records.get(resolver.resolveIndex(key, records));
    }

    /**
     * 키 목록이 가리키는 레코드들을 키 순서대로 조회.
     *
     * @param keys 키 목록
     * @return 레코드 목록 (불변)
     */
    public List<T> getAll(List<? extends Key> keys) {
        List<T> result = new ArrayList<>();
        for (int index : resolver.resolveIndices(keys, records)) {
            result.add(records.get(index));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 값 키로 레코드 검색.
     *
     * @param key 값 키
     * @return 레코드 (없으면 empty)
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     */
    public Optional<T> find(Key.ValueKey key) {
        OptionalInt index = resolver.findIndex(key, records);
        return index.isPresent() ? Optional.of(records.get(index.getAsInt())) : Optional.empty();
    }

    /**
     * 값 키와 일치하는 레코드 존재 여부.
     *
     * @param key 값 키
     * @return 존재하면 true
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     */
    public boolean contains(Key.ValueKey key) {
        return resolver.findIndex(key, records).isPresent();
    }

    /**
     * 값 키가 가리키는 현재 위치.
     *
     * @param key 값 키
     * @return 위치 (없으면 empty)
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     */
    public OptionalInt indexOf(Key.ValueKey key) {
        return resolver.findIndex(key, records);
    }

    /**
     * 키를 현재 위치로 해석.
     *
     * @param key 위치 키 또는 값 키
     * @return 위치
     */
    public int resolveIndex(Key key) {
        return resolver.resolveIndex(key, records);
    }

    /**
     * 키 목록을 현재 위치 목록으로 해석 (입력 순서 유지, 중복 허용).
     *
     * @param keys 키 목록
     * @return 위치 목록
     */
    public List<Integer> resolveIndices(List<? extends Key> keys) {
        return resolver.resolveIndices(keys, records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * 현재 레코드의 불변 복사본 (저장소 순서).
     *
     * @return 레코드 목록
     */
    public List<T> records() {
        return List.copyOf(records);
    }

    /**
     * 호출 시점의 레코드를 저장소 순서로 순회.
     *
     * <p>반환된 Iterator는 이후의 변경을 관찰하지 않습니다.</p>
     */
    @Override
    public Iterator<T> iterator() {
        return records().iterator();
    }

    public Stream<T> stream() {
        return records().stream();
    }

    // ============================================================
    // Projection
    // ============================================================

    /**
     * 한 속성의 값을 모든 레코드에 걸쳐 저장소 순서로 반환.
     *
     * @param projectionName 키 projection 이름 또는 속성 이름의 복수형 (예: "names")
     * @return 속성값 목록
     * @throws AttributeNotFoundException 인식할 수 없는 이름인 경우
     */
    public List<Object> project(String projectionName) {
        return projections.project(projectionName, records);
    }

    /**
     * 타입을 지정한 projection.
     *
     * @param projectionName projection 이름
     * @param valueType 값 타입
     * @param <V> 값 타입
     * @return 속성값 목록 (null 값 포함 가능)
     * @throws AttributeNotFoundException 인식할 수 없는 이름인 경우
     * @throws ClassCastException 값이 valueType이 아닌 경우
     */
    public <V> List<V> project(String projectionName, Class<V> valueType) {
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        List<V> values = new ArrayList<>();
        for (Object value : project(projectionName)) {
            values.add(valueType.cast(value));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * 인식 가능한 projection 이름 목록.
     *
     * @return 키 projection 이름, 이후 속성 복수형 이름
     */
    public List<String> projectionNames() {
        return List.copyOf(projections.projectionNames());
    }

    public KeySchema keySchema() {
        return schema;
    }

    public RecordType<T> recordType() {
        return recordType;
    }

    private static void requireRecord(Object record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
    }

    @Override
    public String toString() {
        return String.format("Registry<%s>: %d records, keys: [%s]",
            recordType.name(), records.size(), String.join(", ", schema.projectionNames()));
    }
}
