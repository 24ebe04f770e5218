package com.ryuqq.registry.core.registry;

import com.ryuqq.registry.core.exception.AmbiguousKeyException;
import com.ryuqq.registry.core.exception.IndexOutOfRangeException;
import com.ryuqq.registry.core.exception.KeyNotFoundException;
import com.ryuqq.registry.core.model.Key;
import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.schema.KeySchema;
import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 키 → 레코드 위치 해석기.
 *
 * <p><strong>해석 규칙:</strong></p>
 * <ul>
 *   <li>{@link Key.Position}: {@code 0 <= index < size} 검증 후 그대로 사용</li>
 *   <li>{@link Key.ValueKey}: 스키마 순서상 같은 타입의 <strong>첫 번째</strong> 선언만 검색
 *       (projection 지정 시 해당 선언만 검색)</li>
 *   <li>일치 0건: not found (findIndex는 empty, resolveIndex는 {@link KeyNotFoundException})</li>
 *   <li>일치 2건 이상: {@link AmbiguousKeyException}</li>
 * </ul>
 *
 * @param <T> 요소 타입
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class IndexResolver<T> {

    private final RecordType<T> recordType;
    private final KeySchema schema;
    private final RegistryEventSink eventSink;

    /**
     * 생성자.
     *
     * @param recordType 요소 타입
     * @param schema 키 스키마
     * @param eventSink 이벤트 싱크
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public IndexResolver(RecordType<T> recordType, KeySchema schema, RegistryEventSink eventSink) {
        if (recordType == null || schema == null || eventSink == null) {
            throw new IllegalArgumentException("recordType, schema and eventSink are required");
        }
        this.recordType = recordType;
        this.schema = schema;
        this.eventSink = eventSink;
    }

    /**
     * 값 키로 레코드 위치 검색.
     *
     * @param key 값 키
     * @param records 현재 저장소 레코드
     * @return 위치 (일치하는 레코드 또는 매칭되는 선언이 없으면 empty)
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     * @throws IllegalArgumentException 지정한 projection이 없거나 키 타입과 맞지 않는 경우
     */
    public OptionalInt findIndex(Key.ValueKey key, List<T> records) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Optional<KeyDeclaration> selected = select(key);
        if (selected.isEmpty()) {
            eventSink.emit(new RegistryEvent.KeyResolved(null, key.value(), -1));
            return OptionalInt.empty();
        }

        KeyDeclaration declaration = selected.get();
        List<Integer> matches = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Object value = declaration.matchType().normalize(recordType.read(records.get(i), declaration.sourceAttribute()));
            if (Objects.equals(value, key.value())) {
                matches.add(i);
            }
        }

        if (matches.size() > 1) {
            throw new AmbiguousKeyException(key.value(), declaration.projectionName(), matches.size());
        }
        int index = matches.isEmpty() ? -1 : matches.get(0);
        eventSink.emit(new RegistryEvent.KeyResolved(declaration.projectionName(), key.value(), index));
        return index < 0 ? OptionalInt.empty() : OptionalInt.of(index);
    }

    private Optional<KeyDeclaration> select(Key.ValueKey key) {
        if (key.projection().isEmpty()) {
            return schema.firstMatching(key.type());
        }
        String projectionName = key.projection().get();
        KeyDeclaration declaration = schema.named(projectionName)
            .orElseThrow(() -> new IllegalArgumentException("No key declaration named '" + projectionName + "'"));
        if (declaration.matchType() != key.type()) {
            throw new IllegalArgumentException(String.format(
                "Key declaration '%s' matches %s, not %s", projectionName, declaration.matchType(), key.type()));
        }
        return Optional.of(declaration);
    }

    /**
     * 키를 레코드 위치로 해석.
     *
     * @param key 위치 키 또는 값 키
     * @param records 현재 저장소 레코드
     * @return 위치
     * @throws IndexOutOfRangeException 위치 키가 범위를 벗어난 경우
     * @throws KeyNotFoundException 값 키와 일치하는 레코드가 없는 경우
     * @throws AmbiguousKeyException 둘 이상의 레코드가 일치하는 경우
     */
    public int resolveIndex(Key key, List<T> records) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (key instanceof Key.Position position) {
            int index = position.index();
            if (index < 0 || index >= records.size()) {
                throw new IndexOutOfRangeException(index, records.size());
            }
            return index;
        }
        Key.ValueKey valueKey = (Key.ValueKey) key;
        OptionalInt index = findIndex(valueKey, records);
        if (index.isEmpty()) {
            throw new KeyNotFoundException(valueKey.value());
        }
        return index.getAsInt();
    }

    /**
     * 키 목록을 위치 목록으로 해석.
     *
     * <p>결과는 입력 순서를 따르며, 같은 위치가 여러 번 나올 수 있습니다.</p>
     *
     * @param keys 순서가 있는 키 목록
     * @param records 현재 저장소 레코드
     * @return 위치 목록 (불변)
     * @throws IllegalArgumentException keys가 null인 경우
     */
    public List<Integer> resolveIndices(List<? extends Key> keys, List<T> records) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        List<Integer> indices = new ArrayList<>(keys.size());
        for (Key key : keys) {
            indices.add(resolveIndex(key, records));
        }
        return Collections.unmodifiableList(indices);
    }
}
