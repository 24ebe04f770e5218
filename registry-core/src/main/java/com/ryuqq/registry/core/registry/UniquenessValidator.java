package com.ryuqq.registry.core.registry;

import com.ryuqq.registry.core.exception.DuplicateKeyException;
import com.ryuqq.registry.core.model.KeyDeclaration;
import com.ryuqq.registry.core.model.RecordType;
import com.ryuqq.registry.core.schema.KeySchema;
import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;

import java.util.List;
import java.util.Objects;

/**
 * 키 유일성 검증기.
 *
 * <p>식별자 타입이 아닌 모든 키 선언에 대해, 후보 레코드의 속성값이
 * 기존 레코드와 충돌하는지 스키마 순서대로 검사합니다.
 * 첫 번째 충돌에서 {@link DuplicateKeyException}을 발생시킵니다.</p>
 *
 * <p>저장소에 쓰기 전에 호출되어야 하며, 검증 자체는 저장소를 변경하지 않습니다.
 * 비용은 키당 O(n)입니다.</p>
 *
 * @param <T> 요소 타입
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class UniquenessValidator<T> {

    /**
     * 제외할 위치가 없음을 나타내는 값.
     */
    public static final int NO_EXCLUSION = -1;

    private final RecordType<T> recordType;
    private final List<KeyDeclaration> uniqueDeclarations;
    private final RegistryEventSink eventSink;

    /**
     * 생성자.
     *
     * @param recordType 요소 타입
     * @param schema 키 스키마
     * @param eventSink 이벤트 싱크
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public UniquenessValidator(RecordType<T> recordType, KeySchema schema, RegistryEventSink eventSink) {
        if (recordType == null || schema == null || eventSink == null) {
            throw new IllegalArgumentException("recordType, schema and eventSink are required");
        }
        this.recordType = recordType;
        this.uniqueDeclarations = schema.uniqueDeclarations();
        this.eventSink = eventSink;
    }

    /**
     * 후보 레코드의 유일성 검증.
     *
     * @param candidate 쓰기 대상 레코드
     * @param records 현재 저장소 레코드 (저장소 순서)
     * @param excludeIndex 검사에서 제외할 위치 (replace 대상), 없으면 {@link #NO_EXCLUSION}
     * @throws DuplicateKeyException 충돌하는 레코드가 있는 경우
     */
    public void checkUnique(T candidate, List<T> records, int excludeIndex) {
        for (KeyDeclaration declaration : uniqueDeclarations) {
            String attribute = declaration.sourceAttribute();
            Object candidateValue = declaration.matchType().normalize(recordType.read(candidate, attribute));

            for (int i = 0; i < records.size(); i++) {
                if (i == excludeIndex) {
                    continue;
                }
                Object existing = declaration.matchType().normalize(recordType.read(records.get(i), attribute));
                if (Objects.equals(existing, candidateValue)) {
                    eventSink.emit(new RegistryEvent.DuplicateRejected(declaration.projectionName(), candidateValue));
                    throw new DuplicateKeyException(declaration.projectionName(), candidateValue);
                }
            }
        }
    }
}
