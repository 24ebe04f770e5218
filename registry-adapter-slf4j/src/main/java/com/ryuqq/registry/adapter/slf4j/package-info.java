/**
 * SLF4J 어댑터.
 *
 * <p>{@link com.ryuqq.registry.adapter.slf4j.Slf4jRegistryEventSink}를 레지스트리에 연결하면
 * 모든 변경과 키 조회가 DEBUG 로그로 남습니다.</p>
 *
 * <pre>
 * KeyedRegistry&lt;Person&gt; registry = KeyedRegistry.create(
 *     Person.TYPE, Person.SCHEMA, List.of(),
 *     new Slf4jRegistryEventSink(new LoggingSinkConfig().withIncludeRecordValues(false)));
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.slf4j;
