package com.ryuqq.registry.adapter.slf4j;

/**
 * Slf4jRegistryEventSink 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>loggerName: 이벤트를 기록할 로거 이름 (기본 "com.ryuqq.registry")</li>
 *   <li>includeRecordValues: 로그에 레코드와 키 값을 포함할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p>레코드에 개인정보가 담기는 경우 includeRecordValues=false로 두면
 * 값 대신 위치와 개수만 기록됩니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param loggerName 로거 이름 (공백 불가)
 * @param includeRecordValues 레코드 값 기록 여부
 */
public record LoggingSinkConfig(String loggerName, boolean includeRecordValues) {

    public static final String DEFAULT_LOGGER_NAME = "com.ryuqq.registry";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: loggerName="com.ryuqq.registry", includeRecordValues=true</p>
     */
    public LoggingSinkConfig() {
        this(DEFAULT_LOGGER_NAME, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException loggerName이 null이거나 공백인 경우
     */
    public LoggingSinkConfig {
        if (loggerName == null || loggerName.isBlank()) {
            throw new IllegalArgumentException("loggerName cannot be null or blank");
        }
    }

    /**
     * loggerName만 변경한 새 인스턴스 생성.
     *
     * @param loggerName 새로운 로거 이름
     * @return 새 LoggingSinkConfig 인스턴스
     */
    public LoggingSinkConfig withLoggerName(String loggerName) {
        return new LoggingSinkConfig(loggerName, this.includeRecordValues);
    }

    /**
     * includeRecordValues만 변경한 새 인스턴스 생성.
     *
     * @param includeRecordValues 레코드 값 기록 여부
     * @return 새 LoggingSinkConfig 인스턴스
     */
    public LoggingSinkConfig withIncludeRecordValues(boolean includeRecordValues) {
        return new LoggingSinkConfig(this.loggerName, includeRecordValues);
    }
}
