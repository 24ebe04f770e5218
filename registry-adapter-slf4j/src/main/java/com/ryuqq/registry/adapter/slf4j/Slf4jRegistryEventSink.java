package com.ryuqq.registry.adapter.slf4j;

import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 RegistryEventSink 구현체.
 *
 * <p>레지스트리가 발행하는 모든 이벤트를 DEBUG 레벨로 기록합니다.
 * DEBUG가 비활성화된 경우 메시지를 만들지 않습니다.</p>
 *
 * <p><strong>기록 형식:</strong></p>
 * <pre>
 * Registry initialized: type=Person, records=0, keys=[names, ids]
 * Record appended at 0 (size=1): Person[name=Alice, ...]
 * Key 'names' resolved: Alice → 0
 * Duplicate rejected for key 'names': Alice
 * </pre>
 *
 * <p>includeRecordValues=false이면 레코드와 키 값은 {@value #REDACTED}로 대체됩니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Slf4jRegistryEventSink implements RegistryEventSink {

    static final String REDACTED = "<redacted>";

    private final Logger log;
    private final LoggingSinkConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public Slf4jRegistryEventSink() {
        this(new LoggingSinkConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Slf4jRegistryEventSink(LoggingSinkConfig config) {
        this(config == null ? null : LoggerFactory.getLogger(config.loggerName()), config);
    }

    Slf4jRegistryEventSink(Logger log, LoggingSinkConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
        this.config = config;
    }

    @Override
    public void emit(RegistryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!log.isDebugEnabled()) {
            return;
        }

        if (event instanceof RegistryEvent.Initialized initialized) {
            log.debug("Registry initialized: type={}, records={}, keys={}",
                initialized.recordType(), initialized.recordCount(), initialized.projectionNames());
        } else if (event instanceof RegistryEvent.Appended appended) {
            log.debug("Record appended at {} (size={}): {}",
                appended.index(), appended.size(), render(appended.record()));
        } else if (event instanceof RegistryEvent.Replaced replaced) {
            log.debug("Record replaced at {}: {} → {}",
                replaced.index(), render(replaced.previous()), render(replaced.current()));
        } else if (event instanceof RegistryEvent.Deleted deleted) {
            log.debug("Record deleted at {} (size={}): {}",
                deleted.index(), deleted.size(), render(deleted.record()));
        } else if (event instanceof RegistryEvent.Cleared cleared) {
            log.debug("Registry cleared: {} records removed", cleared.removed());
        } else if (event instanceof RegistryEvent.KeyResolved resolved) {
            logResolved(resolved);
        } else if (event instanceof RegistryEvent.DuplicateRejected rejected) {
            log.debug("Duplicate rejected for key '{}': {}",
                rejected.projectionName(), render(rejected.value()));
        }
    }

    /**
     * 현재 설정 조회.
     *
     * @return 설정
     */
    public LoggingSinkConfig config() {
        return config;
    }

    private void logResolved(RegistryEvent.KeyResolved resolved) {
        if (resolved.projectionName() == null) {
            log.debug("No key declared for value {}", render(resolved.value()));
        } else if (resolved.found()) {
            log.debug("Key '{}' resolved: {} → {}",
                resolved.projectionName(), render(resolved.value()), resolved.index());
        } else {
            log.debug("Key '{}' has no match for {}",
                resolved.projectionName(), render(resolved.value()));
        }
    }

    private Object render(Object value) {
        return config.includeRecordValues() ? value : REDACTED;
    }
}
