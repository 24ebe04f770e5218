package com.ryuqq.registry.core.spi.noop;

import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;

/**
 * RegistryEventSink NoOp 구현.
 *
 * <p>모든 이벤트를 버립니다. 이벤트 싱크를 지정하지 않은 레지스트리의 기본값입니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class NoOpRegistryEventSink implements RegistryEventSink {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final NoOpRegistryEventSink INSTANCE = new NoOpRegistryEventSink();

    @Override
    public void emit(RegistryEvent event) {
        // NoOp
    }
}
