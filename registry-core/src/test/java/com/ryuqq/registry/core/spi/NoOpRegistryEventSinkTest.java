package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.spi.noop.NoOpRegistryEventSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpRegistryEventSink 유닛 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
@DisplayName("NoOpRegistryEventSink 테스트")
class NoOpRegistryEventSinkTest {

    @Test
    @DisplayName("emit() 는 예외 없이 실행된다")
    void emit_예외_없이_실행() {
        // given
        RegistryEventSink sink = NoOpRegistryEventSink.INSTANCE;

        // when & then
        assertDoesNotThrow(() -> sink.emit(new RegistryEvent.Cleared(3)));
        assertDoesNotThrow(() -> sink.emit(new RegistryEvent.Initialized("Member", 0, List.of())));
    }

    @Test
    @DisplayName("KeyResolved.found() 는 index가 0 이상일 때만 true")
    void keyResolved_found_인덱스_기준() {
        assertTrue(new RegistryEvent.KeyResolved("names", "Alice", 0).found());
        assertFalse(new RegistryEvent.KeyResolved("names", "Alice", -1).found());
        assertFalse(new RegistryEvent.KeyResolved(null, "Alice", -1).found());
    }
}
