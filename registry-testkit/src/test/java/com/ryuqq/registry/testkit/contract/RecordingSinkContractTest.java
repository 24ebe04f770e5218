package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.model.Key;
import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;
import com.ryuqq.registry.testkit.RecordingEventSink;
import com.ryuqq.registry.testkit.fixture.Person;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Tests run against {@link RecordingEventSink}, plus checks of what it records.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class RecordingSinkContractTest extends AbstractRegistryContractTest {

    @Override
    protected RegistryEventSink createEventSink() {
        return new RecordingEventSink();
    }

    private RecordingEventSink recorder() {
        return (RecordingEventSink) eventSink;
    }

    @Test
    void recorder_CapturesInitializationOfBothRegistries() {
        assertThat(recorder().eventsOf(RegistryEvent.Initialized.class))
            .extracting(RegistryEvent.Initialized::recordType)
            .containsExactly("Person", "Item");
    }

    @Test
    void recorder_CapturesMutationsInOrder() {
        // Given
        recorder().clear();
        Person alice = Person.named("Alice");

        // When
        people.append(alice);
        people.delete(Key.of("Alice"));

        // Then
        assertThat(recorder().events()).containsExactly(
            new RegistryEvent.Appended(alice, 0, 1),
            new RegistryEvent.KeyResolved("names", "Alice", 0),
            new RegistryEvent.Deleted(0, alice, 0));
        assertThat(recorder().lastEvent()).isInstanceOf(RegistryEvent.Deleted.class);
    }

    @Test
    void recorder_Empty_LastEventThrows() {
        recorder().clear();

        assertThatThrownBy(() -> recorder().lastEvent())
            .isInstanceOf(IllegalStateException.class);
    }
}
