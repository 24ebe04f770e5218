package com.ryuqq.registry.testkit;

import com.ryuqq.registry.core.spi.RegistryEvent;
import com.ryuqq.registry.core.spi.RegistryEventSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory {@link RegistryEventSink} that keeps every event for later assertions.
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RecordingEventSink sink = new RecordingEventSink();
 * KeyedRegistry&lt;Person&gt; registry = KeyedRegistry.create(Person.TYPE, Person.SCHEMA, List.of(), sink);
 * registry.append(alice);
 *
 * assertThat(sink.eventsOf(RegistryEvent.Appended.class)).hasSize(1);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class RecordingEventSink implements RegistryEventSink {

    private final List<RegistryEvent> events = new ArrayList<>();

    @Override
    public void emit(RegistryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    /**
     * Returns all recorded events in emission order.
     *
     * @return unmodifiable copy of the events
     */
    public List<RegistryEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /**
     * Returns the recorded events of one type, in emission order.
     *
     * @param type the event type
     * @param <E> event type
     * @return matching events
     */
    public <E extends RegistryEvent> List<E> eventsOf(Class<E> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    /**
     * Returns the most recent event.
     *
     * @return last event
     * @throws IllegalStateException if nothing was recorded
     */
    public RegistryEvent lastEvent() {
        if (events.isEmpty()) {
            throw new IllegalStateException("No events recorded");
        }
        return events.get(events.size() - 1);
    }

    /**
     * Clears all recorded events.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        events.clear();
    }
}
