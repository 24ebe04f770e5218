package com.ryuqq.registry.core.spi;

import java.util.List;

/**
 * Structured events emitted by a registry to its {@link RegistryEventSink}.
 *
 * <p>Record values are carried as {@code Object}; sinks decide whether to render them.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface RegistryEvent permits
        RegistryEvent.Initialized,
        RegistryEvent.Appended,
        RegistryEvent.Replaced,
        RegistryEvent.Deleted,
        RegistryEvent.Cleared,
        RegistryEvent.KeyResolved,
        RegistryEvent.DuplicateRejected {

    /**
     * Registry created and initial records loaded.
     *
     * @param recordType element type name
     * @param recordCount number of initial records
     * @param projectionNames configured key projection names
     */
    record Initialized(String recordType, int recordCount, List<String> projectionNames) implements RegistryEvent {
        public Initialized {
            projectionNames = List.copyOf(projectionNames);
        }
    }

    /**
     * Record appended.
     *
     * @param record the appended record
     * @param index position it was written to
     * @param size record count after the append
     */
    record Appended(Object record, int index, int size) implements RegistryEvent {
    }

    /**
     * Record overwritten in place.
     *
     * @param index position that was overwritten
     * @param previous the record that was replaced
     * @param current the new record
     */
    record Replaced(int index, Object previous, Object current) implements RegistryEvent {
    }

    /**
     * Record removed.
     *
     * @param index position it was removed from
     * @param record the removed record
     * @param size record count after the removal
     */
    record Deleted(int index, Object record, int size) implements RegistryEvent {
    }

    /**
     * All records removed.
     *
     * @param removed number of records removed
     */
    record Cleared(int removed) implements RegistryEvent {
    }

    /**
     * Value key lookup finished.
     *
     * @param projectionName key declaration that was searched, null if no declaration matched
     * @param value the looked-up value
     * @param index resolved position, -1 when nothing matched
     */
    record KeyResolved(String projectionName, Object value, int index) implements RegistryEvent {

        public boolean found() {
            return index >= 0;
        }
    }

    /**
     * Write rejected by the uniqueness check. The caller still receives the exception.
     *
     * @param projectionName key that collided
     * @param value colliding value
     */
    record DuplicateRejected(String projectionName, Object value) implements RegistryEvent {
    }
}
