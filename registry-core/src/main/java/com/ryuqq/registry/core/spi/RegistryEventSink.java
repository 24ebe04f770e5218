package com.ryuqq.registry.core.spi;

/**
 * Observability SPI for registry lifecycle and mutation events.
 *
 * <p>The registry emits one {@link RegistryEvent} per construction, append, replace,
 * delete, clear and key resolution. Sinks only observe: they cannot veto or alter an
 * operation, and error reporting to the caller never depends on them.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Must not throw: a failing sink would turn a successful write into a failed call</li>
 *   <li>Must not call back into the emitting registry</li>
 *   <li>Called synchronously on the caller's thread</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RegistryEventSink sink = event -&gt; {
 *     if (event instanceof RegistryEvent.Appended appended) {
 *         metrics.increment("registry.appended");
 *     }
 * };
 * KeyedRegistry&lt;Person&gt; registry = KeyedRegistry.create(type, schema, List.of(), sink);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegistryEventSink {

    /**
     * Receives an event.
     *
     * @param event the event, never null
     */
    void emit(RegistryEvent event);
}
