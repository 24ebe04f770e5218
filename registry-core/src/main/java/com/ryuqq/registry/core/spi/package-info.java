/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the extension points the core calls out to. The core ships
 * only a no-op implementation; adapter modules provide the real ones.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.spi.RegistryEventSink} - Receives {@link com.ryuqq.registry.core.spi.RegistryEvent}s</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code registry-core}: {@link com.ryuqq.registry.core.spi.noop.NoOpRegistryEventSink}</li>
 *   <li>{@code registry-adapter-slf4j}: SLF4J logging sink</li>
 *   <li>{@code registry-testkit}: recording sink for assertions</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.spi;
