/**
 * Reusable contract tests for registries wired with a {@link com.ryuqq.registry.core.spi.RegistryEventSink}.
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.testkit.contract;
