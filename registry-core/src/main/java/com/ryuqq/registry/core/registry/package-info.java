/**
 * The indexed registry and its collaborators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.registry.KeyedRegistry} - Record store and mutation API</li>
 *   <li>{@link com.ryuqq.registry.core.registry.UniquenessValidator} - Per-key uniqueness check before every write</li>
 *   <li>{@link com.ryuqq.registry.core.registry.IndexResolver} - Key and position to index resolution</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.registry;
