/**
 * Key schema validation.
 *
 * <p>{@link com.ryuqq.registry.core.schema.KeySchema} is validated once, when it is created,
 * and bound once to the element type when a registry is built. It never changes afterwards.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.schema;
