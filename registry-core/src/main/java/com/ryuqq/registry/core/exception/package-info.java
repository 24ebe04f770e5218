/**
 * Registry error taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.exception.SchemaException} - Invalid key schema (construction only)</li>
 *   <li>{@link com.ryuqq.registry.core.exception.DuplicateKeyException} - Write would break key uniqueness</li>
 *   <li>{@link com.ryuqq.registry.core.exception.AmbiguousKeyException} - Key value matched several records</li>
 *   <li>{@link com.ryuqq.registry.core.exception.KeyNotFoundException} - Key value matched nothing</li>
 *   <li>{@link com.ryuqq.registry.core.exception.IndexOutOfRangeException} - Position outside the store</li>
 *   <li>{@link com.ryuqq.registry.core.exception.CountMismatchException} - Batch replace with unequal sizes</li>
 *   <li>{@link com.ryuqq.registry.core.exception.AttributeNotFoundException} - Unknown attribute or projection</li>
 * </ul>
 *
 * <p>Null or malformed arguments are rejected with {@link java.lang.IllegalArgumentException}
 * before any of the above can occur.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.exception;
