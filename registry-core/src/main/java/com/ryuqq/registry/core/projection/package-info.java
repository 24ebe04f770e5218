/**
 * Pluralized column projections.
 *
 * <p>The projection name table is computed once per element type and key schema.
 * Values are read in store order on every call.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.projection;
