/**
 * Core model package: key tags, lookup keys, key declarations and the element type contract.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.KeyType} - Match type tag (TEXT, NUMBER, IDENTIFIER)</li>
 *   <li>{@link com.ryuqq.registry.core.model.Key} - Sealed lookup key (position or typed value)</li>
 *   <li>{@link com.ryuqq.registry.core.model.KeyDeclaration} - Projection name, source attribute, match type</li>
 *   <li>{@link com.ryuqq.registry.core.model.RecordType} - Ordered, named attributes of the element type</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All model types are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation rejects null and blank input</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.model;
