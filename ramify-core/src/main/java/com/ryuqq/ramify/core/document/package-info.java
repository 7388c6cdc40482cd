/**
 * Type-erased document utilities.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ramify.core.document.FieldPath} - dot-notation path interpreter</li>
 *   <li>{@link com.ryuqq.ramify.core.document.Documents} - deep copy and document builders</li>
 *   <li>{@link com.ryuqq.ramify.core.document.CopyOnWriteDocument} - mutation-isolating read view</li>
 *   <li>{@link com.ryuqq.ramify.core.document.CopyOnWriteList} - list counterpart of the view</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>No reflection:</strong> documents are plain {@code Map<String, Object>} trees</li>
 *   <li><strong>Lazy isolation:</strong> reads never copy, the first write copies once</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.core.document;
