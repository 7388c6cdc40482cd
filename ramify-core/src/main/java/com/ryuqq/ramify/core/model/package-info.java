/**
 * Core value types shared by collections, queries and observers.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ramify.core.model.Schema} - primary key and index declarations</li>
 *   <li>{@link com.ryuqq.ramify.core.model.IndexValue} - tagged primitive key with total ordering</li>
 *   <li>{@link com.ryuqq.ramify.core.model.CollectionOperation} - mutation kinds</li>
 *   <li>{@link com.ryuqq.ramify.core.model.ChangeEvent} - operation plus affected keys</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> all value objects are immutable</li>
 *   <li><strong>Validation:</strong> constructors reject invalid input with IllegalArgumentException</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ramify Team
 */
package com.ryuqq.ramify.core.model;
