package com.ryuqq.ramify.core.model;

/**
 * Kind of mutation reported to collection observers.
 *
 * <p><strong>Key list per operation:</strong></p>
 * <ul>
 *   <li>CREATE: primary keys written by put/add (including replacements)</li>
 *   <li>UPDATE: primary keys changed by update/modify</li>
 *   <li>DELETE: primary keys removed by delete</li>
 *   <li>CLEAR: always empty, the whole collection was wiped</li>
 * </ul>
 *
 * @author Ramify Team
 * @since 1.0.0
 */
public enum CollectionOperation {

    CREATE,
    UPDATE,
    DELETE,
    CLEAR
}
