package com.vuong.genericcrud.core.domain.model;

import com.vuong.genericcrud.util.ZeroValues;

/**
 * Capability every record handled by the generic CRUD service must expose.
 * @param <ID> the primary key type
 */
public interface Identifiable<ID> {

    /**
     * Returns the primary key of this record, possibly still unassigned.
     * @return the primary key or {@code null}
     */
    ID getPrimaryKey();

    /**
     * Tells whether the primary key holds a non-zero value.
     * Updates and deletes refuse to run without one.
     * @return true when the key is assigned
     */
    default boolean hasPrimaryKey() {
        return !ZeroValues.isZero(getPrimaryKey());
    }
}
