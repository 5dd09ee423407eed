package com.regesh.table;

import com.regesh.model.TableEntity;

/**
 * Write side of a table: inserts one entity at a time.
 */
public interface EntityStore {

    /**
     * Inserts a new entity.  Fails if an entity with the same partition and row key
     * already exists; entities are never overwritten.
     *
     * @throws Exception on any failure; the caller counts it and moves on
     */
    void insert(TableEntity entity) throws Exception;
}
