package com.regesh.table;

import java.io.Closeable;

/**
 * A table that can be created, written to and scanned.
 */
public interface TableStore extends EntityStore, TableScanner, Closeable {

    /**
     * Creates the table if it does not exist yet.  Calling it for an existing table
     * is a no-op, not an error.
     *
     * @throws Exception if the store cannot be reached or the table cannot be created
     */
    void ensureTable() throws Exception;
}
