package com.regesh.table;

import com.regesh.model.TableEntity;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Read side of a table: streams every entity currently stored.
 */
public interface TableScanner {

    /** Name of the table being scanned. */
    String getTableName();

    /**
     * Returns all entities in the table, across every partition.
     */
    Stream<TableEntity> scan() throws IOException;
}
