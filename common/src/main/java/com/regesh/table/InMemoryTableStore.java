package com.regesh.table;

import com.regesh.model.TableEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Table store kept in process memory, in insertion order.
 *
 * <p>Behaves like the remote stores where it matters to the pipeline: inserting before
 * {@link #ensureTable()} fails, and inserting a key that already exists fails.</p>
 */
@Slf4j
public class InMemoryTableStore implements TableStore {

    private final String tableName;
    private final Map<String, TableEntity> entities = new LinkedHashMap<>();
    private volatile boolean created;

    public InMemoryTableStore(String tableName) {
        this.tableName = tableName;
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    @Override
    public void ensureTable() {
        if (created) {
            log.info("Table already exists: {}", tableName);
        } else {
            created = true;
            log.info("Created in-memory table: {}", tableName);
        }
    }

    @Override
    public void insert(TableEntity entity) {
        if (!created) {
            throw new IllegalStateException("Table does not exist: " + tableName);
        }
        String key = entity.getPartitionKey() + "|" + entity.getRowKey();
        synchronized (entities) {
            if (entities.containsKey(key)) {
                throw new IllegalStateException("Entity already exists: " + key);
            }
            entities.put(key, entity);
        }
    }

    @Override
    public Stream<TableEntity> scan() {
        List<TableEntity> snapshot;
        synchronized (entities) {
            snapshot = new ArrayList<>(entities.values());
        }
        return snapshot.stream();
    }

    public int size() {
        synchronized (entities) {
            return entities.size();
        }
    }

    @Override
    public void close() {
        log.debug("Closed in-memory table {} holding {} entities", tableName, size());
    }
}
