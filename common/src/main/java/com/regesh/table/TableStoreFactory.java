package com.regesh.table;

import com.regesh.config.PipelineConfig;
import com.regesh.config.TableConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the {@link TableStore} selected by {@code table.backend}.
 */
@Slf4j
public final class TableStoreFactory {

    private TableStoreFactory() {
        // utility class
    }

    public static TableStore create(PipelineConfig config) {
        TableConfig table = config.getTable();
        log.info("Initialising {} table store: account={} table={}",
                table.getBackend(), table.getStorageAccount(), table.getTableName());

        return switch (table.getBackend()) {
            case ELASTICSEARCH -> new ElasticsearchTableStore(
                    config.getElasticsearch(), table.getStorageAccount(), table.getTableName());
            case MEMORY -> new InMemoryTableStore(table.getTableName());
        };
    }
}
