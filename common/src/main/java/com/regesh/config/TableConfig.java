package com.regesh.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target table of a run, addressed by {@code (storageAccount, tableName)}.
 */
@Data
@NoArgsConstructor
public class TableConfig {

    private String storageAccount;
    private String tableName = "SentimentResults";
    private StoreBackend backend = StoreBackend.ELASTICSEARCH;

    /** Max inserts in flight at once; {@code 1} inserts sequentially. */
    private int insertParallelism = 1;

    /**
     * Longest string a single entity field may hold.  Longer text fields are cut
     * to exactly this length when the entity is built.
     */
    private int maxFieldLength = 32_000;
}
