package com.regesh.config;

/**
 * Defines which table store backs a run.
 */
public enum StoreBackend {

    /**
     * One Elasticsearch index per table; entities are documents keyed by partition and row key.
     */
    ELASTICSEARCH,

    /**
     * In-process store, lost when the JVM exits.  Useful for dry runs and tests.
     */
    MEMORY
}
