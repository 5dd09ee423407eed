package com.regesh.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view over everything stored in a table, not only the latest run.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TableSummary {

    String tableName;
    long totalRecords;
    /** Label to entity count, sorted by label. */
    Map<String, Long> sentimentDistribution;
    /** Latest {@code ProcessedAt} in the table; {@code null} when the table is empty. */
    String latestProcessedAt;
    /** Set when the table could not be scanned. */
    String errorMessage;

    public static TableSummary of(String tableName, long totalRecords,
                                  Map<String, Long> sentimentDistribution,
                                  String latestProcessedAt) {
        return new TableSummary(tableName, totalRecords,
                Collections.unmodifiableMap(new TreeMap<>(sentimentDistribution)),
                latestProcessedAt, null);
    }

    public static TableSummary empty(String tableName) {
        return new TableSummary(tableName, 0, Map.of(), null, null);
    }

    public static TableSummary unavailable(String tableName, String errorMessage) {
        return new TableSummary(tableName, 0, Map.of(), null, errorMessage);
    }

    public boolean isAvailable() {
        return errorMessage == null;
    }
}
