package com.regesh.table;

import com.regesh.model.TableEntity;
import com.regesh.model.TableSummary;
import com.regesh.model.Timestamps;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Summarises the whole content of a table: how many entities it holds, how they are
 * distributed over predicted labels, and the latest processing time.
 *
 * <p>The scan is not limited to the current run.  The distribution covers every entity
 * ever written to the table, so it only matches the current input when the table was
 * empty before the run.</p>
 */
@Slf4j
public class SummaryAggregator {

    /** Label counted for entities that carry no predicted sentiment. */
    public static final String UNKNOWN_LABEL = "unknown";

    /**
     * Scans the table and aggregates it.  An empty table yields {@link TableSummary#empty}.
     *
     * @throws IOException if the table cannot be scanned
     */
    public TableSummary summarize(TableScanner scanner) throws IOException {
        List<TableEntity> entities;
        try (Stream<TableEntity> scan = scanner.scan()) {
            entities = scan.toList();
        }

        if (entities.isEmpty()) {
            log.info("Table {} is empty", scanner.getTableName());
            return TableSummary.empty(scanner.getTableName());
        }

        Map<String, Long> distribution = entities.stream()
                .collect(Collectors.groupingBy(SummaryAggregator::labelOf, HashMap::new, Collectors.counting()));

        return TableSummary.of(scanner.getTableName(), entities.size(), distribution,
                latestProcessedAt(entities));
    }

    private static String labelOf(TableEntity entity) {
        String label = entity.getPredictedSentiment();
        return label == null || label.isEmpty() ? UNKNOWN_LABEL : label;
    }

    /**
     * Latest {@code ProcessedAt}, compared as instants.  Values that do not parse as
     * timestamps only win when nothing parses.
     */
    private static String latestProcessedAt(List<TableEntity> entities) {
        String latest = null;
        OffsetDateTime latestTime = null;
        String latestRaw = null;

        for (TableEntity entity : entities) {
            String value = entity.getProcessedAt();
            if (value == null || value.isEmpty()) {
                continue;
            }
            Optional<OffsetDateTime> parsed = Timestamps.parse(value);
            if (parsed.isPresent()) {
                if (latestTime == null || parsed.get().isAfter(latestTime)) {
                    latestTime = parsed.get();
                    latest = value;
                }
            } else if (latestRaw == null || value.compareTo(latestRaw) > 0) {
                latestRaw = value;
            }
        }
        return latest != null ? latest : latestRaw;
    }
}
