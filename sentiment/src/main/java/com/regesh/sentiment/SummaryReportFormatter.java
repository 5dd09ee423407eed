package com.regesh.sentiment;

import com.regesh.model.TableSummary;
import com.regesh.pipeline.PipelineReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link PipelineReport} as the log lines printed at the end of a run.
 */
public class SummaryReportFormatter {

    public List<String> format(PipelineReport report) {
        List<String> lines = new ArrayList<>();
        lines.add("Sentiment Analysis Summary:");
        lines.add("  Run: " + report.getRunId() + " (partition " + report.getPartitionKey() + ")");
        lines.add("  Total records processed: " + report.getTotalProcessed());
        lines.add("  Classification errors: " + report.getClassificationErrors());
        lines.add("  Inserted: " + report.getInserted() + ", failed: " + report.getFailed());

        TableSummary summary = report.getTableSummary();
        if (summary == null || !summary.isAvailable()) {
            lines.add("  Table summary unavailable: "
                    + (summary != null ? summary.getErrorMessage() : "not computed"));
            return lines;
        }

        lines.add("  Total records in table " + summary.getTableName() + ": " + summary.getTotalRecords());
        if (!summary.getSentimentDistribution().isEmpty()) {
            lines.add("  Sentiment distribution:");
            for (Map.Entry<String, Long> entry : summary.getSentimentDistribution().entrySet()) {
                double percentage = 100.0 * entry.getValue() / summary.getTotalRecords();
                lines.add(String.format(Locale.ROOT, "    %s: %d (%.1f%%)",
                        entry.getKey(), entry.getValue(), percentage));
            }
        }
        if (summary.getLatestProcessedAt() != null) {
            lines.add("  Latest processed at: " + summary.getLatestProcessedAt());
        }
        return lines;
    }
}
