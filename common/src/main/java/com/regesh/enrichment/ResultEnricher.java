package com.regesh.enrichment;

import com.regesh.model.ClassificationResult;
import com.regesh.model.EnrichedRecord;
import com.regesh.model.EnrichedRecord.ProcessingMetadata;
import com.regesh.model.EnrichedRecord.SentimentAnalysis;
import com.regesh.model.InputRecord;
import com.regesh.model.Timestamps;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Joins input records with their classification results by position.
 *
 * <p>Record {@code i} is paired with result {@code i}; there is no key-based matching.
 * Results are carried through as they are, sentinel results included, since they were
 * already checked by the inference engine.</p>
 */
@Slf4j
public class ResultEnricher {

    /**
     * Enriches every record with its classification and processing metadata.
     *
     * @param records   input records, in input order
     * @param results   classification results, same length and order as {@code records}
     * @param modelName model identifier recorded as {@code model_used}
     * @param clock     source of {@code processed_at}, read once per record at enrichment time
     * @return enriched records, {@code record_index} equal to the position in the input
     * @throws IllegalArgumentException if the two lists differ in length
     */
    public List<EnrichedRecord> enrich(List<InputRecord> records,
                                       List<ClassificationResult> results,
                                       String modelName,
                                       Clock clock) {
        if (records.size() != results.size()) {
            throw new IllegalArgumentException("Cannot join " + records.size() + " records with "
                    + results.size() + " classification results");
        }

        List<EnrichedRecord> enriched = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            enriched.add(new EnrichedRecord(
                    records.get(i),
                    SentimentAnalysis.from(results.get(i)),
                    new ProcessingMetadata(modelName, Timestamps.now(clock), i)));
        }

        log.info("Enriched {} records with results of model '{}'", enriched.size(), modelName);
        return enriched;
    }
}
