package com.regesh.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An input record joined with its classification and the metadata of the run that
 * produced it.
 */
@Value
public class EnrichedRecord {

    public static final String SENTIMENT_ANALYSIS = "sentiment_analysis";
    public static final String PROCESSING_METADATA = "processing_metadata";

    InputRecord record;
    SentimentAnalysis sentimentAnalysis;
    ProcessingMetadata processingMetadata;

    /**
     * Produces the denormalized view: every original field, plus the
     * {@value #SENTIMENT_ANALYSIS} and {@value #PROCESSING_METADATA} blocks.
     */
    public Map<String, Object> toMergedMap() {
        Map<String, Object> merged = new LinkedHashMap<>(record.getFields());
        merged.put(SENTIMENT_ANALYSIS, sentimentAnalysis.toMap());
        merged.put(PROCESSING_METADATA, processingMetadata.toMap());
        return merged;
    }

    public int getRecordIndex() {
        return processingMetadata.getRecordIndex();
    }

    @Value
    public static class SentimentAnalysis {
        String predictedLabel;
        double confidence;
        List<LabelScore> scores;
        /** Set only when the record's batch failed. */
        String errorMessage;

        public static SentimentAnalysis from(ClassificationResult result) {
            return new SentimentAnalysis(result.getPredictedLabel(), result.getConfidence(),
                    result.getScores(), result.getErrorMessage());
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("predicted_label", predictedLabel);
            map.put("confidence", confidence);
            map.put("scores", scores);
            if (errorMessage != null) {
                map.put("error", errorMessage);
            }
            return map;
        }
    }

    @Value
    public static class ProcessingMetadata {
        String modelUsed;
        String processedAt;
        int recordIndex;

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("model_used", modelUsed);
            map.put("processed_at", processedAt);
            map.put("record_index", recordIndex);
            return map;
        }
    }
}
