package com.regesh.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat, storage-ready form of an enriched record.
 *
 * <p>The store has no nested structures, so the score list travels as a JSON string in
 * {@link #ALL_SCORES_JSON}.  Entities are written once and never updated.</p>
 *
 * <p>Example – property map of a stored entity:
 * <pre>
 *   PartitionKey       2025-06-02
 *   RowKey             000042_9f1c2ab0
 *   PredictedSentiment positive
 *   AllScoresJson      [{"label":"positive","score":0.93}, ...]
 * </pre>
 */
@Value
@Builder
public class TableEntity {

    public static final String PARTITION_KEY = "PartitionKey";
    public static final String ROW_KEY = "RowKey";
    public static final String ORIGINAL_ID = "OriginalId";
    public static final String TEXT = "Text";
    public static final String CATEGORY = "Category";
    public static final String SOURCE = "Source";
    public static final String PREDICTED_SENTIMENT = "PredictedSentiment";
    public static final String CONFIDENCE = "Confidence";
    public static final String ALL_SCORES_JSON = "AllScoresJson";
    public static final String MODEL_USED = "ModelUsed";
    public static final String PROCESSED_AT = "ProcessedAt";
    public static final String RECORD_ID = "RecordId";
    public static final String INSERTED_AT = "InsertedAt";
    public static final String BATCH_ID = "BatchId";

    String partitionKey;
    String rowKey;
    String originalId;
    String text;
    String category;
    String source;
    String predictedSentiment;
    double confidence;
    String allScoresJson;
    String modelUsed;
    String processedAt;
    int recordId;
    String insertedAt;
    String batchId;

    /**
     * Converts this entity into the property map written to the store.
     */
    public Map<String, Object> toProperties() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(PARTITION_KEY, partitionKey);
        map.put(ROW_KEY, rowKey);
        map.put(ORIGINAL_ID, originalId);
        map.put(TEXT, text);
        map.put(CATEGORY, category);
        map.put(SOURCE, source);
        map.put(PREDICTED_SENTIMENT, predictedSentiment);
        map.put(CONFIDENCE, confidence);
        map.put(ALL_SCORES_JSON, allScoresJson);
        map.put(MODEL_USED, modelUsed);
        map.put(PROCESSED_AT, processedAt);
        map.put(RECORD_ID, recordId);
        map.put(INSERTED_AT, insertedAt);
        map.put(BATCH_ID, batchId);
        return map;
    }

    /**
     * Rebuilds an entity from a stored property map.  Missing properties become
     * {@code null} (or zero for the numeric ones).
     */
    public static TableEntity fromProperties(Map<String, Object> properties) {
        if (properties == null) {
            return TableEntity.builder().build();
        }
        return TableEntity.builder()
                .partitionKey(string(properties, PARTITION_KEY))
                .rowKey(string(properties, ROW_KEY))
                .originalId(string(properties, ORIGINAL_ID))
                .text(string(properties, TEXT))
                .category(string(properties, CATEGORY))
                .source(string(properties, SOURCE))
                .predictedSentiment(string(properties, PREDICTED_SENTIMENT))
                .confidence(number(properties, CONFIDENCE).doubleValue())
                .allScoresJson(string(properties, ALL_SCORES_JSON))
                .modelUsed(string(properties, MODEL_USED))
                .processedAt(string(properties, PROCESSED_AT))
                .recordId(number(properties, RECORD_ID).intValue())
                .insertedAt(string(properties, INSERTED_AT))
                .batchId(string(properties, BATCH_ID))
                .build();
    }

    private static String string(Map<String, Object> properties, String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }

    private static Number number(Map<String, Object> properties, String key) {
        Object value = properties.get(key);
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value != null) {
            try {
                return Double.valueOf(value.toString());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
