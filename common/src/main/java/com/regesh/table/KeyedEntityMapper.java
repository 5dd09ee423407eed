package com.regesh.table;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regesh.model.EnrichedRecord;
import com.regesh.model.InputRecord;
import com.regesh.model.LabelScore;
import com.regesh.model.TableEntity;
import com.regesh.model.Texts;
import com.regesh.model.Timestamps;
import com.regesh.pipeline.RunContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps enriched records to flat table entities and assigns their keys.
 *
 * <p>Keys:
 * <ul>
 *   <li>{@code PartitionKey} – the run's calendar date, so one day's results can be read
 *       without scanning the whole table.</li>
 *   <li>{@code RowKey} – the record's index in the run, zero-padded to six digits, then
 *       {@code _} and a random 8-character token.  The token only keeps repeated runs on
 *       the same day apart; it is not derived from the content, so running the same
 *       input twice writes new rows instead of overwriting the old ones.</li>
 * </ul>
 *
 * <p>Text, category and source are cut to {@code maxFieldLength} characters.  Anything
 * beyond the limit is dropped without notice.</p>
 */
public class KeyedEntityMapper {

    private final RunContext run;
    private final String textField;
    private final int maxFieldLength;
    private final ObjectMapper objectMapper;

    public KeyedEntityMapper(RunContext run, String textField, int maxFieldLength, ObjectMapper objectMapper) {
        this.run = run;
        this.textField = textField;
        this.maxFieldLength = maxFieldLength;
        this.objectMapper = objectMapper;
    }

    public KeyedEntityMapper(RunContext run, String textField, int maxFieldLength) {
        this(run, textField, maxFieldLength, new ObjectMapper());
    }

    /**
     * Maps all records, using each record's position in {@code records} as its run index.
     */
    public List<TableEntity> toEntities(List<EnrichedRecord> records) {
        List<TableEntity> entities = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            entities.add(toEntity(records.get(i), i));
        }
        return entities;
    }

    public TableEntity toEntity(EnrichedRecord enriched, int runIndex) {
        InputRecord record = enriched.getRecord();
        EnrichedRecord.SentimentAnalysis analysis = enriched.getSentimentAnalysis();
        EnrichedRecord.ProcessingMetadata metadata = enriched.getProcessingMetadata();

        Object id = record.getId();
        Object text = record.get(textField);

        return TableEntity.builder()
                .partitionKey(run.getPartitionKey())
                .rowKey(rowKey(runIndex))
                .originalId(id != null ? String.valueOf(id) : String.valueOf(runIndex))
                .text(truncate(text != null ? String.valueOf(text) : ""))
                .category(truncate(orEmpty(record.getCategory())))
                .source(truncate(orEmpty(record.getSource())))
                .predictedSentiment(orEmpty(analysis.getPredictedLabel()))
                .confidence(analysis.getConfidence())
                .allScoresJson(toJson(analysis.getScores()))
                .modelUsed(orEmpty(metadata.getModelUsed()))
                .processedAt(metadata.getProcessedAt())
                .recordId(metadata.getRecordIndex())
                .insertedAt(Timestamps.now(run.getClock()))
                .batchId(run.getRunId())
                .build();
    }

    String rowKey(int runIndex) {
        return String.format(Locale.ROOT, "%06d_%s", runIndex, run.nextToken());
    }

    private String truncate(String value) {
        return Texts.truncate(value, maxFieldLength);
    }

    private String toJson(List<LabelScore> scores) {
        try {
            return objectMapper.writeValueAsString(scores != null ? scores : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize label scores", e);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
