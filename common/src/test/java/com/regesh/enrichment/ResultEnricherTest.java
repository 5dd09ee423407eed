package com.regesh.enrichment;

import com.regesh.model.ClassificationResult;
import com.regesh.model.EnrichedRecord;
import com.regesh.model.InputRecord;
import com.regesh.model.LabelScore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultEnricherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-02T10:15:30.123Z"), ZoneOffset.UTC);

    private final ResultEnricher enricher = new ResultEnricher();

    @Test
    void joinsRecordsAndResultsByPosition() {
        List<InputRecord> records = List.of(
                InputRecord.of(Map.of("id", 7, "text", "great")),
                InputRecord.of(Map.of("text", "awful")));
        List<ClassificationResult> results = List.of(
                ClassificationResult.fromScores("great", List.of(new LabelScore("positive", 0.9))),
                ClassificationResult.failure("awful", "boom"));

        List<EnrichedRecord> enriched = enricher.enrich(records, results, "model-x", CLOCK);

        assertThat(enriched).hasSize(2);
        for (int i = 0; i < enriched.size(); i++) {
            assertThat(enriched.get(i).getRecord().get("text")).isEqualTo(records.get(i).get("text"));
            assertThat(enriched.get(i).getRecordIndex()).isEqualTo(i);
        }
        assertThat(enriched.get(0).getSentimentAnalysis().getPredictedLabel()).isEqualTo("positive");
        assertThat(enriched.get(1).getSentimentAnalysis().getPredictedLabel()).isEqualTo("ERROR");
        assertThat(enriched.get(1).getSentimentAnalysis().getScores()).isEmpty();
    }

    @Test
    void recordsModelAndEnrichmentTime() {
        List<EnrichedRecord> enriched = enricher.enrich(
                List.of(InputRecord.of(Map.of("text", "hi"))),
                List.of(ClassificationResult.fromScores("hi", List.of(new LabelScore("neutral", 0.6)))),
                "model-x", CLOCK);

        EnrichedRecord.ProcessingMetadata metadata = enriched.get(0).getProcessingMetadata();
        assertThat(metadata.getModelUsed()).isEqualTo("model-x");
        assertThat(metadata.getProcessedAt()).isEqualTo("2025-06-02T10:15:30.123Z");
    }

    @Test
    @SuppressWarnings("unchecked")
    void mergedViewKeepsExtraFieldsAndAddsBothBlocks() {
        InputRecord record = InputRecord.of(Map.of("text", "hi", "lang", "en"));
        EnrichedRecord enriched = enricher.enrich(List.of(record),
                List.of(ClassificationResult.fromScores("hi", List.of(new LabelScore("neutral", 0.6)))),
                "model-x", CLOCK).get(0);

        Map<String, Object> merged = enriched.toMergedMap();

        assertThat(merged).containsEntry("lang", "en").containsEntry("text", "hi");
        assertThat((Map<String, Object>) merged.get(EnrichedRecord.SENTIMENT_ANALYSIS))
                .containsEntry("predicted_label", "neutral")
                .containsEntry("confidence", 0.6)
                .doesNotContainKey("error");
        assertThat((Map<String, Object>) merged.get(EnrichedRecord.PROCESSING_METADATA))
                .containsEntry("model_used", "model-x")
                .containsEntry("record_index", 0);
    }

    @Test
    void rejectsListsOfDifferentLength() {
        assertThatThrownBy(() -> enricher.enrich(
                List.of(InputRecord.of(Map.of("text", "a"))), List.of(), "model-x", CLOCK))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
