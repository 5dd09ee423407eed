package com.regesh.pipeline;

import com.regesh.config.PipelineConfig;
import com.regesh.enrichment.ResultEnricher;
import com.regesh.inference.BatchInferenceEngine;
import com.regesh.inference.Classifier;
import com.regesh.inference.TextPreprocessor;
import com.regesh.model.ClassificationResult;
import com.regesh.model.EnrichedRecord;
import com.regesh.model.InputRecord;
import com.regesh.model.PersistSummary;
import com.regesh.model.TableEntity;
import com.regesh.model.TableSummary;
import com.regesh.source.RecordSource;
import com.regesh.table.KeyedEntityMapper;
import com.regesh.table.SummaryAggregator;
import com.regesh.table.TablePersister;
import com.regesh.table.TableStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the sentiment pipeline once, end to end.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>Setup: validate the configuration, create the table if absent, fetch the input.
 *       Any failure here is a {@link PipelineSetupException}; nothing has been classified
 *       or written yet.</li>
 *   <li>Classify the texts in batches ({@link BatchInferenceEngine}).</li>
 *   <li>Join records and results by position ({@link ResultEnricher}).</li>
 *   <li>Key and flatten the enriched records ({@link KeyedEntityMapper}).</li>
 *   <li>Insert the entities one by one ({@link TablePersister}).</li>
 *   <li>Summarise the whole table ({@link SummaryAggregator}).</li>
 * </ol>
 *
 * <p>Past setup, failures are contained: a failed batch yields sentinel results, a failed
 * insert is counted, and a failed summary scan leaves the report with an unavailable
 * summary.  A {@link PipelineReport} is always returned.</p>
 */
@Slf4j
public class PipelineOrchestrator {

    private final PipelineConfig config;
    private final RecordSource recordSource;
    private final Classifier classifier;
    private final TableStore tableStore;
    private final Clock clock;

    public PipelineOrchestrator(PipelineConfig config,
                                RecordSource recordSource,
                                Classifier classifier,
                                TableStore tableStore,
                                Clock clock) {
        this.config = config;
        this.recordSource = recordSource;
        this.classifier = classifier;
        this.tableStore = tableStore;
        this.clock = clock;
    }

    public PipelineReport run() {
        return run(CancellationToken.NONE);
    }

    public PipelineReport run(CancellationToken cancellation) {
        // ── Setup ────────────────────────────────────────────────────────
        config.validate();

        TablePersister persister = new TablePersister(tableStore, config.getTable().getInsertParallelism());
        persister.prepareTable();

        List<InputRecord> records = fetchInput();
        RunContext run = RunContext.start(clock);
        log.info("Starting run {} for {} records (partition {}, model '{}')",
                run.getRunId(), records.size(), run.getPartitionKey(), config.getModelName());

        // ── Classify ─────────────────────────────────────────────────────
        List<String> texts = extractTexts(records, config.getTextField());
        BatchInferenceEngine engine = new BatchInferenceEngine(classifier,
                new TextPreprocessor(config.getInference().getModelMaxLength(),
                        config.getInference().getReservedTokens()),
                config.getInference().getParallelism());
        List<ClassificationResult> results = engine.classify(texts, config.getBatchSize(), cancellation);

        // ── Enrich and map ───────────────────────────────────────────────
        List<EnrichedRecord> enriched = new ResultEnricher()
                .enrich(records, results, config.getModelName(), run.getClock());
        List<TableEntity> entities = new KeyedEntityMapper(run, config.getTextField(),
                config.getTable().getMaxFieldLength()).toEntities(enriched);

        // ── Persist ──────────────────────────────────────────────────────
        PersistSummary persisted = persister.persist(entities, cancellation);

        // ── Summarise ────────────────────────────────────────────────────
        TableSummary summary = summarize();

        PipelineReport report = PipelineReport.builder()
                .runId(run.getRunId())
                .partitionKey(run.getPartitionKey())
                .tableName(config.getTableName())
                .totalProcessed(enriched.size())
                .classificationErrors((int) results.stream().filter(ClassificationResult::isError).count())
                .persistSummary(persisted)
                .tableSummary(summary)
                .build();

        log.info("Run {} complete: processed={}, classificationErrors={}, inserted={}, failed={}",
                report.getRunId(), report.getTotalProcessed(), report.getClassificationErrors(),
                report.getInserted(), report.getFailed());
        return report;
    }

    private List<InputRecord> fetchInput() {
        String container = config.getInput().getContainerName();
        String blob = config.getInput().getBlobName();
        try {
            return recordSource.fetch(container, blob);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load input {}/{}: {}", container, blob, e.getMessage());
            throw new PipelineSetupException(PipelineSetupException.STAGE_INPUT,
                    "Failed to load input " + container + "/" + blob, e);
        }
    }

    /**
     * Reads the text field of every record.  A record without it is classified as the
     * empty text.
     */
    static List<String> extractTexts(List<InputRecord> records, String textField) {
        List<String> texts = new ArrayList<>(records.size());
        int missing = 0;
        for (int i = 0; i < records.size(); i++) {
            Object value = records.get(i).get(textField);
            if (value == null) {
                log.warn("Record {} has no '{}' field; classifying empty text", i, textField);
                missing++;
                texts.add("");
            } else {
                texts.add(String.valueOf(value));
            }
        }
        if (missing > 0) {
            log.warn("{} of {} records had no '{}' field", missing, records.size(), textField);
        }
        return texts;
    }

    private TableSummary summarize() {
        try {
            return new SummaryAggregator().summarize(tableStore);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to summarise table {}: {}", config.getTableName(), e.getMessage());
            return TableSummary.unavailable(config.getTableName(), PipelineSetupException.describe(e));
        }
    }
}
