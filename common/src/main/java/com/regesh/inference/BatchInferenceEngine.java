package com.regesh.inference;

import com.regesh.model.BatchResult;
import com.regesh.model.ClassificationResult;
import com.regesh.model.LabelScore;
import com.regesh.pipeline.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Classifies a sequence of texts in fixed-size batches, one classifier call per batch.
 *
 * <p>The output always has one {@link ClassificationResult} per input text, in input
 * order.  A batch whose classifier call fails (exception, or a response with the wrong
 * number of entries) yields the sentinel result for each of its texts; the failure is
 * logged and the remaining batches still run.  Failed batches are not retried, so the
 * number of records lost to one failure is bounded by the batch size.</p>
 *
 * <h3>Concurrency</h3>
 * <p>With {@code parallelism == 1} batches run one after another on the caller's thread.
 * With a higher value they run on a fixed pool of at most {@code parallelism} workers;
 * each batch result is stored at its batch index in a pre-sized buffer, so completion
 * order never affects output order.</p>
 */
@Slf4j
public class BatchInferenceEngine {

    private final Classifier classifier;
    private final TextPreprocessor preprocessor;
    private final int parallelism;

    public BatchInferenceEngine(Classifier classifier, TextPreprocessor preprocessor, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        }
        this.classifier = classifier;
        this.preprocessor = preprocessor;
        this.parallelism = parallelism;
    }

    public BatchInferenceEngine(Classifier classifier, TextPreprocessor preprocessor) {
        this(classifier, preprocessor, 1);
    }

    /**
     * Classifies {@code texts} in batches of at most {@code batchSize}, running to completion.
     */
    public List<ClassificationResult> classify(List<String> texts, int batchSize) {
        return classify(texts, batchSize, CancellationToken.NONE);
    }

    /**
     * Classifies {@code texts} in batches of at most {@code batchSize}.
     *
     * <p>Batches that have not started when {@code cancellation} fires receive the sentinel
     * result with message {@value CancellationToken#CANCELLED_MESSAGE}.</p>
     *
     * @return one result per text, same order as {@code texts}
     * @throws IllegalArgumentException if {@code batchSize < 1}
     */
    public List<ClassificationResult> classify(List<String> texts, int batchSize,
                                               CancellationToken cancellation) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }

        int batchCount = (texts.size() + batchSize - 1) / batchSize;
        BatchResult[] batches = new BatchResult[batchCount];
        log.info("Classifying {} texts in {} batches of up to {}", texts.size(), batchCount, batchSize);

        if (parallelism == 1 || batchCount <= 1) {
            for (int b = 0; b < batchCount; b++) {
                batches[b] = processBatch(b, b * batchSize, slice(texts, b, batchSize), cancellation);
            }
        } else {
            runConcurrently(texts, batchSize, batches, cancellation);
        }

        List<ClassificationResult> results = new ArrayList<>(texts.size());
        int failedBatches = 0;
        for (BatchResult batch : batches) {
            results.addAll(batch.getResults());
            if (!batch.isSuccess()) {
                failedBatches++;
                log.warn("Batch {} (texts {}-{}) failed: {}", batch.getBatchIndex() + 1,
                        batch.getOffset(), batch.getOffset() + batch.size() - 1, batch.getErrorMessage());
            }
        }

        if (failedBatches > 0) {
            log.warn("{} of {} batches failed; their {} texts carry the {} result",
                    failedBatches, batchCount,
                    results.stream().filter(ClassificationResult::isError).count(),
                    ClassificationResult.ERROR_LABEL);
        }
        log.info("Classification complete: {} results", results.size());
        return results;
    }

    // ── Batch execution ──────────────────────────────────────────────────

    private void runConcurrently(List<String> texts, int batchSize, BatchResult[] batches,
                                 CancellationToken cancellation) {
        int workers = Math.min(parallelism, batches.length);
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "regesh-inference-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<BatchResult>> futures = new ArrayList<>(batches.length);
            for (int b = 0; b < batches.length; b++) {
                int batchIndex = b;
                List<String> batch = slice(texts, b, batchSize);
                futures.add(pool.submit(() ->
                        processBatch(batchIndex, batchIndex * batchSize, batch, cancellation)));
            }

            for (int b = 0; b < batches.length; b++) {
                try {
                    batches[b] = futures.get(b).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for batch {}", b + 1);
                    fillUnfinished(texts, batchSize, batches, "interrupted");
                    return;
                } catch (ExecutionException e) {
                    // processBatch contains every Exception; only Errors get here
                    throw new IllegalStateException("Batch " + (b + 1) + " aborted", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private BatchResult processBatch(int batchIndex, int offset, List<String> batch,
                                     CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return BatchResult.failure(batchIndex, offset, batch, CancellationToken.CANCELLED_MESSAGE);
        }

        try {
            List<String> processed = batch.stream()
                    .map(preprocessor::preprocess)
                    .toList();

            List<List<LabelScore>> scores = classifier.classify(processed);
            if (scores == null || scores.size() != batch.size()) {
                throw new IllegalStateException("Classifier returned "
                        + (scores == null ? "no" : String.valueOf(scores.size()))
                        + " results for a batch of " + batch.size());
            }

            List<ClassificationResult> results = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                results.add(ClassificationResult.fromScores(batch.get(i), scores.get(i)));
            }
            log.debug("Batch {} classified ({} texts)", batchIndex + 1, batch.size());
            return BatchResult.success(batchIndex, offset, results);

        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = describe(e);
            log.error("Error processing batch {}: {}", batchIndex + 1, message);
            return BatchResult.failure(batchIndex, offset, batch, message);
        }
    }

    private static void fillUnfinished(List<String> texts, int batchSize, BatchResult[] batches,
                                       String reason) {
        for (int b = 0; b < batches.length; b++) {
            if (batches[b] == null) {
                batches[b] = BatchResult.failure(b, b * batchSize, slice(texts, b, batchSize), reason);
            }
        }
    }

    private static List<String> slice(List<String> texts, int batchIndex, int batchSize) {
        int from = batchIndex * batchSize;
        int to = Math.min(from + batchSize, texts.size());
        return texts.subList(from, to);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
