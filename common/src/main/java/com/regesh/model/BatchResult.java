package com.regesh.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one classifier invocation over a contiguous batch of texts.
 *
 * <p>Either every text in the batch was classified, or the whole batch failed and each
 * text carries the sentinel result.  In both cases {@link #getResults()} has exactly one
 * entry per text, in batch order.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BatchResult {

    int batchIndex;
    /** Position of the batch's first text within the whole input. */
    int offset;
    List<ClassificationResult> results;
    boolean success;
    String errorMessage;

    public static BatchResult success(int batchIndex, int offset, List<ClassificationResult> results) {
        return new BatchResult(batchIndex, offset, List.copyOf(results), true, null);
    }

    public static BatchResult failure(int batchIndex, int offset, List<String> texts, String errorMessage) {
        List<ClassificationResult> sentinels = texts.stream()
                .map(text -> ClassificationResult.failure(text, errorMessage))
                .toList();
        return new BatchResult(batchIndex, offset, sentinels, false, errorMessage);
    }

    public int size() {
        return results.size();
    }
}
