package com.regesh.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Classification of one text: the full score list plus its arg-max.
 *
 * <p>A failed classification is represented by the sentinel produced by
 * {@link #failure(String, String)}: no scores, label {@value #ERROR_LABEL}, confidence
 * {@code 0.0} and the error message.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassificationResult {

    public static final String ERROR_LABEL = "ERROR";

    /** The text as it was handed to the engine, before preprocessing. */
    String text;
    List<LabelScore> scores;
    String predictedLabel;
    double confidence;
    String errorMessage;

    /**
     * Builds a successful result from the classifier's scores for one text.
     *
     * <p>The predicted label is the pair with the highest score.  When several pairs share
     * the highest score, the one that comes first in the classifier's output wins.</p>
     *
     * @throws IllegalArgumentException if {@code scores} is null or empty
     */
    public static ClassificationResult fromScores(String text, List<LabelScore> scores) {
        if (scores == null || scores.isEmpty()) {
            throw new IllegalArgumentException("Classifier returned no scores for a text");
        }
        LabelScore best = scores.get(0);
        for (LabelScore candidate : scores) {
            if (candidate.getScore() > best.getScore()) {
                best = candidate;
            }
        }
        return new ClassificationResult(text, List.copyOf(scores), best.getLabel(), best.getScore(), null);
    }

    /**
     * Builds the sentinel result standing in for a text whose batch failed.
     */
    public static ClassificationResult failure(String text, String errorMessage) {
        return new ClassificationResult(text, List.of(), ERROR_LABEL, 0.0, errorMessage);
    }

    public boolean isError() {
        return errorMessage != null;
    }
}
