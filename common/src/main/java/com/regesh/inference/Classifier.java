package com.regesh.inference;

import com.regesh.config.InferenceConfig;
import com.regesh.model.LabelScore;

import java.util.List;

/**
 * Contract for text classification backends.
 *
 * <p>The pipeline treats the model as an opaque function from texts to label scores.
 * Implementations are created reflectively by {@link ClassifierFactory} and must have a
 * public no-arg constructor; external resources (HTTP clients, model handles) should be
 * acquired in {@link #init(InferenceConfig)}.</p>
 */
public interface Classifier {

    /**
     * Initialises the classifier with its configuration.
     * Called once, before the first {@link #classify} call.
     */
    default void init(InferenceConfig config) {
        // no-op by default
    }

    /**
     * Classifies a batch of texts in a single call.
     *
     * <p>Returns one score list per text, in the <b>same order</b> as {@code texts}.  Each
     * score list spans the model's full label set; its order is whatever the model
     * produces and is not required to be sorted by score.</p>
     *
     * @param texts preprocessed texts of one batch
     * @return label scores, one list per text, same order
     * @throws Exception on any failure; the whole batch is then treated as failed
     */
    List<List<LabelScore>> classify(List<String> texts) throws Exception;

    /**
     * Releases resources held by this classifier.
     */
    default void close() {
        // no-op by default
    }
}
