package com.regesh.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration for the classifier and the batch inference engine.
 */
@Data
@NoArgsConstructor
public class InferenceConfig {

    /** Fully-qualified {@link com.regesh.inference.Classifier} implementation. */
    private String className = "com.regesh.inference.HttpClassifier";

    /** Model identifier recorded on every enriched record. */
    private String modelName = "cardiffnlp/twitter-roberta-base-sentiment-latest";

    /** Inference endpoint used by the HTTP classifier. */
    private String apiUrl;

    /** Optional bearer token for the inference endpoint. */
    private String apiToken;

    /** Request timeout for a single batch call (default: 30 seconds). */
    private long timeoutMs = 30_000;

    /** Number of texts sent to the classifier per call. */
    private int batchSize = 16;

    /** Max batches in flight at once; {@code 1} runs them sequentially. */
    private int parallelism = 1;

    /** Input length limit of the model, in characters. */
    private int modelMaxLength = 512;

    /** Positions reserved for the model's special tokens. */
    private int reservedTokens = 2;
}
