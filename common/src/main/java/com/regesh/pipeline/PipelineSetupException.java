package com.regesh.pipeline;

import lombok.Getter;

/**
 * A failure that prevents a run from starting: missing configuration, an unreachable
 * store, a classifier that cannot be created, or input that cannot be fetched.
 *
 * <p>Thrown before any batch is classified or any entity inserted.</p>
 */
@Getter
public class PipelineSetupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final String STAGE_CONFIGURATION = "configuration";
    public static final String STAGE_CLASSIFIER = "classifier";
    public static final String STAGE_TABLE = "table";
    public static final String STAGE_INPUT = "input";

    /** Pipeline stage that failed. */
    private final String stage;

    public PipelineSetupException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public PipelineSetupException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message + ": " + describe(cause), cause);
        this.stage = stage;
    }

    static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
