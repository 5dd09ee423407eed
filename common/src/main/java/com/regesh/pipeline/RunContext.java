package com.regesh.pipeline;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Values fixed once at the start of a run and shared by every record of it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RunContext {

    /** Length of the random token appended to row keys. */
    public static final int TOKEN_LENGTH = 8;

    /** Identifies the run; stored as {@code BatchId} on every entity. */
    String runId;
    /** Calendar date of the run; the partition every entity of the run goes to. */
    LocalDate runDate;
    Clock clock;
    Supplier<String> tokenSupplier;

    /**
     * Starts a run on the given clock with random run id and row-key tokens.
     */
    public static RunContext start(Clock clock) {
        return new RunContext(UUID.randomUUID().toString(), LocalDate.now(clock), clock,
                RunContext::randomToken);
    }

    /**
     * Starts a run with explicit run id and token source.
     */
    public static RunContext of(String runId, Clock clock, Supplier<String> tokenSupplier) {
        return new RunContext(runId, LocalDate.now(clock), clock, tokenSupplier);
    }

    /** Partition key of the run, formatted {@code yyyy-MM-dd}. */
    public String getPartitionKey() {
        return runDate.toString();
    }

    public String nextToken() {
        return tokenSupplier.get();
    }

    private static String randomToken() {
        return UUID.randomUUID().toString().substring(0, TOKEN_LENGTH);
    }
}
