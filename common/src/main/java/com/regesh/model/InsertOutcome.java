package com.regesh.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of inserting a single entity.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InsertOutcome {

    String rowKey;
    boolean success;
    String errorMessage;

    public static InsertOutcome inserted(String rowKey) {
        return new InsertOutcome(rowKey, true, null);
    }

    public static InsertOutcome failed(String rowKey, String errorMessage) {
        return new InsertOutcome(rowKey, false, errorMessage);
    }
}
