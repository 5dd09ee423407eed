package com.regesh.model;

import lombok.Value;

/**
 * Insert counts of one persist call.  {@code inserted + failed} equals the number of
 * entities handed to the persister.
 */
@Value
public class PersistSummary {

    public static final PersistSummary EMPTY = new PersistSummary(0, 0);

    int inserted;
    int failed;

    public int getTotal() {
        return inserted + failed;
    }
}
