package com.regesh.source;

import com.regesh.model.InputRecord;

import java.io.IOException;
import java.util.List;

/**
 * Fetches the input records of a run from blob storage.
 */
public interface RecordSource {

    /**
     * Reads the blob {@code blobName} of {@code container} as a JSON array of records.
     *
     * @return the records in array order
     * @throws IOException if the blob cannot be read or is not a JSON array of objects
     */
    List<InputRecord> fetch(String container, String blobName) throws IOException;
}
