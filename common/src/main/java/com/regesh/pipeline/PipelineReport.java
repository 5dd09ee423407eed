package com.regesh.pipeline;

import com.regesh.model.PersistSummary;
import com.regesh.model.TableSummary;
import lombok.Builder;
import lombok.Value;

/**
 * What a completed run reports back, even when some batches or inserts failed.
 */
@Value
@Builder
public class PipelineReport {

    String runId;
    String partitionKey;
    String tableName;
    /** Number of input records that went through the pipeline. */
    int totalProcessed;
    /** Records that carry the sentinel classification. */
    int classificationErrors;
    PersistSummary persistSummary;
    TableSummary tableSummary;

    public int getInserted() {
        return persistSummary.getInserted();
    }

    public int getFailed() {
        return persistSummary.getFailed();
    }

    public boolean isFullySuccessful() {
        return classificationErrors == 0 && persistSummary.getFailed() == 0;
    }
}
