package com.aerarisk.core.pipeline;

import java.util.Objects;

/**
 * Summary of a successful run.
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final String runId;
    private final int processedProfiles;
    private final int snapshotCount;

    public PipelineResult(String runId, int processedProfiles, int snapshotCount) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.processedProfiles = processedProfiles;
        this.snapshotCount = snapshotCount;
    }

    public String getRunId() {
        return runId;
    }

    public int getProcessedProfiles() {
        return processedProfiles;
    }

    public int getSnapshotCount() {
        return snapshotCount;
    }

    @Override
    public String toString() {
        return "PipelineResult{runId='" + runId + "', profiles=" + processedProfiles
                + ", snapshots=" + snapshotCount + '}';
    }
}
