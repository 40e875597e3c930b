package com.aerarisk.core.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity and timing of one pipeline run, passed explicitly to every stage.
 *
 * <p>
 * The run date is the start instant's calendar date in the clock's zone; it
 * keys the snapshots written by the run and anchors the prior window.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunContext {

    private final String runId;
    private final String modelName;
    private final String modelVersion;
    private final Clock clock;
    private final Instant startedAt;
    private final LocalDate runDate;

    private RunContext(String runId, String modelName, String modelVersion, Clock clock) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.modelName = Objects.requireNonNull(modelName, "modelName must not be null");
        this.modelVersion = Objects.requireNonNull(modelVersion, "modelVersion must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
        this.runDate = LocalDate.ofInstant(startedAt, clock.getZone());
    }

    /**
     * Start a new run with a random run id.
     *
     * @param modelName    model name for audit records
     * @param modelVersion model version for audit records and snapshots
     * @param clock        time source
     * @return the context
     */
    public static RunContext start(String modelName, String modelVersion, Clock clock) {
        return new RunContext(UUID.randomUUID().toString(), modelName, modelVersion, clock);
    }

    /**
     * @return the current instant of the run's clock
     */
    public Instant now() {
        return clock.instant();
    }

    /**
     * @param windowDays length of the comparison window
     * @return the date whose snapshots form the baseline of this run
     */
    public LocalDate priorWindowDate(int windowDays) {
        return runDate.minusDays(windowDays);
    }

    public String getRunId() {
        return runId;
    }

    public String getModelName() {
        return modelName;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public LocalDate getRunDate() {
        return runDate;
    }

    @Override
    public String toString() {
        return "RunContext{" +
                "runId='" + runId + '\'' +
                ", model=" + modelName + "@" + modelVersion +
                ", runDate=" + runDate +
                '}';
    }
}
