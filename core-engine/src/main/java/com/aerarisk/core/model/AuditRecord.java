package com.aerarisk.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable audit row for one pipeline stage, appended to {@code model_audit_log}.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code runId}, {@code modelName},
 * {@code modelVersion}, {@code stage}, {@code status}, {@code startedAt} and
 * {@code finishedAt} are required; {@code durationMs} is derived from the two
 * timestamps.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class AuditRecord {

    /** Initiator recorded for scheduled runs. */
    public static final String NIGHTLY_INITIATOR = "nightly_pipeline";

    @JsonProperty("run_id")
    private final String runId;

    @JsonProperty("model_name")
    private final String modelName;

    @JsonProperty("model_version")
    private final String modelVersion;

    private final PipelineStage stage;

    private final StageStatus status;

    @JsonProperty("started_at")
    private final Instant startedAt;

    @JsonProperty("finished_at")
    private final Instant finishedAt;

    @JsonProperty("duration_ms")
    private final long durationMs;

    @JsonProperty("processed_records")
    private final int processedRecords;

    @JsonProperty("feature_set")
    private final List<String> featureSet;

    private final Map<String, Object> metrics;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonProperty("initiated_by")
    private final String initiatedBy;

    private AuditRecord(Builder b) {
        this.runId = Objects.requireNonNull(b.runId, "runId must not be null");
        this.modelName = Objects.requireNonNull(b.modelName, "modelName must not be null");
        this.modelVersion = Objects.requireNonNull(b.modelVersion, "modelVersion must not be null");
        this.stage = Objects.requireNonNull(b.stage, "stage must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.startedAt = Objects.requireNonNull(b.startedAt, "startedAt must not be null");
        this.finishedAt = Objects.requireNonNull(b.finishedAt, "finishedAt must not be null");
        this.durationMs = Math.max(0, finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        this.processedRecords = b.processedRecords;
        this.featureSet = List.copyOf(b.featureSet);
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.metrics));
        this.errorMessage = b.errorMessage;
        this.initiatedBy = b.initiatedBy;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AuditRecord}.
     */
    public static class Builder {
        private String runId;
        private String modelName;
        private String modelVersion;
        private PipelineStage stage;
        private StageStatus status;
        private Instant startedAt;
        private Instant finishedAt;
        private int processedRecords;
        private List<String> featureSet = List.of();
        private final Map<String, Object> metrics = new LinkedHashMap<>();
        private String errorMessage;
        private String initiatedBy = NIGHTLY_INITIATOR;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder stage(PipelineStage stage) {
            this.stage = stage;
            return this;
        }

        public Builder status(StageStatus status) {
            this.status = status;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder processedRecords(int processedRecords) {
            this.processedRecords = processedRecords;
            return this;
        }

        public Builder featureSet(List<String> featureSet) {
            this.featureSet = Objects.requireNonNull(featureSet, "featureSet must not be null");
            return this;
        }

        public Builder metrics(Map<String, ?> metrics) {
            if (metrics != null) {
                this.metrics.putAll(metrics);
            }
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder initiatedBy(String initiatedBy) {
            this.initiatedBy = initiatedBy;
            return this;
        }

        /**
         * @return a new audit record
         * @throws NullPointerException if a required field is missing
         */
        public AuditRecord build() {
            return new AuditRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getRunId() {
        return runId;
    }

    public String getModelName() {
        return modelName;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public StageStatus getStatus() {
        return status;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getProcessedRecords() {
        return processedRecords;
    }

    public List<String> getFeatureSet() {
        return featureSet;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getInitiatedBy() {
        return initiatedBy;
    }

    @Override
    public String toString() {
        return "AuditRecord{" +
                "runId='" + runId + '\'' +
                ", stage=" + stage.getAuditName() +
                ", status=" + status +
                ", processedRecords=" + processedRecords +
                ", durationMs=" + durationMs +
                ", metrics=" + metrics +
                (errorMessage != null ? ", errorMessage='" + errorMessage + '\'' : "") +
                '}';
    }
}
