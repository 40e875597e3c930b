package com.aerarisk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-region risk summary for one run date, stored in {@code region_snapshots}.
 *
 * <p>
 * The natural key is ({@code snapshotDate}, {@code countyId}, {@code stateId},
 * {@code organizationId}); stores upsert on it so a re-run on the same date
 * replaces the previous row.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code snapshotDate}, {@code countyId} and
 * {@code stateId} are required. The no-arg constructor and setters exist for
 * Jackson, which also reads the partial rows returned by prior-window lookups.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class RegionSnapshot {

    /** Length of the comparison window stamped on every snapshot. */
    public static final int DEFAULT_WINDOW_DAYS = 30;

    @JsonProperty("snapshot_date")
    private LocalDate snapshotDate;

    @JsonProperty("snapshot_window_days")
    private int windowDays = DEFAULT_WINDOW_DAYS;

    @JsonProperty("organization_id")
    private String organizationId;

    @JsonProperty("county_id")
    private String countyId;

    @JsonProperty("state_id")
    private String stateId;

    @JsonProperty("profile_count")
    private int profileCount;

    @JsonProperty("avg_risk_score")
    private Double avgRiskScore;

    @JsonProperty("max_risk_score")
    private Double maxRiskScore;

    @JsonProperty("min_risk_score")
    private Double minRiskScore;

    @JsonProperty("risk_growth_pct")
    private double riskGrowthPct;

    @JsonProperty("drift_value")
    private double driftValue;

    @JsonProperty("drift_status")
    private DriftStatus driftStatus = DriftStatus.STABLE;

    @JsonProperty("kmeans_cluster")
    private Integer kmeansCluster;

    @JsonProperty("dbscan_cluster")
    private Integer dbscanCluster;

    @JsonProperty("anomaly_count")
    private int anomalyCount;

    @JsonProperty("projection_14d")
    private Double projection14d;

    @JsonProperty("model_version")
    private String modelVersion;

    @JsonProperty("pipeline_run_id")
    private String pipelineRunId;

    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public RegionSnapshot() {
    }

    private RegionSnapshot(Builder b) {
        this.snapshotDate = Objects.requireNonNull(b.snapshotDate, "snapshotDate must not be null");
        this.countyId = Objects.requireNonNull(b.countyId, "countyId must not be null");
        this.stateId = Objects.requireNonNull(b.stateId, "stateId must not be null");
        this.windowDays = b.windowDays;
        this.organizationId = b.organizationId;
        this.profileCount = b.profileCount;
        this.avgRiskScore = b.avgRiskScore;
        this.maxRiskScore = b.maxRiskScore;
        this.minRiskScore = b.minRiskScore;
        this.riskGrowthPct = b.riskGrowthPct;
        this.driftValue = b.driftValue;
        this.driftStatus = b.driftStatus;
        this.kmeansCluster = b.kmeansCluster;
        this.dbscanCluster = b.dbscanCluster;
        this.anomalyCount = b.anomalyCount;
        this.projection14d = b.projection14d;
        this.modelVersion = b.modelVersion;
        this.pipelineRunId = b.pipelineRunId;
        this.metadata = new LinkedHashMap<>(b.metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the (county, state, organization) part of the natural key
     */
    public RegionKey regionKey() {
        return RegionKey.of(countyId, stateId, organizationId);
    }

    /**
     * Fluent builder for {@link RegionSnapshot}.
     */
    public static class Builder {
        private LocalDate snapshotDate;
        private int windowDays = DEFAULT_WINDOW_DAYS;
        private String organizationId;
        private String countyId;
        private String stateId;
        private int profileCount;
        private Double avgRiskScore;
        private Double maxRiskScore;
        private Double minRiskScore;
        private double riskGrowthPct;
        private double driftValue;
        private DriftStatus driftStatus = DriftStatus.STABLE;
        private Integer kmeansCluster;
        private Integer dbscanCluster;
        private int anomalyCount;
        private Double projection14d;
        private String modelVersion;
        private String pipelineRunId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder snapshotDate(LocalDate snapshotDate) {
            this.snapshotDate = snapshotDate;
            return this;
        }

        public Builder windowDays(int windowDays) {
            this.windowDays = windowDays;
            return this;
        }

        public Builder regionKey(RegionKey key) {
            this.countyId = key.getCountyId();
            this.stateId = key.getStateId();
            this.organizationId = key.getOrganizationId();
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder countyId(String countyId) {
            this.countyId = countyId;
            return this;
        }

        public Builder stateId(String stateId) {
            this.stateId = stateId;
            return this;
        }

        public Builder profileCount(int profileCount) {
            this.profileCount = profileCount;
            return this;
        }

        public Builder avgRiskScore(double avgRiskScore) {
            this.avgRiskScore = avgRiskScore;
            return this;
        }

        public Builder maxRiskScore(double maxRiskScore) {
            this.maxRiskScore = maxRiskScore;
            return this;
        }

        public Builder minRiskScore(double minRiskScore) {
            this.minRiskScore = minRiskScore;
            return this;
        }

        public Builder riskGrowthPct(double riskGrowthPct) {
            this.riskGrowthPct = riskGrowthPct;
            return this;
        }

        public Builder driftValue(double driftValue) {
            this.driftValue = driftValue;
            return this;
        }

        public Builder driftStatus(DriftStatus driftStatus) {
            this.driftStatus = Objects.requireNonNull(driftStatus, "driftStatus must not be null");
            return this;
        }

        public Builder kmeansCluster(Integer kmeansCluster) {
            this.kmeansCluster = kmeansCluster;
            return this;
        }

        public Builder dbscanCluster(Integer dbscanCluster) {
            this.dbscanCluster = dbscanCluster;
            return this;
        }

        public Builder anomalyCount(int anomalyCount) {
            this.anomalyCount = anomalyCount;
            return this;
        }

        public Builder projection14d(double projection14d) {
            this.projection14d = projection14d;
            return this;
        }

        public Builder modelVersion(String modelVersion) {
            this.modelVersion = modelVersion;
            return this;
        }

        public Builder pipelineRunId(String pipelineRunId) {
            this.pipelineRunId = pipelineRunId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * @return a new snapshot
         * @throws NullPointerException if the date, county or state is missing
         */
        public RegionSnapshot build() {
            return new RegionSnapshot(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public LocalDate getSnapshotDate() {
        return snapshotDate;
    }

    public void setSnapshotDate(LocalDate snapshotDate) {
        this.snapshotDate = snapshotDate;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getCountyId() {
        return countyId;
    }

    public void setCountyId(String countyId) {
        this.countyId = countyId;
    }

    public String getStateId() {
        return stateId;
    }

    public void setStateId(String stateId) {
        this.stateId = stateId;
    }

    public int getProfileCount() {
        return profileCount;
    }

    public void setProfileCount(int profileCount) {
        this.profileCount = profileCount;
    }

    public Double getAvgRiskScore() {
        return avgRiskScore;
    }

    public void setAvgRiskScore(Double avgRiskScore) {
        this.avgRiskScore = avgRiskScore;
    }

    public Double getMaxRiskScore() {
        return maxRiskScore;
    }

    public void setMaxRiskScore(Double maxRiskScore) {
        this.maxRiskScore = maxRiskScore;
    }

    public Double getMinRiskScore() {
        return minRiskScore;
    }

    public void setMinRiskScore(Double minRiskScore) {
        this.minRiskScore = minRiskScore;
    }

    public double getRiskGrowthPct() {
        return riskGrowthPct;
    }

    public void setRiskGrowthPct(double riskGrowthPct) {
        this.riskGrowthPct = riskGrowthPct;
    }

    public double getDriftValue() {
        return driftValue;
    }

    public void setDriftValue(double driftValue) {
        this.driftValue = driftValue;
    }

    public DriftStatus getDriftStatus() {
        return driftStatus;
    }

    public void setDriftStatus(DriftStatus driftStatus) {
        this.driftStatus = driftStatus;
    }

    public Integer getKmeansCluster() {
        return kmeansCluster;
    }

    public void setKmeansCluster(Integer kmeansCluster) {
        this.kmeansCluster = kmeansCluster;
    }

    public Integer getDbscanCluster() {
        return dbscanCluster;
    }

    public void setDbscanCluster(Integer dbscanCluster) {
        this.dbscanCluster = dbscanCluster;
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    public void setAnomalyCount(int anomalyCount) {
        this.anomalyCount = anomalyCount;
    }

    public Double getProjection14d() {
        return projection14d;
    }

    public void setProjection14d(Double projection14d) {
        this.projection14d = projection14d;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public String getPipelineRunId() {
        return pipelineRunId;
    }

    public void setPipelineRunId(String pipelineRunId) {
        this.pipelineRunId = pipelineRunId;
    }

    /**
     * @return unmodifiable view of the free-form metadata
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    /**
     * Two snapshots are equal when they share the natural key.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegionSnapshot that))
            return false;
        return Objects.equals(snapshotDate, that.snapshotDate)
                && Objects.equals(countyId, that.countyId)
                && Objects.equals(stateId, that.stateId)
                && Objects.equals(organizationId, that.organizationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshotDate, countyId, stateId, organizationId);
    }

    @Override
    public String toString() {
        return "RegionSnapshot{" +
                "snapshotDate=" + snapshotDate +
                ", region=" + countyId + "/" + stateId + "/" + organizationId +
                ", profileCount=" + profileCount +
                ", avgRiskScore=" + avgRiskScore +
                ", driftValue=" + driftValue +
                ", driftStatus=" + driftStatus +
                '}';
    }
}
