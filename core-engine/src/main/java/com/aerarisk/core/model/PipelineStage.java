package com.aerarisk.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audited stages of a nightly run, in execution order.
 *
 * <p>
 * {@link #PIPELINE} is the run-level record written once at the end of a
 * run (success, empty input or failure).
 * </p>
 *
 * @since 1.0.0
 */
public enum PipelineStage {
    RISK_SCORE("risk_score"),
    KMEANS("kmeans"),
    DBSCAN("dbscan"),
    ISOLATION_FOREST("isolation_forest"),
    DRIFT("drift"),
    PIPELINE("pipeline");

    private final String auditName;

    PipelineStage(String auditName) {
        this.auditName = auditName;
    }

    /**
     * @return the stage name as written to the audit log
     */
    @JsonValue
    public String getAuditName() {
        return auditName;
    }
}
