package com.aerarisk.core.model;

import java.util.Objects;

/**
 * A scored profile together with its run-scoped model labels.
 *
 * <p>
 * Never persisted; lives for the duration of one run between the model
 * stages and region aggregation.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoredProfile {

    private final VulnerabilityProfile profile;
    private final int kmeansCluster;
    private final int dbscanCluster;
    private final boolean outlier;

    /**
     * @param profile       the scored profile; its risk score must be set
     * @param kmeansCluster centroid cluster id
     * @param dbscanCluster density cluster id, {@code -1} for noise
     * @param outlier       isolation forest verdict
     */
    public ScoredProfile(VulnerabilityProfile profile, int kmeansCluster, int dbscanCluster, boolean outlier) {
        this.profile = Objects.requireNonNull(profile, "Profile must not be null");
        Objects.requireNonNull(profile.getRiskScore(),
                "Profile '" + profile.getId() + "' has not been scored");
        this.kmeansCluster = kmeansCluster;
        this.dbscanCluster = dbscanCluster;
        this.outlier = outlier;
    }

    public double getRiskScore() {
        return profile.getRiskScore();
    }

    public RegionKey getRegionKey() {
        return RegionKey.of(profile);
    }

    public int getKmeansCluster() {
        return kmeansCluster;
    }

    public int getDbscanCluster() {
        return dbscanCluster;
    }

    public boolean isOutlier() {
        return outlier;
    }

    @Override
    public String toString() {
        return "ScoredProfile{" +
                "id='" + profile.getId() + '\'' +
                ", riskScore=" + profile.getRiskScore() +
                ", kmeansCluster=" + kmeansCluster +
                ", dbscanCluster=" + dbscanCluster +
                ", outlier=" + outlier +
                '}';
    }
}
