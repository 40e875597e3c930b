package com.aerarisk.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Write-back row for a recomputed risk score, keyed by profile id.
 *
 * @since 1.0.0
 */
public class RiskScoreUpdate {

    private final String id;

    @JsonProperty("risk_score")
    private final double riskScore;

    public RiskScoreUpdate(String id, double riskScore) {
        this.id = Objects.requireNonNull(id, "Profile id must not be null");
        this.riskScore = riskScore;
    }

    /**
     * @param profile a scored profile
     * @return the update carrying the profile's current score
     * @throws NullPointerException if the profile has no score yet
     */
    public static RiskScoreUpdate of(VulnerabilityProfile profile) {
        Objects.requireNonNull(profile.getRiskScore(),
                "Profile '" + profile.getId() + "' has not been scored");
        return new RiskScoreUpdate(profile.getId(), profile.getRiskScore());
    }

    public String getId() {
        return id;
    }

    public double getRiskScore() {
        return riskScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RiskScoreUpdate that))
            return false;
        return Double.compare(riskScore, that.riskScore) == 0 && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, riskScore);
    }

    @Override
    public String toString() {
        return "RiskScoreUpdate{id='" + id + "', riskScore=" + riskScore + '}';
    }
}
