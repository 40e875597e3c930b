package com.aerarisk.core.analytics;

import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.model.VulnerabilityProfile;
import com.aerarisk.core.util.Decimals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Deterministic per-profile risk score.
 *
 * <pre>
 * score = min(max(household, 1) × 0.4, 3.2)
 *       + 1.8·medication + 2.2·insulin + 2.5·oxygen device
 *       + 1.5·mobility + 1.2·(no transportation) + 1.4·financial strain
 * </pre>
 *
 * <p>
 * Weights come from {@link ModelConfig.Scoring}; the result is rounded to four
 * decimals. The score depends only on the profile's own attributes, so it is
 * stable under any re-ordering of the batch.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskScorer {

    private static final Logger LOG = LoggerFactory.getLogger(RiskScorer.class);

    private final ModelConfig.Scoring weights;

    public RiskScorer(ModelConfig.Scoring weights) {
        this.weights = Objects.requireNonNull(weights, "Scoring weights must not be null");
    }

    /**
     * @param profile the profile to score; absent attributes take their defaults
     * @return the non-negative score, rounded to four decimals
     */
    public double score(VulnerabilityProfile profile) {
        Objects.requireNonNull(profile, "Profile must not be null");

        double score = householdComponent(profile.effectiveHouseholdSize())
                + indicator(profile.hasMedicationDependency()) * weights.getMedicationWeight()
                + indicator(profile.hasInsulinDependency()) * weights.getInsulinWeight()
                + indicator(profile.hasOxygenPoweredDevice()) * weights.getOxygenDeviceWeight()
                + indicator(profile.hasMobilityLimitation()) * weights.getMobilityWeight()
                + indicator(!profile.hasTransportationAccess()) * weights.getNoTransportationWeight()
                + indicator(profile.hasFinancialStrain()) * weights.getFinancialStrainWeight();

        return Decimals.round4(score);
    }

    /**
     * Score every profile, replacing its stored risk score.
     *
     * @param profiles profiles to score in place
     * @return mean of the new scores, {@code 0} for an empty list
     */
    public double scoreAll(List<VulnerabilityProfile> profiles) {
        Objects.requireNonNull(profiles, "Profiles must not be null");
        double sum = 0;
        for (VulnerabilityProfile profile : profiles) {
            double score = score(profile);
            profile.setRiskScore(score);
            sum += score;
        }
        double mean = profiles.isEmpty() ? 0 : sum / profiles.size();
        LOG.debug("Scored {} profile(s), mean risk {}", profiles.size(), mean);
        return mean;
    }

    /**
     * @param householdSize household size, already floored at 1
     * @return the capped household contribution
     */
    double householdComponent(double householdSize) {
        double component = Math.max(householdSize, VulnerabilityProfile.DEFAULT_HOUSEHOLD_SIZE)
                * weights.getHouseholdWeight();
        return Math.min(component, weights.getHouseholdCap());
    }

    private static int indicator(boolean flag) {
        return flag ? 1 : 0;
    }
}
