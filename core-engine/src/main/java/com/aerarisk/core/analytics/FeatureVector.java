package com.aerarisk.core.analytics;

import com.aerarisk.core.model.VulnerabilityProfile;

import java.util.List;
import java.util.Objects;

/**
 * Numeric projection of a scored profile used as model input.
 *
 * <p>
 * Column order is fixed by {@link #FEATURE_NAMES}. Booleans map to 0/1, with
 * transportation access encoded as 1 when the household has access.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    /** Column names in matrix order. */
    public static final List<String> FEATURE_NAMES = List.of(
            "risk_score",
            "household_size",
            "medication_dependency",
            "insulin_dependency",
            "oxygen_powered_device",
            "mobility_limitation",
            "transportation_access",
            "financial_strain");

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    /**
     * @param profile a profile; a missing risk score is read as 0
     * @return the profile's feature vector
     */
    public static FeatureVector of(VulnerabilityProfile profile) {
        Objects.requireNonNull(profile, "Profile must not be null");
        double risk = profile.getRiskScore() != null ? profile.getRiskScore() : 0.0;
        return new FeatureVector(new double[] {
                risk,
                profile.effectiveHouseholdSize(),
                bit(profile.hasMedicationDependency()),
                bit(profile.hasInsulinDependency()),
                bit(profile.hasOxygenPoweredDevice()),
                bit(profile.hasMobilityLimitation()),
                bit(profile.hasTransportationAccess()),
                bit(profile.hasFinancialStrain())
        });
    }

    /**
     * @return a copy of the values in {@link #FEATURE_NAMES} order
     */
    public double[] toArray() {
        return values.clone();
    }

    public double get(int column) {
        return values[column];
    }

    public static int dimension() {
        return FEATURE_NAMES.size();
    }

    private static double bit(boolean flag) {
        return flag ? 1.0 : 0.0;
    }
}
