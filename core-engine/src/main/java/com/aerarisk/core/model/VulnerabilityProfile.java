package com.aerarisk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One household vulnerability profile as stored in {@code vulnerability_profiles}.
 *
 * <p>
 * Every attribute is nullable because rows arrive straight from the store.
 * The {@code has*} / {@code effective*} accessors apply the defaults used by
 * scoring and feature extraction: missing risk factors are {@code false},
 * missing transportation access is {@code true}, and the household size
 * defaults to 1 and is floored at 1.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The pipeline mutates {@link #setRiskScore(Double)} once
 * per run from a single thread.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VulnerabilityProfile {

    /** Household size used when the stored value is absent. */
    public static final double DEFAULT_HOUSEHOLD_SIZE = 1.0;

    private String id;

    @JsonProperty("organization_id")
    private String organizationId;

    @JsonProperty("county_id")
    private String countyId;

    @JsonProperty("state_id")
    private String stateId;

    @JsonProperty("household_size")
    private Double householdSize;

    @JsonProperty("medication_dependency")
    private Boolean medicationDependency;

    @JsonProperty("insulin_dependency")
    private Boolean insulinDependency;

    @JsonProperty("oxygen_powered_device")
    private Boolean oxygenPoweredDevice;

    @JsonProperty("mobility_limitation")
    private Boolean mobilityLimitation;

    @JsonProperty("transportation_access")
    private Boolean transportationAccess;

    @JsonProperty("financial_strain")
    private Boolean financialStrain;

    @JsonProperty("risk_score")
    private Double riskScore;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;

    // ---------------------------------------------------------------
    // Defaulted views
    // ---------------------------------------------------------------

    /**
     * @return the household size, 1 when absent, never below 1
     */
    public double effectiveHouseholdSize() {
        double size = householdSize != null ? householdSize : DEFAULT_HOUSEHOLD_SIZE;
        return Math.max(size, DEFAULT_HOUSEHOLD_SIZE);
    }

    public boolean hasMedicationDependency() {
        return Boolean.TRUE.equals(medicationDependency);
    }

    public boolean hasInsulinDependency() {
        return Boolean.TRUE.equals(insulinDependency);
    }

    public boolean hasOxygenPoweredDevice() {
        return Boolean.TRUE.equals(oxygenPoweredDevice);
    }

    public boolean hasMobilityLimitation() {
        return Boolean.TRUE.equals(mobilityLimitation);
    }

    /**
     * @return {@code true} unless the profile explicitly reports no access
     */
    public boolean hasTransportationAccess() {
        return !Boolean.FALSE.equals(transportationAccess);
    }

    public boolean hasFinancialStrain() {
        return Boolean.TRUE.equals(financialStrain);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public Double getHouseholdSize() {
        return householdSize;
    }

    public void setHouseholdSize(Double householdSize) {
        this.householdSize = householdSize;
    }

    public Boolean getMedicationDependency() {
        return medicationDependency;
    }

    public void setMedicationDependency(Boolean medicationDependency) {
        this.medicationDependency = medicationDependency;
    }

    public Boolean getInsulinDependency() {
        return insulinDependency;
    }

    public void setInsulinDependency(Boolean insulinDependency) {
        this.insulinDependency = insulinDependency;
    }

    public Boolean getOxygenPoweredDevice() {
        return oxygenPoweredDevice;
    }

    public void setOxygenPoweredDevice(Boolean oxygenPoweredDevice) {
        this.oxygenPoweredDevice = oxygenPoweredDevice;
    }

    public Boolean getMobilityLimitation() {
        return mobilityLimitation;
    }

    public void setMobilityLimitation(Boolean mobilityLimitation) {
        this.mobilityLimitation = mobilityLimitation;
    }

    public Boolean getTransportationAccess() {
        return transportationAccess;
    }

    public void setTransportationAccess(Boolean transportationAccess) {
        this.transportationAccess = transportationAccess;
    }

    public Boolean getFinancialStrain() {
        return financialStrain;
    }

    public void setFinancialStrain(Boolean financialStrain) {
        this.financialStrain = financialStrain;
    }

    public Double getRiskScore() {
        return riskScore;
    }

    public void setRiskScore(Double riskScore) {
        this.riskScore = riskScore;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof VulnerabilityProfile that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "VulnerabilityProfile{" +
                "id='" + id + '\'' +
                ", organizationId='" + organizationId + '\'' +
                ", countyId='" + countyId + '\'' +
                ", stateId='" + stateId + '\'' +
                ", riskScore=" + riskScore +
                '}';
    }
}
