package com.aerarisk.core.model;

import java.util.Objects;

/**
 * Grouping key of a region snapshot: county, state and owning organization.
 *
 * <p>
 * Missing or blank county and state ids are bucketed under
 * {@value #UNKNOWN}. The organization id is kept as-is and may be
 * {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegionKey {

    /** Placeholder for an absent county or state id. */
    public static final String UNKNOWN = "UNKNOWN";

    private final String countyId;
    private final String stateId;
    private final String organizationId;

    private RegionKey(String countyId, String stateId, String organizationId) {
        this.countyId = countyId;
        this.stateId = stateId;
        this.organizationId = organizationId;
    }

    /**
     * @param countyId       county id, may be {@code null} or blank
     * @param stateId        state id, may be {@code null} or blank
     * @param organizationId organization id, may be {@code null}
     * @return the normalised key
     */
    public static RegionKey of(String countyId, String stateId, String organizationId) {
        return new RegionKey(orUnknown(countyId), orUnknown(stateId), organizationId);
    }

    public static RegionKey of(VulnerabilityProfile profile) {
        Objects.requireNonNull(profile, "Profile must not be null");
        return of(profile.getCountyId(), profile.getStateId(), profile.getOrganizationId());
    }

    /**
     * Normalise a county or state id.
     *
     * @param id raw id
     * @return {@code id}, or {@value #UNKNOWN} when it is {@code null} or blank
     */
    public static String orUnknown(String id) {
        return id == null || id.isBlank() ? UNKNOWN : id;
    }

    public String getCountyId() {
        return countyId;
    }

    public String getStateId() {
        return stateId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegionKey that))
            return false;
        return countyId.equals(that.countyId)
                && stateId.equals(that.stateId)
                && Objects.equals(organizationId, that.organizationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(countyId, stateId, organizationId);
    }

    @Override
    public String toString() {
        return countyId + "/" + stateId + "/" + organizationId;
    }
}
