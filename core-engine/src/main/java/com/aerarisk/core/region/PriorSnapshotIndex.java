package com.aerarisk.core.region;

import com.aerarisk.core.model.RegionKey;
import com.aerarisk.core.model.RegionSnapshot;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Average risk of the prior window, looked up by (county, state).
 *
 * <p>
 * The organization is not part of the lookup key. When several prior rows
 * share a county and state the last one wins. A missing average is read
 * as 0, which disables drift for that region.
 * </p>
 *
 * @since 1.0.0
 */
public final class PriorSnapshotIndex {

    private final Map<String, Double> averages;

    private PriorSnapshotIndex(Map<String, Double> averages) {
        this.averages = averages;
    }

    public static PriorSnapshotIndex empty() {
        return new PriorSnapshotIndex(Map.of());
    }

    /**
     * @param priorSnapshots snapshots dated at the start of the window
     * @return the index
     */
    public static PriorSnapshotIndex of(List<RegionSnapshot> priorSnapshots) {
        Objects.requireNonNull(priorSnapshots, "Prior snapshots must not be null");
        Map<String, Double> averages = new HashMap<>();
        for (RegionSnapshot prior : priorSnapshots) {
            double avg = prior.getAvgRiskScore() != null ? prior.getAvgRiskScore() : 0.0;
            averages.put(key(prior.getCountyId(), prior.getStateId()), avg);
        }
        return new PriorSnapshotIndex(averages);
    }

    /**
     * @return the prior average for the region's county and state, 0 when absent
     */
    public double previousAverage(RegionKey region) {
        return averages.getOrDefault(key(region.getCountyId(), region.getStateId()), 0.0);
    }

    public int size() {
        return averages.size();
    }

    private static String key(String countyId, String stateId) {
        return RegionKey.orUnknown(countyId) + '\u0000' + RegionKey.orUnknown(stateId);
    }
}
