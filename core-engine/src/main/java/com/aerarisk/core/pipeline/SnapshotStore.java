package com.aerarisk.core.pipeline;

import com.aerarisk.core.model.RegionSnapshot;

import java.time.LocalDate;
import java.util.List;

/**
 * Storage of region snapshots.
 *
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * @param snapshotDate the date to read
     * @return snapshots dated exactly {@code snapshotDate}; at least county,
     *         state and average risk must be populated
     * @throws UpstreamException if the store cannot be read
     */
    List<RegionSnapshot> findByDate(LocalDate snapshotDate);

    /**
     * Insert or replace snapshots on (snapshot date, county, state,
     * organization). An existing row with the same key is overwritten, never
     * duplicated.
     *
     * @param snapshots rows to upsert
     * @throws UpstreamException if the write is rejected
     */
    void upsert(List<RegionSnapshot> snapshots);
}
