package com.aerarisk.job;

import com.aerarisk.core.model.RegionSnapshot;
import com.aerarisk.core.pipeline.SnapshotStore;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SnapshotStore} backed by the {@value #TABLE} table.
 *
 * @since 1.0.0
 */
public class SupabaseSnapshotStore implements SnapshotStore {

    static final String TABLE = "region_snapshots";

    static final String PRIOR_COLUMNS = "county_id,state_id,avg_risk_score,snapshot_date";

    static final String NATURAL_KEY = "snapshot_date,county_id,state_id,organization_id";

    private final SupabaseClient client;

    public SupabaseSnapshotStore(SupabaseClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public List<RegionSnapshot> findByDate(LocalDate snapshotDate) {
        Objects.requireNonNull(snapshotDate, "snapshotDate must not be null");
        return client.select(TABLE, PRIOR_COLUMNS,
                Map.of("snapshot_date", "eq." + snapshotDate), RegionSnapshot.class);
    }

    @Override
    public void upsert(List<RegionSnapshot> snapshots) {
        client.upsert(TABLE, snapshots, NATURAL_KEY);
    }
}
