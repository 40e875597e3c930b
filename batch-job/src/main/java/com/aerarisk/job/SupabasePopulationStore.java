package com.aerarisk.job;

import com.aerarisk.core.model.RiskScoreUpdate;
import com.aerarisk.core.model.VulnerabilityProfile;
import com.aerarisk.core.pipeline.PopulationStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PopulationStore} backed by the {@value #TABLE} table.
 *
 * @since 1.0.0
 */
public class SupabasePopulationStore implements PopulationStore {

    static final String TABLE = "vulnerability_profiles";

    static final String COLUMNS = "id,organization_id,county_id,state_id,household_size,"
            + "medication_dependency,insulin_dependency,oxygen_powered_device,mobility_limitation,"
            + "transportation_access,financial_strain,risk_score,updated_at";

    private final SupabaseClient client;

    public SupabasePopulationStore(SupabaseClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public List<VulnerabilityProfile> loadAll() {
        return client.select(TABLE, COLUMNS, Map.of(), VulnerabilityProfile.class);
    }

    @Override
    public void updateRiskScores(List<RiskScoreUpdate> updates) {
        client.upsert(TABLE, updates, "id");
    }
}
