package com.aerarisk.core.pipeline;

import com.aerarisk.core.model.RiskScoreUpdate;
import com.aerarisk.core.model.VulnerabilityProfile;

import java.util.List;

/**
 * Source of the population and target of the risk score write-back.
 *
 * @since 1.0.0
 */
public interface PopulationStore {

    /**
     * @return every current profile, possibly empty
     * @throws UpstreamException if the store cannot be read
     */
    List<VulnerabilityProfile> loadAll();

    /**
     * Overwrite the stored risk score of each listed profile. No other column
     * is touched.
     *
     * @param updates one update per profile id
     * @throws UpstreamException if the write is rejected
     */
    void updateRiskScores(List<RiskScoreUpdate> updates);
}
