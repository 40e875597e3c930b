package com.aerarisk.core.region;

import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.model.RegionKey;
import com.aerarisk.core.model.RegionSnapshot;
import com.aerarisk.core.model.ScoredProfile;
import com.aerarisk.core.util.Decimals;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups scored profiles into regions and derives one snapshot per region.
 *
 * <h3>Per region</h3>
 * <ul>
 * <li>profile count, mean / max / min risk (rounded to 4 places)</li>
 * <li>anomaly count: number of isolation forest outliers</li>
 * <li>dominant k-means and DBSCAN cluster: most frequent label; on a tie any
 * of the tied labels may be reported</li>
 * <li>drift against the prior window: {@code round((avg - prev) / prev, 4)},
 * or 0 when there is no prior average or it is 0</li>
 * <li>risk growth: same value as drift</li>
 * <li>14-day projection: {@code round(avg × (1 + drift × 0.5), 4)}</li>
 * </ul>
 *
 * <p>
 * Drift and projection use the unrounded mean. Regions are emitted in order
 * of first appearance.
 * </p>
 *
 * @since 1.0.0
 */
public class RegionAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(RegionAggregator.class);

    /** Metadata key identifying the producer of a snapshot. */
    public static final String GENERATED_BY_KEY = "generated_by";

    /** Producer recorded in snapshot metadata. */
    public static final String GENERATED_BY = "aera-nightly-risk-job";

    private final ModelConfig.Drift params;
    private final DriftClassifier classifier;

    public RegionAggregator(ModelConfig.Drift params) {
        this.params = Objects.requireNonNull(params, "Drift parameters must not be null");
        this.classifier = new DriftClassifier(params);
    }

    /**
     * @param profiles     scored and labelled profiles of the whole run
     * @param prior        prior-window averages
     * @param snapshotDate date of the run
     * @param modelVersion model version to stamp
     * @param runId        run id to stamp
     * @return one snapshot per (county, state, organization)
     */
    public List<RegionSnapshot> aggregate(List<ScoredProfile> profiles,
            PriorSnapshotIndex prior,
            LocalDate snapshotDate,
            String modelVersion,
            String runId) {
        Objects.requireNonNull(profiles, "Profiles must not be null");
        Objects.requireNonNull(prior, "Prior snapshot index must not be null");
        Objects.requireNonNull(snapshotDate, "Snapshot date must not be null");

        Map<RegionKey, List<ScoredProfile>> groups = new LinkedHashMap<>();
        for (ScoredProfile profile : profiles) {
            groups.computeIfAbsent(profile.getRegionKey(), k -> new ArrayList<>()).add(profile);
        }

        List<RegionSnapshot> snapshots = new ArrayList<>(groups.size());
        for (Map.Entry<RegionKey, List<ScoredProfile>> group : groups.entrySet()) {
            snapshots.add(summarise(group.getKey(), group.getValue(), prior, snapshotDate, modelVersion, runId));
        }

        LOG.debug("Aggregated {} profile(s) into {} region(s), {} prior region(s) available",
                profiles.size(), snapshots.size(), prior.size());
        return snapshots;
    }

    /**
     * @param current  current unrounded mean risk
     * @param previous prior mean risk, 0 when unknown
     * @return fractional change rounded to 4 places, 0 without a usable baseline
     */
    public static double drift(double current, double previous) {
        if (previous == 0) {
            return 0.0;
        }
        return Decimals.round4((current - previous) / previous);
    }

    /**
     * @return the near-term projection of {@code current} under {@code drift}
     */
    public double projection(double current, double drift) {
        return Decimals.round4(current * (1 + drift * params.getProjectionFactor()));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private RegionSnapshot summarise(RegionKey key,
            List<ScoredProfile> members,
            PriorSnapshotIndex prior,
            LocalDate snapshotDate,
            String modelVersion,
            String runId) {
        int n = members.size();
        double[] risk = new double[n];
        double[] kmeans = new double[n];
        double[] dbscan = new double[n];
        int anomalies = 0;

        for (int i = 0; i < n; i++) {
            ScoredProfile member = members.get(i);
            risk[i] = member.getRiskScore();
            kmeans[i] = member.getKmeansCluster();
            dbscan[i] = member.getDbscanCluster();
            if (member.isOutlier()) {
                anomalies++;
            }
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(risk);
        double avg = stats.getMean();
        double drift = drift(avg, prior.previousAverage(key));

        return RegionSnapshot.builder()
                .snapshotDate(snapshotDate)
                .windowDays(params.getWindowDays())
                .regionKey(key)
                .profileCount(n)
                .avgRiskScore(Decimals.round4(avg))
                .maxRiskScore(Decimals.round4(stats.getMax()))
                .minRiskScore(Decimals.round4(stats.getMin()))
                .anomalyCount(anomalies)
                .kmeansCluster(dominant(kmeans))
                .dbscanCluster(dominant(dbscan))
                .riskGrowthPct(drift)
                .driftValue(drift)
                .driftStatus(classifier.classify(drift))
                .projection14d(projection(avg, drift))
                .modelVersion(modelVersion)
                .pipelineRunId(runId)
                .metadata(GENERATED_BY_KEY, GENERATED_BY)
                .build();
    }

    private static Integer dominant(double[] labels) {
        double[] modes = StatUtils.mode(labels);
        return modes.length == 0 ? null : (int) modes[0];
    }
}
