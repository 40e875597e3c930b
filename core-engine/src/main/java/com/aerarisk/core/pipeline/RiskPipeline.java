package com.aerarisk.core.pipeline;

import com.aerarisk.core.analytics.DensityClusterDetector;
import com.aerarisk.core.analytics.FeatureStandardizer;
import com.aerarisk.core.analytics.FeatureVector;
import com.aerarisk.core.analytics.KMeansClusterAssigner;
import com.aerarisk.core.analytics.OutlierScorer;
import com.aerarisk.core.analytics.RiskScorer;
import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.model.AuditRecord;
import com.aerarisk.core.model.PipelineStage;
import com.aerarisk.core.model.RegionSnapshot;
import com.aerarisk.core.model.RiskScoreUpdate;
import com.aerarisk.core.model.ScoredProfile;
import com.aerarisk.core.model.StageStatus;
import com.aerarisk.core.model.VulnerabilityProfile;
import com.aerarisk.core.region.PriorSnapshotIndex;
import com.aerarisk.core.region.RegionAggregator;
import com.aerarisk.core.util.Decimals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One nightly pass over the whole population.
 *
 * <p>
 * Stages run strictly in order: score and write back, standardize, k-means,
 * DBSCAN, isolation forest, then region aggregation against the prior window
 * and the snapshot upsert. Every completed stage appends a SUCCESS audit
 * record, and the run ends with a {@code pipeline} record.
 * </p>
 *
 * <p>
 * Any exception aborts the run. A single FAILED {@code pipeline} record is
 * then attempted; if that write fails too it is attached to the original
 * exception as suppressed and logged, and the original is rethrown.
 * Writes already performed are not rolled back.
 * </p>
 *
 * @since 1.0.0
 */
public class RiskPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(RiskPipeline.class);

    /** Feature set reported on every audit record. */
    public static final List<String> AUDIT_FEATURE_SET = List.of(
            "household_size",
            "medication_dependency",
            "insulin_dependency",
            "oxygen_powered_device",
            "mobility_limitation",
            "transportation_access",
            "financial_strain",
            "risk_score");

    static final String NO_RECORDS_MESSAGE = "no records";

    private final ModelConfig config;
    private final PopulationStore populationStore;
    private final SnapshotStore snapshotStore;
    private final AuditSink auditSink;

    private final RiskScorer scorer;
    private final FeatureStandardizer standardizer;
    private final KMeansClusterAssigner kmeans;
    private final DensityClusterDetector dbscan;
    private final OutlierScorer outlierScorer;
    private final RegionAggregator aggregator;

    public RiskPipeline(ModelConfig config,
            PopulationStore populationStore,
            SnapshotStore snapshotStore,
            AuditSink auditSink) {
        this.config = Objects.requireNonNull(config, "Model configuration must not be null");
        this.populationStore = Objects.requireNonNull(populationStore, "Population store must not be null");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "Snapshot store must not be null");
        this.auditSink = Objects.requireNonNull(auditSink, "Audit sink must not be null");

        this.scorer = new RiskScorer(config.getScoring());
        this.standardizer = new FeatureStandardizer();
        this.kmeans = new KMeansClusterAssigner(config.getKmeans());
        this.dbscan = new DensityClusterDetector(config.getDbscan());
        this.outlierScorer = new OutlierScorer(config.getIsolationForest());
        this.aggregator = new RegionAggregator(config.getDrift());
    }

    /**
     * Execute the full pipeline.
     *
     * @param context identity and clock of this run
     * @return processed profile and snapshot counts
     * @throws RuntimeException whatever aborted the run, after the FAILED audit
     *                          attempt
     */
    public PipelineResult run(RunContext context) {
        Objects.requireNonNull(context, "Run context must not be null");
        LOG.info("Starting risk pipeline run {} (model {} version {}, run date {})",
                context.getRunId(), context.getModelName(), context.getModelVersion(), context.getRunDate());
        try {
            return execute(context);
        } catch (RuntimeException e) {
            recordFailure(context, e);
            throw e;
        }
    }

    // ---------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------

    private PipelineResult execute(RunContext context) {
        Instant stageStart = context.now();
        List<VulnerabilityProfile> profiles = populationStore.loadAll();
        int n = profiles.size();

        if (n == 0) {
            audit(context, PipelineStage.PIPELINE, StageStatus.SUCCESS, context.getStartedAt(), 0,
                    Map.of("message", NO_RECORDS_MESSAGE), null);
            LOG.info("Run {} found no profiles, nothing to do", context.getRunId());
            return new PipelineResult(context.getRunId(), 0, 0);
        }

        // risk score
        double meanRisk = scorer.scoreAll(profiles);
        List<RiskScoreUpdate> updates = profiles.stream()
                .map(RiskScoreUpdate::of)
                .collect(Collectors.toList());
        populationStore.updateRiskScores(updates);
        audit(context, PipelineStage.RISK_SCORE, StageStatus.SUCCESS, stageStart, n,
                Map.of("mean_risk", Decimals.round4(meanRisk)), null);
        LOG.info("Scored {} profile(s), mean risk {}", n, Decimals.round4(meanRisk));

        double[][] matrix = standardizer.standardize(profiles.stream()
                .map(FeatureVector::of)
                .collect(Collectors.toList()));

        // k-means
        stageStart = context.now();
        int[] kmeansLabels = kmeans.fitPredict(matrix);
        int clusters = kmeans.clusterCount(n);
        audit(context, PipelineStage.KMEANS, StageStatus.SUCCESS, stageStart, n,
                Map.of("clusters", clusters), null);
        LOG.info("{}: assigned {} profile(s) to {} cluster(s)", kmeans.getModelName(), n, clusters);

        // dbscan
        stageStart = context.now();
        int[] dbscanLabels = dbscan.fitPredict(matrix);
        int noise = DensityClusterDetector.countNoise(dbscanLabels);
        audit(context, PipelineStage.DBSCAN, StageStatus.SUCCESS, stageStart, n,
                Map.of("noise_points", noise), null);
        LOG.info("{}: labelled {} of {} profile(s) as noise", dbscan.getModelName(), noise, n);

        // isolation forest
        stageStart = context.now();
        boolean[] outliers = outlierScorer.fitPredict(matrix);
        int outlierCount = OutlierScorer.countOutliers(outliers);
        audit(context, PipelineStage.ISOLATION_FOREST, StageStatus.SUCCESS, stageStart, n,
                Map.of("outliers", outlierCount), null);
        LOG.info("Isolation forest flagged {} of {} profile(s)", outlierCount, n);

        // drift
        stageStart = context.now();
        List<ScoredProfile> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            scored.add(new ScoredProfile(profiles.get(i), kmeansLabels[i], dbscanLabels[i], outliers[i]));
        }
        LocalDate priorDate = context.priorWindowDate(config.getDrift().getWindowDays());
        PriorSnapshotIndex prior = PriorSnapshotIndex.of(snapshotStore.findByDate(priorDate));
        List<RegionSnapshot> snapshots = aggregator.aggregate(scored, prior, context.getRunDate(),
                context.getModelVersion(), context.getRunId());
        snapshotStore.upsert(snapshots);
        audit(context, PipelineStage.DRIFT, StageStatus.SUCCESS, stageStart, snapshots.size(),
                Map.of("snapshot_rows", snapshots.size()), null);
        LOG.info("Upserted {} region snapshot(s) against {} prior region(s) from {}",
                snapshots.size(), prior.size(), priorDate);

        audit(context, PipelineStage.PIPELINE, StageStatus.SUCCESS, context.getStartedAt(), n,
                Map.of("run_id", context.getRunId()), null);
        LOG.info("Run {} complete: {} profile(s), {} snapshot(s)",
                context.getRunId(), n, snapshots.size());
        return new PipelineResult(context.getRunId(), n, snapshots.size());
    }

    // ---------------------------------------------------------------
    // Audit
    // ---------------------------------------------------------------

    private void audit(RunContext context, PipelineStage stage, StageStatus status, Instant startedAt,
            int processed, Map<String, ?> metrics, String errorMessage) {
        auditSink.record(AuditRecord.builder()
                .runId(context.getRunId())
                .modelName(context.getModelName())
                .modelVersion(context.getModelVersion())
                .stage(stage)
                .status(status)
                .startedAt(startedAt)
                .finishedAt(context.now())
                .processedRecords(processed)
                .featureSet(AUDIT_FEATURE_SET)
                .metrics(metrics)
                .errorMessage(errorMessage)
                .build());
    }

    private void recordFailure(RunContext context, RuntimeException cause) {
        String message = describe(cause);
        try {
            audit(context, PipelineStage.PIPELINE, StageStatus.FAILED, context.getStartedAt(), 0,
                    Map.of("error", message), message);
        } catch (RuntimeException auditFailure) {
            cause.addSuppressed(auditFailure);
            LOG.warn("Could not record failure audit for run {}: {}",
                    context.getRunId(), auditFailure.getMessage());
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
