package com.aerarisk.job;

import com.aerarisk.core.config.ConfigurationException;
import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.config.ModelConfigLoader;
import com.aerarisk.core.pipeline.PipelineResult;
import com.aerarisk.core.pipeline.RiskPipeline;
import com.aerarisk.core.pipeline.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main entry point of the nightly risk job.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   vulnerability_profiles
 *     → score + write back risk_score
 *     → standardize → k-means / DBSCAN / isolation forest
 *     → region aggregation vs. snapshots 30 days earlier
 *     → region_snapshots upsert
 *   every stage → model_audit_log
 * </pre>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} when the run succeeds (including an empty population),
 * {@code 1} on a configuration error or any failure during the run.
 * </p>
 *
 * @since 1.0.0
 */
public final class NightlyRiskJob {

    private static final Logger LOG = LoggerFactory.getLogger(NightlyRiskJob.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private NightlyRiskJob() {
        // entry-point class
    }

    public static void main(String[] args) {
        System.exit(run(Clock.systemUTC()));
    }

    /**
     * Configure and execute one run.
     *
     * @param clock time source of the run
     * @return the process exit status
     */
    static int run(Clock clock) {
        JobConfig config;
        ModelConfig model;
        try {
            // 1. Configuration, before any data is touched
            config = JobConfig.fromEnvironment();
            LOG.info("Starting nightly risk job with config: {}", config);
            model = ModelConfigLoader.load(config.getModelConfigPath());
        } catch (ConfigurationException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        // 2. Wire the store adapters
        SupabaseClient client = new SupabaseClient(config);
        RiskPipeline pipeline = new RiskPipeline(model,
                new SupabasePopulationStore(client),
                new SupabaseSnapshotStore(client),
                new SupabaseAuditSink(client));

        // 3. Execute
        return execute(pipeline, RunContext.start(model.getModelName(), config.getModelVersion(), clock));
    }

    static int execute(RiskPipeline pipeline, RunContext context) {
        try {
            PipelineResult result = pipeline.run(context);
            LOG.info("Nightly risk job finished: run {} processed {} profile(s), wrote {} snapshot(s)",
                    result.getRunId(), result.getProcessedProfiles(), result.getSnapshotCount());
            return EXIT_SUCCESS;
        } catch (RuntimeException e) {
            LOG.error("Nightly risk job run {} failed: {}", context.getRunId(), e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
