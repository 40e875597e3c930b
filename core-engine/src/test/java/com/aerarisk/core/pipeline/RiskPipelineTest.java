package com.aerarisk.core.pipeline;

import com.aerarisk.core.config.ModelConfig;
import com.aerarisk.core.model.AuditRecord;
import com.aerarisk.core.model.DriftStatus;
import com.aerarisk.core.model.PipelineStage;
import com.aerarisk.core.model.RegionKey;
import com.aerarisk.core.model.RegionSnapshot;
import com.aerarisk.core.model.StageStatus;
import com.aerarisk.core.model.VulnerabilityProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.aerarisk.core.model.ProfileFixtures.profile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of {@link RiskPipeline} against in-memory stores.
 */
class RiskPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-31T02:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate RUN_DATE = LocalDate.of(2026, 3, 31);

    private final ModelConfig config = ModelConfig.defaults();

    private InMemoryStores.Population population;
    private InMemoryStores.Snapshots snapshots;
    private InMemoryStores.Audit audit;

    @BeforeEach
    void setUp() {
        population = new InMemoryStores.Population(population());
        snapshots = new InMemoryStores.Snapshots();
        audit = new InMemoryStores.Audit();
    }

    @Test
    @DisplayName("Empty population writes one SUCCESS pipeline record and nothing else")
    void shouldHandleEmptyPopulation() {
        InMemoryStores.Population empty = new InMemoryStores.Population(List.of());

        PipelineResult result = new RiskPipeline(config, empty, snapshots, audit).run(context());

        assertThat(result.getProcessedProfiles()).isZero();
        assertThat(result.getSnapshotCount()).isZero();
        assertThat(snapshots.rows).isEmpty();
        assertThat(audit.records).hasSize(1);
        AuditRecord record = audit.records.get(0);
        assertThat(record.getStage()).isEqualTo(PipelineStage.PIPELINE);
        assertThat(record.getStatus()).isEqualTo(StageStatus.SUCCESS);
        assertThat(record.getProcessedRecords()).isZero();
        assertThat(record.getMetrics()).containsEntry("message", "no records");
    }

    @Test
    @DisplayName("Full run scores, snapshots and audits every stage in order")
    void shouldRunAllStages() {
        RunContext context = context();

        PipelineResult result = new RiskPipeline(config, population, snapshots, audit).run(context);

        assertThat(result.getProcessedProfiles()).isEqualTo(6);
        assertThat(result.getSnapshotCount()).isEqualTo(2);
        assertThat(result.getRunId()).isEqualTo(context.getRunId());

        assertThat(population.writtenScores).containsEntry("p1", 3.0).hasSize(6);

        assertThat(audit.records).extracting(AuditRecord::getStage).containsExactly(
                PipelineStage.RISK_SCORE,
                PipelineStage.KMEANS,
                PipelineStage.DBSCAN,
                PipelineStage.ISOLATION_FOREST,
                PipelineStage.DRIFT,
                PipelineStage.PIPELINE);
        assertThat(audit.records).allSatisfy(record -> {
            assertThat(record.getStatus()).isEqualTo(StageStatus.SUCCESS);
            assertThat(record.getRunId()).isEqualTo(context.getRunId());
            assertThat(record.getModelName()).isEqualTo("aera-level3");
            assertThat(record.getModelVersion()).isEqualTo("level3-test");
            assertThat(record.getFeatureSet()).isEqualTo(RiskPipeline.AUDIT_FEATURE_SET);
            assertThat(record.getInitiatedBy()).isEqualTo("nightly_pipeline");
        });
        assertThat(audit.records.get(1).getMetrics()).containsEntry("clusters", 2);
        assertThat(audit.records.get(4).getMetrics()).containsEntry("snapshot_rows", 2);
        assertThat(audit.records.get(5).getMetrics()).containsEntry("run_id", context.getRunId());

        assertThat(snapshots.queriedDates).containsExactly(RUN_DATE.minusDays(30));
        assertThat(snapshots.byDate(RUN_DATE)).hasSize(2)
                .allSatisfy(s -> assertThat(s.getPipelineRunId()).isEqualTo(context.getRunId()));
    }

    @Test
    @DisplayName("Fifty identical profiles form one cluster, no noise and no outliers")
    void shouldHandleIdenticalPopulation() {
        List<VulnerabilityProfile> identical = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            identical.add(profile("id-" + i, "c1", "s1", "org-a"));
        }
        InMemoryStores.Population uniform = new InMemoryStores.Population(identical);

        PipelineResult result = new RiskPipeline(config, uniform, snapshots, audit).run(context());

        assertThat(result.getProcessedProfiles()).isEqualTo(50);
        assertThat(audit.records.get(1).getMetrics()).containsEntry("clusters", 6);
        assertThat(audit.records.get(2).getMetrics()).containsEntry("noise_points", 0);
        assertThat(audit.records.get(3).getMetrics()).containsEntry("outliers", 0);

        assertThat(snapshots.byDate(RUN_DATE)).hasSize(1);
        RegionSnapshot snapshot = snapshots.byDate(RUN_DATE).get(0);
        assertThat(snapshot.getProfileCount()).isEqualTo(50);
        assertThat(snapshot.getKmeansCluster()).isEqualTo(0);
        assertThat(snapshot.getDbscanCluster()).isEqualTo(0);
        assertThat(snapshot.getAnomalyCount()).isZero();
        assertThat(snapshot.getAvgRiskScore()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Drift is measured against the snapshot thirty days earlier")
    void shouldCompareAgainstPriorWindow() {
        RegionSnapshot prior = RegionSnapshot.builder()
                .snapshotDate(RUN_DATE.minusDays(30))
                .regionKey(RegionKey.of("c1", "s1", "org-a"))
                .avgRiskScore(2.0)
                .build();
        snapshots.upsert(List.of(prior));

        new RiskPipeline(config, population, snapshots, audit).run(context());

        RegionSnapshot current = snapshots.byDate(RUN_DATE).stream()
                .filter(s -> "c1".equals(s.getCountyId()))
                .findFirst()
                .orElseThrow();
        // region c1 scores 3.0, 3.0 and 2.0 → mean 2.6667
        assertThat(current.getAvgRiskScore()).isEqualTo(2.6667);
        assertThat(current.getDriftValue()).isEqualTo(0.3333);
        assertThat(current.getDriftStatus()).isEqualTo(DriftStatus.ACCELERATING);
    }

    @Test
    @DisplayName("Re-running on the same date overwrites snapshots instead of duplicating them")
    void shouldBeIdempotentPerDate() {
        new RiskPipeline(config, population, snapshots, audit).run(context());
        List<RegionSnapshot> first = new ArrayList<>(snapshots.byDate(RUN_DATE));

        new RiskPipeline(config, population, snapshots, audit).run(context());
        List<RegionSnapshot> second = snapshots.byDate(RUN_DATE);

        assertThat(second).hasSize(first.size());
        assertThat(second).usingRecursiveFieldByFieldElementComparatorIgnoringFields("pipelineRunId")
                .containsExactlyElementsOf(first);
    }

    @Test
    @DisplayName("A failing store aborts the run with one FAILED pipeline record")
    void shouldAuditFailure() {
        PopulationStore failing = mock(PopulationStore.class);
        when(failing.loadAll()).thenReturn(population());
        doThrow(new UpstreamException("write rejected: 401")).when(failing).updateRiskScores(anyList());
        SnapshotStore snapshotStore = mock(SnapshotStore.class);

        RiskPipeline pipeline = new RiskPipeline(config, failing, snapshotStore, audit);

        assertThatThrownBy(() -> pipeline.run(context()))
                .isInstanceOf(UpstreamException.class)
                .hasMessage("write rejected: 401");
        assertThat(audit.records).hasSize(1);
        AuditRecord record = audit.records.get(0);
        assertThat(record.getStage()).isEqualTo(PipelineStage.PIPELINE);
        assertThat(record.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(record.getErrorMessage()).isEqualTo("write rejected: 401");
        verify(snapshotStore, never()).upsert(anyList());
    }

    @Test
    @DisplayName("A failing audit sink does not mask the original error")
    void shouldKeepOriginalErrorWhenAuditFails() {
        AuditSink brokenSink = mock(AuditSink.class);
        doThrow(new UpstreamException("audit down")).when(brokenSink)
                .record(argThat(record -> record.getStatus() == StageStatus.FAILED));
        SnapshotStore failingSnapshots = mock(SnapshotStore.class);
        when(failingSnapshots.findByDate(any())).thenThrow(new UpstreamException("select timed out"));

        RiskPipeline pipeline = new RiskPipeline(config, population, failingSnapshots, brokenSink);

        assertThatThrownBy(() -> pipeline.run(context()))
                .isInstanceOf(UpstreamException.class)
                .hasMessage("select timed out")
                .satisfies(e -> assertThat(e.getSuppressed())
                        .extracting(Throwable::getMessage)
                        .containsExactly("audit down"));
    }

    @Test
    @DisplayName("An exception without message is described by its type")
    void shouldDescribeAnonymousErrors() {
        assertThat(RiskPipeline.describe(new IllegalStateException())).isEqualTo("IllegalStateException");
        assertThat(RiskPipeline.describe(new IllegalStateException("boom"))).isEqualTo("boom");
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private static RunContext context() {
        return RunContext.start("aera-level3", "level3-test", CLOCK);
    }

    private static List<VulnerabilityProfile> population() {
        List<VulnerabilityProfile> profiles = new ArrayList<>();
        profiles.add(withFactors(profile("p1", "c1", "s1", "org-a"), 2.0, true));
        profiles.add(withFactors(profile("p2", "c1", "s1", "org-a"), 2.0, true));
        profiles.add(withFactors(profile("p3", "c1", "s1", "org-a"), 5.0, false));
        profiles.add(withFactors(profile("p4", "c2", "s1", "org-a"), 1.0, false));
        profiles.add(withFactors(profile("p5", "c2", "s1", "org-a"), 1.0, false));
        profiles.add(withFactors(profile("p6", "c2", "s1", "org-a"), 3.0, true));
        return profiles;
    }

    private static VulnerabilityProfile withFactors(VulnerabilityProfile profile, double household,
            boolean insulin) {
        profile.setHouseholdSize(household);
        profile.setInsulinDependency(insulin);
        return profile;
    }
}
