package com.aerarisk.job;

import com.aerarisk.core.model.AuditRecord;
import com.aerarisk.core.model.PipelineStage;
import com.aerarisk.core.model.RegionKey;
import com.aerarisk.core.model.RegionSnapshot;
import com.aerarisk.core.model.RiskScoreUpdate;
import com.aerarisk.core.model.StageStatus;
import com.aerarisk.core.model.VulnerabilityProfile;
import com.aerarisk.core.pipeline.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests of {@link SupabaseClient} and the store adapters against an embedded
 * HTTP server.
 */
class SupabaseClientTest {

    private final ObjectMapper json = new ObjectMapper();

    private StubRestServer server;
    private SupabaseClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubRestServer();
        client = new SupabaseClient(new JobConfig.Builder()
                .supabaseUrl(server.baseUrl() + "/")
                .serviceKey("service-key")
                .readTimeoutSeconds(5)
                .writeTimeoutSeconds(5)
                .build());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Should load profiles with auth headers and apply defaults to missing fields")
    void shouldLoadProfiles() {
        server.respondWith(r -> StubRestServer.Reply.ok("[{\"id\":\"p1\",\"county_id\":\"c1\",\"state_id\":\"s1\","
                + "\"household_size\":2,\"insulin_dependency\":true,\"transportation_access\":null,"
                + "\"updated_at\":\"2026-02-01T10:00:00+00:00\",\"extra_column\":1}]"));

        List<VulnerabilityProfile> profiles = new SupabasePopulationStore(client).loadAll();

        assertThat(profiles).hasSize(1);
        VulnerabilityProfile profile = profiles.get(0);
        assertThat(profile.getId()).isEqualTo("p1");
        assertThat(profile.effectiveHouseholdSize()).isEqualTo(2.0);
        assertThat(profile.hasInsulinDependency()).isTrue();
        assertThat(profile.hasTransportationAccess()).isTrue();
        assertThat(profile.getUpdatedAt()).isNotNull();

        StubRestServer.Recorded request = server.requests().get(0);
        assertThat(request.method).isEqualTo("GET");
        assertThat(request.table).isEqualTo("vulnerability_profiles");
        assertThat(request.query.get("select")).isEqualTo(SupabasePopulationStore.COLUMNS);
        assertThat(request.headers).containsEntry("apikey", "service-key")
                .containsEntry("authorization", "Bearer service-key");
    }

    @Test
    @DisplayName("Should upsert risk scores on id with merge-duplicates")
    void shouldUpsertRiskScores() throws IOException {
        new SupabasePopulationStore(client).updateRiskScores(List.of(new RiskScoreUpdate("p1", 3.0)));

        StubRestServer.Recorded request = server.requests().get(0);
        assertThat(request.method).isEqualTo("POST");
        assertThat(request.query).containsEntry("on_conflict", "id");
        assertThat(request.headers.get("prefer")).isEqualTo("resolution=merge-duplicates,return=representation");

        JsonNode body = json.readTree(request.body);
        assertThat(body.isArray()).isTrue();
        assertThat(body.get(0).get("id").asText()).isEqualTo("p1");
        assertThat(body.get(0).get("risk_score").asDouble()).isEqualTo(3.0);
        assertThat(body.get(0).size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should select prior snapshots by exact date")
    void shouldSelectPriorSnapshots() {
        server.respondWith(r -> StubRestServer.Reply.ok(
                "[{\"county_id\":\"c1\",\"state_id\":\"s1\",\"avg_risk_score\":2.5,\"snapshot_date\":\"2026-03-01\"}]"));

        List<RegionSnapshot> prior = new SupabaseSnapshotStore(client).findByDate(LocalDate.of(2026, 3, 1));

        assertThat(prior).hasSize(1);
        assertThat(prior.get(0).getAvgRiskScore()).isEqualTo(2.5);
        assertThat(prior.get(0).getSnapshotDate()).isEqualTo(LocalDate.of(2026, 3, 1));

        StubRestServer.Recorded request = server.requests().get(0);
        assertThat(request.table).isEqualTo("region_snapshots");
        assertThat(request.query).containsEntry("snapshot_date", "eq.2026-03-01")
                .containsEntry("select", "county_id,state_id,avg_risk_score,snapshot_date");
    }

    @Test
    @DisplayName("Should upsert snapshots on the natural key with snake_case ISO payload")
    void shouldUpsertSnapshots() throws IOException {
        RegionSnapshot snapshot = RegionSnapshot.builder()
                .snapshotDate(LocalDate.of(2026, 3, 31))
                .regionKey(RegionKey.of("c1", "s1", "org-a"))
                .profileCount(3)
                .avgRiskScore(2.6667)
                .modelVersion("level3-test")
                .pipelineRunId("run-1")
                .metadata("generated_by", "aera-nightly-risk-job")
                .build();

        new SupabaseSnapshotStore(client).upsert(List.of(snapshot));

        StubRestServer.Recorded request = server.requests().get(0);
        assertThat(request.query).containsEntry("on_conflict", "snapshot_date,county_id,state_id,organization_id");
        JsonNode row = json.readTree(request.body).get(0);
        assertThat(row.get("snapshot_date").asText()).isEqualTo("2026-03-31");
        assertThat(row.get("snapshot_window_days").asInt()).isEqualTo(30);
        assertThat(row.get("drift_status").asText()).isEqualTo("STABLE");
        assertThat(row.get("pipeline_run_id").asText()).isEqualTo("run-1");
        assertThat(row.get("metadata").get("generated_by").asText()).isEqualTo("aera-nightly-risk-job");
    }

    @Test
    @DisplayName("Should insert audit records with stage names and ISO timestamps")
    void shouldInsertAuditRecord() throws IOException {
        AuditRecord record = AuditRecord.builder()
                .runId("run-1")
                .modelName("aera-level3")
                .modelVersion("level3-test")
                .stage(PipelineStage.ISOLATION_FOREST)
                .status(StageStatus.SUCCESS)
                .startedAt(Instant.parse("2026-03-31T02:00:00Z"))
                .finishedAt(Instant.parse("2026-03-31T02:00:01.500Z"))
                .processedRecords(10)
                .metrics(Map.of("outliers", 1))
                .build();

        new SupabaseAuditSink(client).record(record);

        StubRestServer.Recorded request = server.requests().get(0);
        assertThat(request.table).isEqualTo("model_audit_log");
        assertThat(request.query).doesNotContainKey("on_conflict");
        JsonNode row = json.readTree(request.body).get(0);
        assertThat(row.get("stage").asText()).isEqualTo("isolation_forest");
        assertThat(row.get("status").asText()).isEqualTo("SUCCESS");
        assertThat(row.get("duration_ms").asLong()).isEqualTo(1500);
        assertThat(row.get("started_at").asText()).isEqualTo("2026-03-31T02:00:00Z");
        assertThat(row.get("initiated_by").asText()).isEqualTo("nightly_pipeline");
        assertThat(row.get("metrics").get("outliers").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip writes of empty row lists")
    void shouldSkipEmptyWrites() {
        client.upsert("region_snapshots", List.of(), "snapshot_date");
        client.insert("model_audit_log", List.of());

        assertThat(server.requests()).isEmpty();
    }

    @Test
    @DisplayName("Should raise UpstreamException carrying status and body on non-2xx")
    void shouldFailOnErrorStatus() {
        server.respondWith(r -> new StubRestServer.Reply(401, "{\"message\":\"Invalid API key\"}"));

        assertThatThrownBy(() -> new SupabasePopulationStore(client).loadAll())
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("401")
                .hasMessageContaining("Invalid API key");
    }

    @Test
    @DisplayName("Should raise UpstreamException on an unreadable body")
    void shouldFailOnMalformedBody() {
        server.respondWith(r -> StubRestServer.Reply.ok("<html>not json</html>"));

        assertThatThrownBy(() -> new SupabasePopulationStore(client).loadAll())
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("Unreadable");
    }

    @Test
    @DisplayName("Should raise UpstreamException when the store is unreachable")
    void shouldFailOnTransportError() {
        String url = server.baseUrl();
        server.close();
        SupabaseClient unreachable = new SupabaseClient(new JobConfig.Builder()
                .supabaseUrl(url)
                .serviceKey("k")
                .readTimeoutSeconds(2)
                .build());

        assertThatThrownBy(() -> unreachable.select("vulnerability_profiles", "id", Map.of(),
                VulnerabilityProfile.class))
                .isInstanceOf(UpstreamException.class);
    }
}
