package com.aerarisk.core.pipeline;

import com.aerarisk.core.model.AuditRecord;
import com.aerarisk.core.model.RegionSnapshot;
import com.aerarisk.core.model.RiskScoreUpdate;
import com.aerarisk.core.model.VulnerabilityProfile;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory store implementations for pipeline tests.
 */
final class InMemoryStores {

    private InMemoryStores() {
    }

    static final class Population implements PopulationStore {
        final Map<String, VulnerabilityProfile> profiles = new LinkedHashMap<>();
        final Map<String, Double> writtenScores = new LinkedHashMap<>();

        Population(List<VulnerabilityProfile> initial) {
            initial.forEach(p -> profiles.put(p.getId(), p));
        }

        @Override
        public List<VulnerabilityProfile> loadAll() {
            // fresh copies so a run never shares state with the store
            return profiles.values().stream().map(Population::copy).collect(Collectors.toList());
        }

        @Override
        public void updateRiskScores(List<RiskScoreUpdate> updates) {
            for (RiskScoreUpdate update : updates) {
                profiles.get(update.getId()).setRiskScore(update.getRiskScore());
                writtenScores.put(update.getId(), update.getRiskScore());
            }
        }

        private static VulnerabilityProfile copy(VulnerabilityProfile p) {
            VulnerabilityProfile c = new VulnerabilityProfile();
            c.setId(p.getId());
            c.setOrganizationId(p.getOrganizationId());
            c.setCountyId(p.getCountyId());
            c.setStateId(p.getStateId());
            c.setHouseholdSize(p.getHouseholdSize());
            c.setMedicationDependency(p.getMedicationDependency());
            c.setInsulinDependency(p.getInsulinDependency());
            c.setOxygenPoweredDevice(p.getOxygenPoweredDevice());
            c.setMobilityLimitation(p.getMobilityLimitation());
            c.setTransportationAccess(p.getTransportationAccess());
            c.setFinancialStrain(p.getFinancialStrain());
            c.setRiskScore(p.getRiskScore());
            c.setUpdatedAt(p.getUpdatedAt());
            return c;
        }
    }

    static final class Snapshots implements SnapshotStore {
        final Map<String, RegionSnapshot> rows = new LinkedHashMap<>();
        final List<LocalDate> queriedDates = new ArrayList<>();

        @Override
        public List<RegionSnapshot> findByDate(LocalDate snapshotDate) {
            queriedDates.add(snapshotDate);
            return rows.values().stream()
                    .filter(s -> snapshotDate.equals(s.getSnapshotDate()))
                    .collect(Collectors.toList());
        }

        @Override
        public void upsert(List<RegionSnapshot> snapshots) {
            snapshots.forEach(s -> rows.put(key(s), s));
        }

        List<RegionSnapshot> byDate(LocalDate date) {
            return rows.values().stream()
                    .filter(s -> date.equals(s.getSnapshotDate()))
                    .collect(Collectors.toList());
        }

        private static String key(RegionSnapshot s) {
            return s.getSnapshotDate() + "|" + s.getCountyId() + "|" + s.getStateId() + "|"
                    + s.getOrganizationId();
        }
    }

    static final class Audit implements AuditSink {
        final List<AuditRecord> records = new ArrayList<>();

        @Override
        public void record(AuditRecord record) {
            records.add(record);
        }
    }
}
