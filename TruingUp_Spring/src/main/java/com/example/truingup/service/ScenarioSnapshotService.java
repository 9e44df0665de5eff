package com.example.truingup.service;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.dto.ScenarioDtos.DeltaLineItem;
import com.example.truingup.dto.ScenarioDtos.DeltaReport;
import com.example.truingup.dto.ScenarioDtos.ImpactDirection;
import com.example.truingup.dto.ScenarioDtos.ScenarioRef;
import com.example.truingup.dto.ScenarioDtos.Snapshot;
import com.example.truingup.engine.CostInput;
import com.example.truingup.engine.exception.ScenarioNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import static com.example.truingup.util.MoneyUtils.roundMoney;

/**
 * Officers' what-if runs ("Base Case" vs "Aggressive Disallowance") and the delta between two of
 * them. Snapshots are held in memory for the life of the process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioSnapshotService {

    private final TruingUpService truingUpService;
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    public Snapshot createSnapshot(String id, String label, String createdBy, List<CostInput> inputs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Snapshot id is required");
        }
        PetitionReport report = truingUpService.processPetition(null, inputs, null);
        Snapshot snapshot = new Snapshot(id, label, createdBy, Instant.now(), report);
        Snapshot previous = snapshots.put(id, snapshot);
        log.info("[scenario] {} '{}' by {} gap={}{}", id, label, createdBy, report.totalRevenueGap(),
                previous == null ? "" : " (replaced)");
        return snapshot;
    }

    public Snapshot get(String id) {
        Snapshot s = snapshots.get(id);
        if (s == null) {
            throw new ScenarioNotFoundException(id, new TreeSet<>(snapshots.keySet()));
        }
        return s;
    }

    /** Line items are paired by position; a side with fewer items contributes 0.00. */
    public DeltaReport compare(String scenarioAId, String scenarioBId) {
        Snapshot a = get(scenarioAId);
        Snapshot b = get(scenarioBId);
        List<AuditResult> aItems = a.report().lineItems();
        List<AuditResult> bItems = b.report().lineItems();

        List<DeltaLineItem> lines = new ArrayList<>();
        int n = Math.max(aItems.size(), bItems.size());
        for (int i = 0; i < n; i++) {
            AuditResult ar = i < aItems.size() ? aItems.get(i) : null;
            AuditResult br = i < bItems.size() ? bItems.get(i) : null;
            String head = ar != null ? ar.costHead() : (br != null ? br.costHead() : "Unknown");
            BigDecimal av = ar != null ? ar.varianceAmount() : roundMoney(BigDecimal.ZERO);
            BigDecimal bv = br != null ? br.varianceAmount() : roundMoney(BigDecimal.ZERO);
            lines.add(new DeltaLineItem(head, av, bv, roundMoney(bv.subtract(av))));
        }

        BigDecimal delta = roundMoney(b.totalRevenueGap().subtract(a.totalRevenueGap()));
        ImpactDirection direction = delta.signum() > 0 ? ImpactDirection.FAVORABLE
                : delta.signum() < 0 ? ImpactDirection.ADVERSE : ImpactDirection.NEUTRAL;

        return new DeltaReport(
                Instant.now(),
                new ScenarioRef(a.id(), a.label(), a.totalRevenueGap()),
                new ScenarioRef(b.id(), b.label(), b.totalRevenueGap()),
                delta,
                direction,
                lines);
    }
}
