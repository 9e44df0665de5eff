package com.example.truingup.engine;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.dto.PetitionReport.SbuSummary;
import com.example.truingup.util.ChecksumUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.example.truingup.util.MoneyUtils.roundMoney;

/**
 * Runs the rule engine over every cost head of a petition, in the order given.
 *
 * <p>Fail-fast: the first rejected record propagates and no report exists for the batch.
 * Per-record results stay local until the whole petition has computed.
 */
@Slf4j
public class PetitionProcessor {

    private final RuleEngine engine;
    private final Clock clock;

    public PetitionProcessor(RuleEngine engine) {
        this(engine, Clock.systemUTC());
    }

    public PetitionProcessor(RuleEngine engine, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PetitionReport processPetition(List<CostInput> inputs) {
        return processPetition(null, inputs);
    }

    public PetitionReport processPetition(String financialYear, List<CostInput> inputs) {
        Objects.requireNonNull(inputs, "inputs");

        List<AuditResult> results = new ArrayList<>(inputs.size());
        for (CostInput input : inputs) {
            results.add(engine.computeVariance(input));
        }

        BigDecimal gap = BigDecimal.ZERO;
        BigDecimal disallowed = BigDecimal.ZERO;
        BigDecimal passedThrough = BigDecimal.ZERO;
        int pending = 0;
        Map<SbuCode, SbuTotals> bySbu = new LinkedHashMap<>();
        for (AuditResult r : results) {
            gap = gap.add(r.varianceAmount());
            disallowed = disallowed.add(r.disallowedVariance());
            passedThrough = passedThrough.add(r.passedThroughVariance());
            if (r.hasFlag(AuditFlags.ACTUAL_PENDING_EXTRACTION)) pending++;
            bySbu.computeIfAbsent(r.sbuCode(), k -> new SbuTotals()).add(r);
        }

        List<SbuSummary> summaries = new ArrayList<>();
        bySbu.forEach((sbu, t) -> summaries.add(t.toSummary(sbu)));

        PetitionReport unsigned = new PetitionReport(
                engine.getVersion(),
                financialYear,
                Instant.now(clock),
                results.size(),
                pending,
                roundMoney(gap),
                roundMoney(disallowed),
                roundMoney(passedThrough),
                summaries,
                results,
                null);
        PetitionReport report = unsigned.withBatchChecksum(ChecksumUtils.computeChecksum(unsigned));

        log.info("petition processed: version={} fy={} items={} pending={} gap={} disallowed={} batch={}",
                report.engineVersion(), financialYear, report.totalItemsProcessed(), pending,
                report.totalRevenueGap(), report.totalDisallowed(), report.batchChecksum().substring(0, 12));
        return report;
    }

    private static final class SbuTotals {
        private int count;
        private BigDecimal approved = BigDecimal.ZERO;
        private BigDecimal actual = BigDecimal.ZERO;
        private BigDecimal variance = BigDecimal.ZERO;
        private BigDecimal disallowed = BigDecimal.ZERO;
        private BigDecimal passedThrough = BigDecimal.ZERO;

        void add(AuditResult r) {
            count++;
            approved = approved.add(r.approvedAmount());
            if (r.actualAmount() != null) actual = actual.add(r.actualAmount());
            variance = variance.add(r.varianceAmount());
            disallowed = disallowed.add(r.disallowedVariance());
            passedThrough = passedThrough.add(r.passedThroughVariance());
        }

        SbuSummary toSummary(SbuCode sbu) {
            return new SbuSummary(sbu, count, roundMoney(approved), roundMoney(actual), roundMoney(variance),
                    roundMoney(disallowed), roundMoney(passedThrough));
        }
    }
}
