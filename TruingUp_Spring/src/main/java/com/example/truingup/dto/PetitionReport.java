package com.example.truingup.dto;

import com.example.truingup.engine.SbuCode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Consolidated result of one petition. Exists only if every line item computed; there is no
 * partial report. {@code batchChecksum} covers the whole report minus timestamps.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PetitionReport(
        String engineVersion,
        String financialYear,
        Instant timestamp,
        int totalItemsProcessed,
        int pendingExtractionItems,
        BigDecimal totalRevenueGap,
        BigDecimal totalDisallowed,
        BigDecimal totalPassedThrough,
        List<SbuSummary> sbuSummaries,
        List<AuditResult> lineItems,
        String batchChecksum
) {

    public PetitionReport {
        sbuSummaries = List.copyOf(sbuSummaries);
        lineItems = List.copyOf(lineItems);
    }

    public PetitionReport withBatchChecksum(String batchChecksum) {
        return new PetitionReport(engineVersion, financialYear, timestamp, totalItemsProcessed,
                pendingExtractionItems, totalRevenueGap, totalDisallowed, totalPassedThrough,
                sbuSummaries, lineItems, batchChecksum);
    }

    /** Per-partition subtotals, listed in order of first appearance. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SbuSummary(
            SbuCode sbuCode,
            int itemCount,
            BigDecimal totalApproved,
            BigDecimal totalActual,
            BigDecimal netVariance,
            BigDecimal disallowedAmount,
            BigDecimal passedThroughAmount
    ) {}
}
