package com.example.truingup.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** Named what-if runs of a petition and the delta between two of them. */
public class ScenarioDtos {

    private ScenarioDtos() {}

    public enum ImpactDirection { FAVORABLE, ADVERSE, NEUTRAL }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Snapshot(
            String id,
            String label,
            String createdBy,
            Instant createdAt,
            PetitionReport report
    ) {
        public BigDecimal totalRevenueGap() {
            return report.totalRevenueGap();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ScenarioRef(String id, String label, BigDecimal revenueGap) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DeltaLineItem(
            String costHead,
            BigDecimal scenarioAVariance,
            BigDecimal scenarioBVariance,
            BigDecimal delta
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DeltaReport(
            Instant timestamp,
            ScenarioRef scenarioA,
            ScenarioRef scenarioB,
            BigDecimal delta,
            ImpactDirection impactDirection,
            List<DeltaLineItem> lineItems
    ) {}
}
