package com.example.truingup.dto;

import com.example.truingup.engine.CostCategory;
import com.example.truingup.engine.CostInput;
import com.example.truingup.engine.SbuCode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Traceable output of one variance computation.
 *
 * <p>{@code checksum} covers every field except {@code timestamp} (and itself), so recomputing
 * the same input under the same rule version reproduces it exactly. All amounts carry scale 2.
 * {@code utilityRetainedGain} is the utility's own share of a controllable gain; it is neither
 * disallowed nor passed through, and {@code utilityRetainedGain + passedThroughVariance} equals
 * {@code |varianceAmount|} to the cent for such gains.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditResult(
        Instant timestamp,
        String checksum,
        SbuCode sbuCode,
        String scenario,
        String costHead,
        CostCategory varianceCategory,
        BigDecimal approvedAmount,
        BigDecimal actualAmount,
        BigDecimal varianceAmount,
        BigDecimal disallowedVariance,
        BigDecimal passedThroughVariance,
        BigDecimal utilityRetainedGain,
        String disallowanceReason,
        String logicApplied,
        RegulatoryReference regulatoryReference,
        AuditMetadata metadata,
        CostInput inputSnapshot
) {

    public AuditResult withChecksum(String checksum) {
        return new AuditResult(timestamp, checksum, sbuCode, scenario, costHead, varianceCategory,
                approvedAmount, actualAmount, varianceAmount, disallowedVariance, passedThroughVariance,
                utilityRetainedGain, disallowanceReason, logicApplied, regulatoryReference, metadata, inputSnapshot);
    }

    public boolean hasFlag(String flag) {
        return metadata != null && metadata.flags().contains(flag);
    }
}
