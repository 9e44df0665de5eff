package com.example.truingup.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/** Results of the auxiliary normative formulas. Each carries the formula text it evaluated. */
public class FormulaDtos {

    private FormulaDtos() {}

    /** Escalated O&amp;M = base × (1 + cpiWeight×ΔCPI + wpiWeight×ΔWPI) */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record OmEscalation(
            BigDecimal baseOm,
            BigDecimal cpiChange,
            BigDecimal wpiChange,
            BigDecimal blendedEscalationPct,   // 4 places
            BigDecimal escalatedOm,
            String formula,
            String regulatoryClause,
            String engineVersion
    ) {}

    /** Interest = outstanding loan × (SBI EBLR + spread) */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record NormativeInterest(
            BigDecimal outstandingLoan,
            BigDecimal sbiEblr,
            BigDecimal spread,
            BigDecimal normativeRate,
            BigDecimal normativeInterest,
            String formula,
            String regulatoryClause,
            String engineVersion
    ) {}

    /** Actual line loss against the trajectory target, both in percent. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record LineLossEfficiency(
            String financialYear,
            BigDecimal targetLossPercent,
            BigDecimal actualLossPercent,
            BigDecimal deviationPercent,
            boolean violation,
            String logicApplied,
            String regulatoryClause,
            String engineVersion
    ) {}
}
