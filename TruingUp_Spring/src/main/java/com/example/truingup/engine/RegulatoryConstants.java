package com.example.truingup.engine;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One frozen version of the normative parameters of a tariff order.
 *
 * <p>There are no setters and no way to change a built instance. A new order means a new version,
 * registered next to the old ones in {@link RuleSetRegistry} so historical results can be
 * re-derived exactly.
 *
 * <p>The normative interest rate is not a field: it is always {@code sbiEblr + interestSpread}.
 */
@Getter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class RegulatoryConstants {

    private static final BigDecimal ONE_TOLERANCE = new BigDecimal("1E-9");
    static final String FY_PREFIX = "FY_";

    private final String version;
    private final String orderDate;
    private final String framework;

    // O&M escalation
    private final BigDecimal cpiWeight;
    private final BigDecimal wpiWeight;

    // gain / loss sharing on controllable heads
    private final BigDecimal utilityGainShare;
    private final BigDecimal consumerGainShare;
    private final BigDecimal utilityLossShare;
    private final BigDecimal consumerLossShare;

    private final BigDecimal uncontrollablePassThrough;

    // finance
    private final BigDecimal sbiEblr;
    private final BigDecimal interestSpread;
    private final BigDecimal roeRate;

    // technical losses, keyed "FY_2024-25"
    private final Map<String, BigDecimal> tdLossTrajectory;
    private final BigDecimal defaultTdLossTarget;
    private final BigDecimal atcLossTarget;

    private final String depreciationMethod;
    private final int assetLifeYears;
    private final BigDecimal growthProjection;

    @Builder
    private RegulatoryConstants(String version,
                                String orderDate,
                                String framework,
                                BigDecimal cpiWeight,
                                BigDecimal wpiWeight,
                                BigDecimal utilityGainShare,
                                BigDecimal consumerGainShare,
                                BigDecimal utilityLossShare,
                                BigDecimal consumerLossShare,
                                BigDecimal uncontrollablePassThrough,
                                BigDecimal sbiEblr,
                                BigDecimal interestSpread,
                                BigDecimal roeRate,
                                Map<String, BigDecimal> tdLossTrajectory,
                                BigDecimal defaultTdLossTarget,
                                BigDecimal atcLossTarget,
                                String depreciationMethod,
                                int assetLifeYears,
                                BigDecimal growthProjection) {
        this.version = requireText(version, "version");
        this.orderDate = requireText(orderDate, "orderDate");
        this.framework = requireText(framework, "framework");
        this.cpiWeight = Objects.requireNonNull(cpiWeight, "cpiWeight");
        this.wpiWeight = Objects.requireNonNull(wpiWeight, "wpiWeight");
        this.utilityGainShare = Objects.requireNonNull(utilityGainShare, "utilityGainShare");
        this.consumerGainShare = Objects.requireNonNull(consumerGainShare, "consumerGainShare");
        this.utilityLossShare = Objects.requireNonNull(utilityLossShare, "utilityLossShare");
        this.consumerLossShare = Objects.requireNonNull(consumerLossShare, "consumerLossShare");
        this.uncontrollablePassThrough = Objects.requireNonNull(uncontrollablePassThrough, "uncontrollablePassThrough");
        this.sbiEblr = Objects.requireNonNull(sbiEblr, "sbiEblr");
        this.interestSpread = Objects.requireNonNull(interestSpread, "interestSpread");
        this.roeRate = Objects.requireNonNull(roeRate, "roeRate");
        this.defaultTdLossTarget = Objects.requireNonNull(defaultTdLossTarget, "defaultTdLossTarget");
        this.atcLossTarget = Objects.requireNonNull(atcLossTarget, "atcLossTarget");
        this.depreciationMethod = requireText(depreciationMethod, "depreciationMethod");
        this.assetLifeYears = assetLifeYears;
        this.growthProjection = Objects.requireNonNull(growthProjection, "growthProjection");

        Map<String, BigDecimal> trajectory = new LinkedHashMap<>();
        if (tdLossTrajectory != null) {
            tdLossTrajectory.forEach((year, target) ->
                    trajectory.put(normalizeFinancialYear(year), Objects.requireNonNull(target, year)));
        }
        this.tdLossTrajectory = Collections.unmodifiableMap(trajectory);

        requireSumsToOne("CPI/WPI weights", cpiWeight, wpiWeight);
        requireSumsToOne("gain shares", utilityGainShare, consumerGainShare);
        requireSumsToOne("loss shares", utilityLossShare, consumerLossShare);
        if (assetLifeYears <= 0) {
            throw new IllegalArgumentException("assetLifeYears must be positive, got " + assetLifeYears);
        }
    }

    /** SBI EBLR + spread, derived on every read. */
    public BigDecimal getNormativeInterestRate() {
        return sbiEblr.add(interestSpread);
    }

    /**
     * Normative T&amp;D loss target for a financial year, "2024-25" or "FY_2024-25".
     * Years outside the trajectory fall back to {@link #getDefaultTdLossTarget()}.
     */
    public BigDecimal getTdLossTarget(String financialYear) {
        if (financialYear == null || financialYear.isBlank()) {
            return defaultTdLossTarget;
        }
        return tdLossTrajectory.getOrDefault(normalizeFinancialYear(financialYear), defaultTdLossTarget);
    }

    static String normalizeFinancialYear(String financialYear) {
        String fy = financialYear.trim();
        return fy.startsWith(FY_PREFIX) ? fy : FY_PREFIX + fy;
    }

    private static void requireSumsToOne(String what, BigDecimal a, BigDecimal b) {
        BigDecimal drift = a.add(b).subtract(BigDecimal.ONE).abs();
        if (drift.compareTo(ONE_TOLERANCE) > 0) {
            throw new IllegalArgumentException(what + " must sum to 1.0, got " + a + " + " + b);
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}
