package com.example.truingup.engine;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Known-good constant sets, one factory per tariff order. Values are transcribed from the order;
 * a correction is a new version, never an edit of an existing one.
 */
public final class RuleSets {

    public static final String KSERC_MYT_2022_27_V1 = "KSERC-MYT-2022-27-v1.0";

    private RuleSets() {}

    public static List<RegulatoryConstants> all() {
        return List.of(ksercMyt2022To27());
    }

    /** KSERC MYT 2022-27 control period, order dated 30.06.2025. */
    public static RegulatoryConstants ksercMyt2022To27() {
        Map<String, BigDecimal> trajectory = new LinkedHashMap<>();
        trajectory.put("FY_2022-23", new BigDecimal("0.155")); // baseline
        trajectory.put("FY_2023-24", new BigDecimal("0.150"));
        trajectory.put("FY_2024-25", new BigDecimal("0.145"));
        trajectory.put("FY_2025-26", new BigDecimal("0.140")); // target year
        trajectory.put("FY_2026-27", new BigDecimal("0.135"));

        return RegulatoryConstants.builder()
                .version(KSERC_MYT_2022_27_V1)
                .orderDate("30.06.2025")
                .framework("KSERC MYT Framework")
                .cpiWeight(new BigDecimal("0.70"))
                .wpiWeight(new BigDecimal("0.30"))
                .utilityGainShare(ratio(2, 3))
                .consumerGainShare(ratio(1, 3))
                .utilityLossShare(new BigDecimal("1.0"))
                .consumerLossShare(new BigDecimal("0.0"))
                .uncontrollablePassThrough(new BigDecimal("1.0"))
                .sbiEblr(new BigDecimal("0.0850"))
                .interestSpread(new BigDecimal("0.02"))
                .roeRate(new BigDecimal("0.155"))
                .tdLossTrajectory(trajectory)
                .defaultTdLossTarget(new BigDecimal("0.140"))
                .atcLossTarget(new BigDecimal("0.18"))
                .depreciationMethod("Straight-Line")
                .assetLifeYears(25)
                .growthProjection(new BigDecimal("0.05"))
                .build();
    }

    /** p/q at 34 significant digits. 2/3 + 1/3 is exactly 1 at this precision. */
    static BigDecimal ratio(int p, int q) {
        return BigDecimal.valueOf(p).divide(BigDecimal.valueOf(q), MathContext.DECIMAL128);
    }
}
