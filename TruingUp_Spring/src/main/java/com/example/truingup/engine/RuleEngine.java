package com.example.truingup.engine;

import com.example.truingup.dto.AuditMetadata;
import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.FormulaDtos.LineLossEfficiency;
import com.example.truingup.dto.FormulaDtos.NormativeInterest;
import com.example.truingup.dto.FormulaDtos.OmEscalation;
import com.example.truingup.dto.RegulatoryReference;
import com.example.truingup.engine.exception.HumanVerificationRequiredException;
import com.example.truingup.util.ChecksumUtils;
import com.example.truingup.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.example.truingup.util.MoneyUtils.format;
import static com.example.truingup.util.MoneyUtils.formatPercent;
import static com.example.truingup.util.MoneyUtils.roundMoney;

/*
 * ────────────────────────────────────────────────────────────────────────────
 * Deterministic rule engine: gain/loss sharing for one ARR cost head
 * ────────────────────────────────────────────────────────────────────────────
 * Policy (per category, variance = approved - actual, gain when variance >= 0)
 *  - Controllable gain : consumer share passed through, utility keeps the rest
 *  - Controllable loss : utility loss share disallowed (100% under the 2022-27 order)
 *  - Uncontrollable    : signed variance passed through (negative = extra consumer burden)
 *
 * Gate
 *  - actual present + not human-verified -> HumanVerificationRequiredException, nothing computed
 *  - actual absent -> "pending extraction" result, no subtraction, zero amounts, flagged
 *
 * Determinism
 *  - constants are an immutable instance handed in at construction, never looked up
 *  - every amount goes through MoneyUtils.roundMoney
 *  - the checksum excludes the timestamp, so the same input + version = the same digest
 *
 * Thread-safe: no mutable state.
 * ────────────────────────────────────────────────────────────────────────────
 */
@Slf4j
public class RuleEngine {

    private static final int PERCENT_SCALE = 4;

    private final RegulatoryConstants constants;
    private final Clock clock;

    public RuleEngine(RegulatoryConstants constants) {
        this(constants, Clock.systemUTC());
    }

    public RuleEngine(RegulatoryConstants constants, Clock clock) {
        this.constants = Objects.requireNonNull(constants, "constants");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getVersion() {
        return constants.getVersion();
    }

    public RegulatoryConstants getConstants() {
        return constants;
    }

    // ─── Core: gain/loss sharing ───

    public AuditResult computeVariance(CostInput input) {
        Objects.requireNonNull(input, "input");
        if (input.actual() != null && !input.humanVerified()) {
            throw new HumanVerificationRequiredException(input.head(), input.actual());
        }

        Disposition d = input.awaitingExtraction() ? pending(input) : dispose(input);

        List<String> flags = new ArrayList<>();
        if (input.anomalyScore() != null && input.anomalyScore() > AuditFlags.HIGH_ANOMALY_THRESHOLD) {
            flags.add(AuditFlags.HIGH_ANOMALY);
        }
        if (!input.humanVerified()) {
            flags.add(AuditFlags.UNVERIFIED_DATA);
        }
        if (input.awaitingExtraction()) {
            flags.add(AuditFlags.ACTUAL_PENDING_EXTRACTION);
        }

        RegulatoryReference ref = new RegulatoryReference(
                d.clause().citation(),
                constants.getFramework() + ": " + input.category().getLabel() + " " + input.head(),
                constants.getOrderDate(),
                constants.getVersion());

        AuditResult unsigned = new AuditResult(
                Instant.now(clock),
                null,
                input.sbuCode(),
                input.head() + " " + d.scenario(),
                input.head(),
                input.category(),
                roundMoney(input.approved()),
                input.actual() == null ? null : roundMoney(input.actual()),
                d.variance(),
                d.disallowed(),
                d.passedThrough(),
                d.utilityRetained(),
                d.reason(),
                d.logic(),
                ref,
                new AuditMetadata(constants.getVersion(), ChecksumUtils.CHECKSUM_SCHEME, flags),
                input);

        AuditResult result = unsigned.withChecksum(ChecksumUtils.computeChecksum(unsigned));
        log.debug("variance [{} / {} / {}] {} -> disallowed={} passedThrough={} checksum={}",
                input.sbuCode().getLabel(), input.head(), input.category().getLabel(), d.clause().getClauseId(),
                d.disallowed(), d.passedThrough(), result.checksum().substring(0, 12));
        return result;
    }

    private Disposition dispose(CostInput input) {
        BigDecimal variance = roundMoney(input.approved().subtract(input.actual()));
        boolean gain = variance.signum() >= 0;
        BigDecimal magnitude = variance.abs();

        if (input.category() == CostCategory.UNCONTROLLABLE) {
            BigDecimal passedThrough = MoneyUtils.share(variance, constants.getUncontrollablePassThrough());
            String logic = "Uncontrollable Variance: " + format(variance) + " passed through to Consumer ("
                    + formatPercent(constants.getUncontrollablePassThrough()) + " recovery).";
            return new Disposition(gain ? "Gain Sharing" : "Loss Sharing", variance, zero(), passedThrough, zero(),
                    null, logic, RegulatoryClause.PASS_THROUGH);
        }

        if (gain) {
            // consumer share rounded once, utility takes the remainder: the two always add back to |variance|
            BigDecimal consumer = MoneyUtils.share(magnitude, constants.getConsumerGainShare());
            BigDecimal utility = magnitude.subtract(consumer);
            String logic = "Controllable Gain: Savings of " + format(magnitude) + " shared "
                    + formatPercent(constants.getUtilityGainShare()) + " (" + format(utility) + ") to Utility, "
                    + formatPercent(constants.getConsumerGainShare()) + " (" + format(consumer) + ") to Consumer.";
            return new Disposition("Gain Sharing", variance, zero(), consumer, utility,
                    null, logic, RegulatoryClause.GAINS_SHARING);
        }

        BigDecimal disallowed = MoneyUtils.share(magnitude, constants.getUtilityLossShare());
        BigDecimal consumerBurden = magnitude.subtract(disallowed);
        BigDecimal passedThrough = consumerBurden.negate();
        String borne = formatPercent(constants.getUtilityLossShare()) + " borne by Utility";
        String reason = "Controllable Loss of " + format(magnitude) + " disallowed per "
                + RegulatoryClause.LOSS_DISALLOWANCE.getClauseId() + ": " + borne + ". "
                + (consumerBurden.signum() == 0
                        ? "No pass-through to consumers."
                        : format(consumerBurden) + " passed through to consumers.");
        String logic = "Controllable Loss: Excess of " + format(magnitude) + " disallowed (" + borne + ").";
        return new Disposition("Loss Sharing", variance, disallowed, passedThrough, zero(),
                disallowed.signum() > 0 ? reason : null, logic, RegulatoryClause.LOSS_DISALLOWANCE);
    }

    private Disposition pending(CostInput input) {
        String logic = "Actual value for '" + input.head() + "' not yet extracted: no variance computed, "
                + "approved " + format(input.approved()) + " held pending verified actuals.";
        return new Disposition("Pending Extraction", zero(), zero(), zero(), zero(),
                null, logic, RegulatoryClause.PENDING_ACTUALS);
    }

    // ─── T&D loss trajectory ───

    public BigDecimal getTdLossTarget(String financialYear) {
        return constants.getTdLossTarget(financialYear);
    }

    public LineLossEfficiency computeLineLossEfficiency(String financialYear, BigDecimal actualLossPercent) {
        Objects.requireNonNull(actualLossPercent, "actualLossPercent");
        BigDecimal target = roundMoney(getTdLossTarget(financialYear).movePointRight(2), PERCENT_SCALE);
        BigDecimal actual = roundMoney(actualLossPercent, PERCENT_SCALE);
        BigDecimal deviation = actual.subtract(target);
        boolean violation = deviation.signum() > 0;
        String logic = violation
                ? "Line loss " + actual.toPlainString() + "% exceeds the normative target " + target.toPlainString()
                        + "% by " + deviation.toPlainString() + " percentage points."
                : "Line loss " + actual.toPlainString() + "% is within the normative target "
                        + target.toPlainString() + "%.";
        return new LineLossEfficiency(financialYear, target, actual, deviation, violation, logic,
                RegulatoryClause.TD_LOSS_TRAJECTORY.citation(), constants.getVersion());
    }

    // ─── O&M escalation ───

    public OmEscalation computeOmEscalation(BigDecimal baseOm, BigDecimal cpiChange, BigDecimal wpiChange) {
        Objects.requireNonNull(baseOm, "baseOm");
        Objects.requireNonNull(cpiChange, "cpiChange");
        Objects.requireNonNull(wpiChange, "wpiChange");
        BigDecimal blended = constants.getCpiWeight().multiply(cpiChange)
                .add(constants.getWpiWeight().multiply(wpiChange));
        BigDecimal escalated = roundMoney(baseOm.multiply(BigDecimal.ONE.add(blended)));
        String formula = baseOm.toPlainString() + " × (1 + (" + constants.getCpiWeight().toPlainString() + "×"
                + cpiChange.toPlainString() + " + " + constants.getWpiWeight().toPlainString() + "×"
                + wpiChange.toPlainString() + "))";
        return new OmEscalation(baseOm, cpiChange, wpiChange,
                blended.movePointRight(2).setScale(PERCENT_SCALE, RoundingMode.HALF_UP),
                escalated, formula, RegulatoryClause.OM_ESCALATION.citation(), constants.getVersion());
    }

    // ─── Normative interest ───

    public NormativeInterest computeNormativeInterest(BigDecimal outstandingLoan) {
        Objects.requireNonNull(outstandingLoan, "outstandingLoan");
        BigDecimal rate = constants.getNormativeInterestRate();
        BigDecimal interest = roundMoney(outstandingLoan.multiply(rate));
        String formula = outstandingLoan.toPlainString() + " × (" + constants.getSbiEblr().toPlainString()
                + " + " + constants.getInterestSpread().toPlainString() + ")";
        return new NormativeInterest(outstandingLoan, constants.getSbiEblr(), constants.getInterestSpread(),
                rate, interest, formula, RegulatoryClause.NORMATIVE_INTEREST.citation(), constants.getVersion());
    }

    private static BigDecimal zero() {
        return roundMoney(BigDecimal.ZERO);
    }

    private record Disposition(
            String scenario,
            BigDecimal variance,
            BigDecimal disallowed,
            BigDecimal passedThrough,
            BigDecimal utilityRetained,
            String reason,
            String logic,
            RegulatoryClause clause
    ) {}
}
