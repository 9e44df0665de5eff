package com.example.truingup.engine;

import com.example.truingup.engine.exception.CostInputValidationException;
import com.example.truingup.util.MoneyUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.experimental.Tolerate;

import java.math.BigDecimal;

/**
 * One cost head, for one financial year, in one SBU partition.
 *
 * <p>Immutable once built. {@code actual == null} means the figure has not been extracted yet.
 * Category and SBU arrive as free text from upstream and are parsed here; an unknown label
 * fails construction with {@link com.example.truingup.engine.exception.InvalidEnumValueException}.
 * Amounts are held at money scale, so {@code 150} and {@code 150.00} build equal records.
 *
 * @param head           cost-head label, e.g. "O&amp;M", "Power_Purchase"
 * @param anomalyScore   external detector score in [0, 1], optional
 * @param evidencePage   source document page the actual was read from, optional
 * @param humanVerified  set by the review workflow once an officer confirmed {@code actual}
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CostInput(
        String head,
        CostCategory category,
        SbuCode sbuCode,
        BigDecimal approved,
        BigDecimal actual,
        Double anomalyScore,
        Integer evidencePage,
        @JsonProperty("is_human_verified") boolean humanVerified
) {

    /** Longest cost-head label the audit trail stores. */
    public static final int MAX_HEAD_LENGTH = 100;

    public CostInput {
        if (head == null || head.isBlank()) {
            throw new CostInputValidationException("Cost head label is required");
        }
        if (head.length() > MAX_HEAD_LENGTH) {
            throw new CostInputValidationException("Cost head label exceeds " + MAX_HEAD_LENGTH
                    + " characters (" + head.length() + "): '" + head.substring(0, 20) + "...'");
        }
        if (category == null) {
            throw new CostInputValidationException("category is required for '" + head + "'");
        }
        if (sbuCode == null) {
            throw new CostInputValidationException("sbu_code is required for '" + head + "'");
        }
        if (approved == null) {
            throw new CostInputValidationException("approved amount is required for '" + head + "'");
        }
        if (anomalyScore != null && !(anomalyScore >= 0.0 && anomalyScore <= 1.0)) {
            throw new CostInputValidationException(
                    "anomaly_score for '" + head + "' must be within [0, 1], got " + anomalyScore);
        }
        if (evidencePage != null && evidencePage < 1) {
            throw new CostInputValidationException(
                    "evidence_page for '" + head + "' must be a 1-based page number, got " + evidencePage);
        }
        approved = MoneyUtils.roundMoney(approved);
        actual = actual == null ? null : MoneyUtils.roundMoney(actual);
    }

    /** No actual figure yet: the record can only produce a pending-extraction result. */
    public boolean awaitingExtraction() {
        return actual == null;
    }

    public static class CostInputBuilder {

        @Tolerate
        public CostInputBuilder category(String label) {
            return category(CostCategory.fromLabel(label));
        }

        @Tolerate
        public CostInputBuilder sbuCode(String label) {
            return sbuCode(SbuCode.fromLabel(label));
        }
    }
}
