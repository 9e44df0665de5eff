package com.example.truingup.dto;

import com.example.truingup.engine.CostInput;
import com.example.truingup.engine.exception.CostInputValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Wire shape of one cost head. Category and SBU stay free text until {@link #toCostInput()}. */
@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CostInputRequest {
    private String head;
    private String category;        // "Controllable" | "Uncontrollable"
    private String sbuCode;         // "SBU-G" | "SBU-T" | "SBU-D"
    private BigDecimal approved;
    private BigDecimal actual;      // null = not yet extracted
    private Double anomalyScore;
    private Integer evidencePage;

    @JsonProperty("is_human_verified")
    private boolean humanVerified;

    public CostInput toCostInput() {
        return CostInput.builder()
                .head(head)
                .category(category)
                .sbuCode(sbuCode)
                .approved(approved)
                .actual(actual)
                .anomalyScore(anomalyScore)
                .evidencePage(evidencePage)
                .humanVerified(humanVerified)
                .build();
    }

    /** Converts a request's item list in order; a missing list or a null entry is a validation failure. */
    public static List<CostInput> toCostInputs(List<CostInputRequest> items) {
        if (items == null) {
            throw new CostInputValidationException("items is required");
        }
        List<CostInput> inputs = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            CostInputRequest item = items.get(i);
            if (item == null) {
                throw new CostInputValidationException("items[" + i + "] is null");
            }
            inputs.add(item.toCostInput());
        }
        return inputs;
    }
}
