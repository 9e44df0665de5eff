package com.example.truingup.dto;

import com.example.truingup.engine.CostInput;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PetitionRequest {
    private String financialYear;   // e.g. "2024-25"
    private String ruleVersion;     // null = active rule set
    private boolean persist;
    private List<CostInputRequest> items = new ArrayList<>();

    public List<CostInput> toCostInputs() {
        return CostInputRequest.toCostInputs(items);
    }
}
