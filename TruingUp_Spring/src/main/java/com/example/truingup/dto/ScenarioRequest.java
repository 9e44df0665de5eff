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
public class ScenarioRequest {
    private String id;
    private String label;
    private String createdBy;
    private List<CostInputRequest> items = new ArrayList<>();

    public List<CostInput> toCostInputs() {
        return CostInputRequest.toCostInputs(items);
    }
}
