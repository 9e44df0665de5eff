package com.example.truingup.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Citation linking a computation to the clause, order and rule version it applied. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegulatoryReference(
        String clause,
        String description,
        String orderDate,
        String regulationVersion
) {}
