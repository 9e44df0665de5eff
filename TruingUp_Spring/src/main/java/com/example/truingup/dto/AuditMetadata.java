package com.example.truingup.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditMetadata(
        String engineVersion,
        String checksumScheme,
        List<String> flags
) {
    public AuditMetadata {
        flags = List.copyOf(flags);
    }
}
