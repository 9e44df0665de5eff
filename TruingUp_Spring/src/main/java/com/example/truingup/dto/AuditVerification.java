package com.example.truingup.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Outcome of recomputing a stored record's checksum from its stored JSON. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditVerification(
        String checksum,
        String recomputedChecksum,
        boolean intact,
        String engineVersion
) {}
