package com.example.truingup.dto;

import com.example.truingup.engine.RegulatoryConstants;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleSetListing(String activeVersion, List<RegulatoryConstants> ruleSets) {}
