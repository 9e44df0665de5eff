package com.example.truingup.engine;

import com.example.truingup.engine.exception.InvalidEnumValueException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/** Whether management decisions influence a cost head. Governs the sharing policy. */
public enum CostCategory {
    CONTROLLABLE("Controllable"),
    UNCONTROLLABLE("Uncontrollable");

    private final String label;

    CostCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Exact, case-sensitive match on the label. */
    public static CostCategory fromLabel(String value) {
        for (CostCategory c : values()) {
            if (c.label.equals(value)) return c;
        }
        throw new InvalidEnumValueException("category", value, labels());
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(CostCategory::getLabel).toList();
    }
}
