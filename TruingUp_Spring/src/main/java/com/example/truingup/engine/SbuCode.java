package com.example.truingup.engine;

import com.example.truingup.engine.exception.InvalidEnumValueException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Strategic business unit partition. Generation, transmission and distribution figures are
 * computed and reported per partition and never blended in one computation.
 */
public enum SbuCode {
    SBU_G("SBU-G"),
    SBU_T("SBU-T"),
    SBU_D("SBU-D");

    private final String label;

    SbuCode(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static SbuCode fromLabel(String value) {
        for (SbuCode s : values()) {
            if (s.label.equals(value)) return s;
        }
        throw new InvalidEnumValueException("sbu_code", value, labels());
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(SbuCode::getLabel).toList();
    }
}
