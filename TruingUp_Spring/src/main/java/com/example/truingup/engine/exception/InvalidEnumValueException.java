package com.example.truingup.engine.exception;

import lombok.Getter;

import java.util.List;

/**
 * A free-text value did not match any label of a closed enumeration (category, SBU code).
 */
@Getter
public class InvalidEnumValueException extends CostInputValidationException {

    private final String field;
    private final String value;
    private final List<String> acceptedValues;

    public InvalidEnumValueException(String field, String value, List<String> acceptedValues) {
        super("Invalid " + field + " '" + value + "'. Accepted values: " + acceptedValues);
        this.field = field;
        this.value = value;
        this.acceptedValues = List.copyOf(acceptedValues);
    }
}
