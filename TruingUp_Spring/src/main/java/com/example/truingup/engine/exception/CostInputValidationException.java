package com.example.truingup.engine.exception;

/**
 * Thrown when a cost input record is malformed. Raised at construction, never defaulted.
 */
public class CostInputValidationException extends TruingUpException {

    public CostInputValidationException(String message) {
        super(message);
    }
}
