package com.example.truingup.engine.exception;

/**
 * Base exception for the truing-up engine
 */
public class TruingUpException extends RuntimeException {

    public TruingUpException(String message) {
        super(message);
    }

    public TruingUpException(String message, Throwable cause) {
        super(message, cause);
    }
}
