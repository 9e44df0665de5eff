package com.example.truingup.engine.exception;

import java.util.Collection;

public class ScenarioNotFoundException extends TruingUpException {

    public ScenarioNotFoundException(String id, Collection<String> known) {
        super("Snapshot '" + id + "' not found. Available: " + String.join(", ", known));
    }
}
