package com.example.truingup.engine.exception;

import java.util.Collection;

public class RuleSetNotFoundException extends TruingUpException {

    public RuleSetNotFoundException(String version, Collection<String> known) {
        super("Rule set '" + version + "' is not registered. Available: " + known);
    }
}
