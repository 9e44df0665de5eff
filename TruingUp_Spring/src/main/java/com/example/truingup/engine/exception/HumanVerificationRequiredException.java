package com.example.truingup.engine.exception;

import com.example.truingup.util.MoneyUtils;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * An actual figure that no reviewer has confirmed reached a binding computation.
 * Hard stop: the caller re-submits once the figure has been verified.
 */
@Getter
public class HumanVerificationRequiredException extends TruingUpException {

    private final String costHead;
    private final BigDecimal actual;

    public HumanVerificationRequiredException(String costHead, BigDecimal actual) {
        super("ZERO-HALLUCINATION VIOLATION: Actual value for '" + costHead + "' ("
                + MoneyUtils.format(actual) + ") has not been human-verified. "
                + "Confirm the mapping before computation.");
        this.costHead = costHead;
        this.actual = actual;
    }
}
