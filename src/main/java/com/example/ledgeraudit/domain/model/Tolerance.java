package com.example.ledgeraudit.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Allowed deviation between asserted and matched values, either in claim units or as a percentage of
 * the asserted value.
 */
public record Tolerance(Kind kind, BigDecimal value) {

    public enum Kind {
        ABSOLUTE,
        PERCENT
    }

    public Tolerance {
        if (kind == null) {
            kind = Kind.ABSOLUTE;
        }
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("tolerance must be a non-negative number");
        }
    }

    public static Tolerance absolute(String value) {
        return new Tolerance(Kind.ABSOLUTE, new BigDecimal(value));
    }

    public static Tolerance percent(String value) {
        return new Tolerance(Kind.PERCENT, new BigDecimal(value));
    }

    /**
     * @return the tolerance expressed in claim units for the given asserted value
     */
    public BigDecimal allowanceFor(BigDecimal asserted) {
        return switch (kind) {
            case ABSOLUTE -> value;
            case PERCENT -> asserted.abs().multiply(value).divide(BigDecimal.valueOf(100), 6, RoundingMode.HALF_UP);
        };
    }
}
