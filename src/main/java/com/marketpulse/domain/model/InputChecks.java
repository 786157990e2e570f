package com.marketpulse.domain.model;

import com.marketpulse.exception.ValidationException;

/**
 * Guard clauses shared by the domain constructors. Each check throws
 * {@link ValidationException} naming the offending field; nothing is clamped.
 */
public final class InputChecks {

    private InputChecks() {}

    public static double requireFinite(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException(field, value, "must be a finite number");
        }
        return value;
    }

    public static double requireNonNegative(String field, double value) {
        requireFinite(field, value);
        if (value < 0) {
            throw new ValidationException(field, value, "must not be negative");
        }
        return value;
    }

    public static double requirePositive(String field, double value) {
        requireFinite(field, value);
        if (value <= 0) {
            throw new ValidationException(field, value, "must be positive");
        }
        return value;
    }

    public static <T> T requirePresent(String field, T value) {
        if (value == null) {
            throw new ValidationException(field, null, "is required");
        }
        return value;
    }
}
