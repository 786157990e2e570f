package com.marketpulse.exception;

import java.util.Map;

/**
 * Rejected input: negative strike/spot/volatility, an expiration before the as-of date,
 * or strategy legs that do not belong together. Always raised before any computation.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String field, Object value, String reason) {
        super(
                ErrorCode.VALIDATION_ERROR,
                String.format("Invalid %s [%s]: %s", field, value, reason),
                Map.of("field", field, "value", String.valueOf(value)));
    }
}
