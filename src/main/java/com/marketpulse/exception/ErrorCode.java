package com.marketpulse.exception;

import lombok.Getter;

/**
 * Error taxonomy exposed to API clients. {@code retryable} marks failures of upstream
 * market data, which may clear on their own; every other code needs different input.
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR(400, false),
    BAD_REQUEST(400, false),
    NOT_FOUND(404, false),
    CONFIGURATION_ERROR(422, false),
    DATA_QUALITY_ERROR(422, false),
    INTERNAL_ERROR(500, false),
    DATA_UNAVAILABLE(503, true);

    private final int httpStatus;
    private final boolean retryable;

    ErrorCode(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public String getCode() {
        return name();
    }

    public boolean isClientError() {
        return httpStatus < 500;
    }
}
