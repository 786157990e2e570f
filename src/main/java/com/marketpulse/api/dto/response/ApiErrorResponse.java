package com.marketpulse.api.dto.response;

import com.marketpulse.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope written by {@link com.marketpulse.exception.GlobalExceptionHandler}.
 * {@code error.retryable} tells a client whether the same request may succeed later.
 */
@Value
public class ApiErrorResponse {

    boolean success = false;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .retryable(errorCode.isRetryable())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Value
    @Builder
    public static class ErrorDetail {
        String code;
        int status;
        boolean retryable;
        String message;
        Map<String, Object> details;
        String path;
        Instant timestamp;
    }
}
