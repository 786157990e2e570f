package com.marketpulse.api.dto.response;

import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Success envelope applied to analytics responses by {@link com.marketpulse.config.ApiResponseAdvice}. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
