package com.marketpulse.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.marketpulse.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions onto the {@link ApiErrorResponse} envelope.
 *
 * <p>{@link BaseException} subclasses carry their own status: validation 400, configuration
 * and data quality 422, unavailable market data 503 with a {@code Retry-After} hint. Bean
 * Validation failures on request DTOs become 400 with one detail per field, sorted by
 * path. An unknown enum constant in the body (an option type, strategy or screen type)
 * is reported with the accepted values.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "30";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new TreeMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Request validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        if (ex.getCause() instanceof InvalidFormatException) {
            InvalidFormatException format = (InvalidFormatException) ex.getCause();
            Class<?> target = format.getTargetType();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", fieldPath(format));
            details.put("value", String.valueOf(format.getValue()));
            if (target != null && target.isEnum()) {
                details.put("accepted", Arrays.stream(target.getEnumConstants())
                        .map(String::valueOf)
                        .collect(Collectors.toList()));
            }
            return buildResponse(ErrorCode.BAD_REQUEST, "Unreadable value for " + details.get("field"), details, request);
        }
        log.debug("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return buildResponse(ErrorCode.NOT_FOUND, ex.getMessage(), null, request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleAnalytics(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.isClientError()) {
            log.warn("{} on {}: {}", errorCode, request.getRequestURI(), ex.getMessage());
        } else {
            log.error("{} on {}: {}", errorCode, request.getRequestURI(), ex.getMessage(), ex);
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private static String fieldPath(JsonMappingException ex) {
        String path = ex.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."))
                .replace(".[", "[");
        return path.isEmpty() ? "body" : path;
    }

    private ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ResponseEntity.BodyBuilder response = ResponseEntity.status(errorCode.getHttpStatus());
        if (errorCode.isRetryable()) {
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return response.body(ApiErrorResponse.of(errorCode, message, details, request.getRequestURI()));
    }
}
