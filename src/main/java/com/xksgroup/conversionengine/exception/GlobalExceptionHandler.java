package com.xksgroup.conversionengine.exception;

import com.xksgroup.conversionengine.config.security.response.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.OffsetDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConversionEngineException.class)
    public ResponseEntity<ApiError> handleEngineException(ConversionEngineException ex, HttpServletRequest request) {
        ErrorCode code = ex.getErrorCode();
        if (code == ErrorCode.INTERNAL) {
            log.error("Engine error on {}", request.getRequestURI(), ex);
            return buildErrorResponse(code, "An unexpected error occurred", null, request);
        }
        log.warn("{} on {}: {}", code, request.getRequestURI(), ex.getMessage());
        return buildErrorResponse(code, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationErrors(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .orElse("Validation failed");
        log.warn("Validation error on {}: {}", request.getRequestURI(), msg);
        return buildErrorResponse(ErrorCode.VALIDATION_ERROR, msg, null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleHttpMessageNotReadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Bad request - unreadable/missing body: {}", ex.getMessage());
        return buildErrorResponse(ErrorCode.VALIDATION_ERROR, "Invalid or missing request body", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("Invalid parameter {}: {}", ex.getName(), ex.getValue());
        return buildErrorResponse(ErrorCode.VALIDATION_ERROR,
                "Invalid value for parameter " + ex.getName(), null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Invalid argument provided: {}", ex.getMessage());
        return buildErrorResponse(ErrorCode.VALIDATION_ERROR, ex.getMessage(), null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoResourceFoundException(NoResourceFoundException ex, HttpServletRequest request) {
        log.debug("No resource for {}", request.getRequestURI());
        return buildErrorResponse(ErrorCode.NOT_FOUND, "Resource not found", null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error occurred on {}", request.getRequestURI(), ex);
        // Never echo internal detail back to the caller
        return buildErrorResponse(ErrorCode.INTERNAL, "An unexpected error occurred", null, request);
    }

    @ExceptionHandler({
        org.springframework.web.context.request.async.AsyncRequestNotUsableException.class,
        org.apache.catalina.connector.ClientAbortException.class
    })
    public ResponseEntity<Map<String, Object>> handleSseDisconnect(Exception ex) {
        Map<String, Object> body = Map.of(
            "timestamp", OffsetDateTime.now().toString(),
            "status", 499, // client closed request (used by Nginx, more accurate than 500)
            "error", "Client Closed Request",
            "message", "Event stream client disconnected or connection was lost"
        );

        // Expected when a subscriber goes away
        log.info("Event stream client disconnected: {}", ex.getMessage());

        return ResponseEntity
                .status(499)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    private ResponseEntity<ApiError> buildErrorResponse(ErrorCode code, String message, Object details,
                                                        HttpServletRequest request) {
        HttpStatus status = code.httpStatus();
        ApiError error = new ApiError(
                false,
                status.value(),
                code.name(),
                message,
                details,
                OffsetDateTime.now().toString(),
                request.getRequestURI()
        );
        return new ResponseEntity<>(error, status);
    }
}
