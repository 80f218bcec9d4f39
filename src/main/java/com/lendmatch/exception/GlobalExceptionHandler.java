package com.lendmatch.exception;

import com.lendmatch.api.dto.response.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Turns lending failures into {@link ApiResponse} error bodies. A {@link BaseException}
 * keeps its typed reason, asset and user in the body; its {@link ErrorCode} fixes the status.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiResponse<Void>> handleLending(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode == ErrorCode.POOL_ERROR) {
            log.error("Pool failure on {} for asset {}: {}", request.getRequestURI(), ex.getAsset(), ex.getMessage());
        } else {
            log.warn(
                    "Rejected {} with {} (asset={}, user={}): {}",
                    request.getRequestURI(),
                    ex.getReasonCode(),
                    ex.getAsset(),
                    ex.getUser(),
                    ex.getMessage());
        }
        return ResponseEntity.status(errorCode.getHttpStatus()).body(ApiResponse.failure(ex, request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return webFailure(ErrorCode.VALIDATION_ERROR, "Invalid request", fieldErrors, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception ex, HttpServletRequest request) {
        return webFailure(ErrorCode.BAD_REQUEST, "Malformed request", null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return webFailure(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiResponse<Void>> webFailure(
            ErrorCode errorCode, String message, Map<String, String> fieldErrors, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiResponse.failure(errorCode, message, fieldErrors, request.getRequestURI()));
    }
}
