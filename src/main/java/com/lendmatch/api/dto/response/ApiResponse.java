package com.lendmatch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lendmatch.exception.BaseException;
import com.lendmatch.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope of every lending API body. A successful call carries {@code data}; a failed one
 * carries an {@link ErrorBody} naming the typed reason and, when the failure concerns them,
 * the market asset and the user address. Null members are omitted from the JSON.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final ErrorBody error;
    private final Instant timestamp = Instant.now();

    private ApiResponse(boolean success, T data, ErrorBody error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> failure(BaseException ex, String path) {
        return new ApiResponse<>(
                false,
                null,
                ErrorBody.builder()
                        .code(ex.getErrorCode().getCode())
                        .reason(ex.getReasonCode())
                        .message(ex.getMessage())
                        .asset(ex.getAsset())
                        .user(ex.getUser())
                        .path(path)
                        .build());
    }

    /** Failure raised by the web layer itself, before any lending code ran. */
    public static ApiResponse<Void> failure(
            ErrorCode errorCode, String message, Map<String, String> fieldErrors, String path) {
        return new ApiResponse<>(
                false,
                null,
                ErrorBody.builder()
                        .code(errorCode.getCode())
                        .message(message)
                        .fieldErrors(fieldErrors)
                        .path(path)
                        .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private final String code;
        private final String reason;
        private final String message;
        private final String asset;
        private final String user;
        private final Map<String, String> fieldErrors;
        private final String path;
    }
}
