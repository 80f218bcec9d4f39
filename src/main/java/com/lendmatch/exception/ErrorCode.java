package com.lendmatch.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHORIZED("UNAUTHORIZED", 403),
    POLICY_VIOLATION("POLICY_VIOLATION", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    POOL_ERROR("POOL_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
