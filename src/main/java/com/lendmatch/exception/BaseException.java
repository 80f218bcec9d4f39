package com.lendmatch.exception;

import lombok.Getter;

/**
 * Root of every lending failure. Besides the {@link ErrorCode} that fixes the HTTP status,
 * it names the typed reason that raised it and, where the failure is scoped to one, the
 * market asset and the user address involved. Any of the three may be null.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String reasonCode;
    private final String asset;
    private final String user;

    protected BaseException(ErrorCode errorCode, Enum<?> reason, String asset, String user, String message) {
        super(message);
        this.errorCode = errorCode;
        this.reasonCode = reason != null ? reason.name() : null;
        this.asset = asset;
        this.user = user;
    }
}
