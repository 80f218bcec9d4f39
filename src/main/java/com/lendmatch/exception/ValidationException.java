package com.lendmatch.exception;

import lombok.Getter;

/**
 * Rejects a call whose parameters can never succeed: zero address, zero amount,
 * unknown market, nothing left to repay/withdraw. Checked before any policy or
 * authorization rule.
 */
@Getter
public class ValidationException extends BaseException {

    private final ValidationReason reason;

    public ValidationException(ValidationReason reason, String message) {
        this(reason, null, null, message);
    }

    public ValidationException(ValidationReason reason, String asset, String user, String message) {
        super(ErrorCode.VALIDATION_ERROR, reason, asset, user, message);
        this.reason = reason;
    }
}
