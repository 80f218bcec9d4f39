package com.lendmatch.exception;

import lombok.Getter;

/**
 * Authorization failures: the caller may not act for the target address, or the
 * risk engine refuses the borrow / collateral withdrawal / liquidation. {@code user}
 * is the position the refusal protects.
 */
@Getter
public class UnauthorizedException extends BaseException {

    private final AuthorizationReason reason;

    public UnauthorizedException(AuthorizationReason reason, String user, String message) {
        super(ErrorCode.UNAUTHORIZED, reason, null, user, message);
        this.reason = reason;
    }
}
