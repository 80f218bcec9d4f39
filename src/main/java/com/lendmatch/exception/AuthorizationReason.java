package com.lendmatch.exception;

public enum AuthorizationReason {
    PERMISSION_DENIED,
    UNAUTHORIZED_BORROW,
    UNAUTHORIZED_WITHDRAW,
    UNAUTHORIZED_LIQUIDATE,
    SENTINEL_LIQUIDATE_NOT_ENABLED
}
