package com.lendmatch.exception;

import lombok.Getter;

/**
 * Thrown when a market's operator flags forbid the requested action
 * (action paused, P2P disabled, market deprecated, asset not usable as collateral).
 * Each action has its own {@link PolicyReason} so callers can tell which switch blocked them.
 */
@Getter
public class PolicyException extends BaseException {

    private final PolicyReason reason;

    public PolicyException(PolicyReason reason, String asset) {
        super(
                ErrorCode.POLICY_VIOLATION,
                reason,
                asset,
                null,
                String.format("%s on market %s", reason.getDescription(), asset));
        this.reason = reason;
    }
}
