package com.lendmatch.exception;

/**
 * Failure reported by an external collaborator (lending pool or price oracle) for one
 * asset. Propagated to the caller as-is; the ledger transaction that issued the call is
 * rolled back.
 */
public class PoolException extends BaseException {

    public PoolException(String asset, String message) {
        super(ErrorCode.POOL_ERROR, null, asset, null, message);
    }
}
