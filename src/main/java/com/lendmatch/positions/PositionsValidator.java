package com.lendmatch.positions;

import com.lendmatch.auth.PermissionManager;
import com.lendmatch.domain.Addresses;
import com.lendmatch.domain.enums.MarketAction;
import com.lendmatch.exception.AuthorizationReason;
import com.lendmatch.exception.PolicyException;
import com.lendmatch.exception.PolicyReason;
import com.lendmatch.exception.UnauthorizedException;
import com.lendmatch.exception.ValidationException;
import com.lendmatch.exception.ValidationReason;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Input, policy and permission checks run before any accounting.
 *
 * <p>Order is fixed so that a request failing several rules always reports the same
 * one: zero amount, zero address, market not created, action paused, then (where the
 * action needs it) manager permission.
 */
@Component
public class PositionsValidator {

    private final Ledger ledger;
    private final PermissionManager permissionManager;

    public PositionsValidator(Ledger ledger, PermissionManager permissionManager) {
        this.ledger = ledger;
        this.permissionManager = permissionManager;
    }

    public Market validateSupply(String asset, BigInteger amount, String onBehalf) {
        return validate(asset, amount, onBehalf, onBehalf, MarketAction.SUPPLY);
    }

    public Market validateSupplyCollateral(String asset, BigInteger amount, String onBehalf) {
        Market market = validate(asset, amount, onBehalf, onBehalf, MarketAction.SUPPLY_COLLATERAL);
        if (!market.isCollateral()) {
            throw new PolicyException(PolicyReason.ASSET_NOT_COLLATERAL, asset);
        }
        return market;
    }

    public Market validateBorrow(String asset, BigInteger amount, String onBehalf, String receiver) {
        return validate(asset, amount, onBehalf, receiver, MarketAction.BORROW);
    }

    public Market validateRepay(String asset, BigInteger amount, String onBehalf) {
        return validate(asset, amount, onBehalf, onBehalf, MarketAction.REPAY);
    }

    public Market validateWithdraw(String asset, BigInteger amount, String onBehalf, String receiver) {
        return validate(asset, amount, onBehalf, receiver, MarketAction.WITHDRAW);
    }

    public Market validateWithdrawCollateral(String asset, BigInteger amount, String onBehalf, String receiver) {
        return validate(asset, amount, onBehalf, receiver, MarketAction.WITHDRAW_COLLATERAL);
    }

    /**
     * @throws UnauthorizedException unless {@code caller} is {@code onBehalf} or an
     *     approved manager of it
     */
    public void validateManager(String caller, String onBehalf) {
        if (!permissionManager.isManagedBy(onBehalf, caller)) {
            throw new UnauthorizedException(
                    AuthorizationReason.PERMISSION_DENIED, onBehalf, caller + " is not allowed to manage " + onBehalf);
        }
    }

    public void validateMaxLoops(int maxLoops) {
        if (maxLoops < 0) {
            throw new ValidationException(ValidationReason.INVALID_MAX_LOOPS, "maxLoops must not be negative");
        }
    }

    private Market validate(String asset, BigInteger amount, String onBehalf, String receiver, MarketAction action) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ValidationReason.AMOUNT_IS_ZERO, "Amount must be positive");
        }
        if (Addresses.isZero(onBehalf) || Addresses.isZero(receiver)) {
            throw new ValidationException(ValidationReason.ADDRESS_IS_ZERO, "Address is zero");
        }
        Market market = ledger.getMarket(asset);
        if (market.getPauseStatuses().isPaused(action)) {
            throw new PolicyException(action.getPausedReason(), asset);
        }
        return market;
    }
}
