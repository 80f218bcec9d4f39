package com.lendmatch.event;

import com.lendmatch.domain.enums.Side;
import java.math.BigInteger;
import lombok.Builder;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a user's position in a market changes.
 *
 * <p>Money-movement events ({@code SUPPLIED}, {@code BORROWED}, {@code REPAID},
 * {@code WITHDRAWN}) carry the resulting scaled {@code (onPool, inP2P)} pair; collateral
 * events carry the resulting scaled collateral balance. {@code POSITION_UPDATED} is
 * emitted once per user moved by the matching engine and has no actor.
 *
 * <p>Events are buffered during an operation and only published once it commits, so
 * listeners never see a change that was rolled back.
 */
public class PositionEvent extends ApplicationEvent {

    private final PositionEventType eventType;
    private final Side side;
    private final String actor;
    private final String onBehalf;
    private final String receiver;
    private final String asset;
    private final BigInteger amount;
    private final BigInteger scaledOnPool;
    private final BigInteger scaledInP2P;
    private final BigInteger scaledCollateral;

    @Builder
    public PositionEvent(
            Object source,
            PositionEventType eventType,
            Side side,
            String actor,
            String onBehalf,
            String receiver,
            String asset,
            BigInteger amount,
            BigInteger scaledOnPool,
            BigInteger scaledInP2P,
            BigInteger scaledCollateral) {
        super(source);
        this.eventType = eventType;
        this.side = side;
        this.actor = actor;
        this.onBehalf = onBehalf;
        this.receiver = receiver;
        this.asset = asset;
        this.amount = amount;
        this.scaledOnPool = scaledOnPool;
        this.scaledInP2P = scaledInP2P;
        this.scaledCollateral = scaledCollateral;
    }

    public PositionEventType getEventType() {
        return eventType;
    }

    public Side getSide() {
        return side;
    }

    public String getActor() {
        return actor;
    }

    public String getOnBehalf() {
        return onBehalf;
    }

    /** Address receiving the assets for borrow/withdraw flows; null otherwise. */
    public String getReceiver() {
        return receiver;
    }

    public String getAsset() {
        return asset;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public BigInteger getScaledOnPool() {
        return scaledOnPool;
    }

    public BigInteger getScaledInP2P() {
        return scaledInP2P;
    }

    public BigInteger getScaledCollateral() {
        return scaledCollateral;
    }
}
