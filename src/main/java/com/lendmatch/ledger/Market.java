package com.lendmatch.ledger;

import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Deltas;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideDelta;
import com.lendmatch.domain.model.PauseStatuses;
import java.math.BigInteger;

/**
 * Ledger record of one listed asset: indexes, deltas, idle supply and operator flags.
 *
 * <p>State is held in immutable value objects; every setter swaps the value and journals
 * the previous one so a failed operation can restore it.
 */
public class Market {

    private final String asset;
    private final BigInteger reserveFactor;
    private final BigInteger p2pIndexCursor;
    private final MutationJournal journal;

    private Indexes indexes;
    private Deltas deltas;
    private BigInteger idleSupply;
    private PauseStatuses pauseStatuses;
    private boolean collateral;

    Market(
            String asset,
            BigInteger reserveFactor,
            BigInteger p2pIndexCursor,
            Indexes indexes,
            MutationJournal journal) {
        this.asset = asset;
        this.reserveFactor = reserveFactor;
        this.p2pIndexCursor = p2pIndexCursor;
        this.indexes = indexes;
        this.journal = journal;
        this.deltas = Deltas.ZERO;
        this.idleSupply = BigInteger.ZERO;
        this.pauseStatuses = PauseStatuses.NONE;
    }

    public String getAsset() {
        return asset;
    }

    /** Always true: a market exists in the ledger only once created. */
    public boolean isCreated() {
        return true;
    }

    public BigInteger getReserveFactor() {
        return reserveFactor;
    }

    public BigInteger getP2pIndexCursor() {
        return p2pIndexCursor;
    }

    // ---- Indexes ----

    public Indexes getIndexes() {
        return indexes;
    }

    public void setIndexes(Indexes newIndexes) {
        Indexes previous = this.indexes;
        journal.record(() -> this.indexes = previous);
        this.indexes = newIndexes;
    }

    // ---- Deltas ----

    public Deltas getDeltas() {
        return deltas;
    }

    public MarketSideDelta getDelta(Side side) {
        return deltas.get(side);
    }

    public void setDelta(Side side, MarketSideDelta delta) {
        Deltas previous = this.deltas;
        journal.record(() -> this.deltas = previous);
        this.deltas = deltas.with(side, delta);
    }

    // ---- Idle supply ----

    public BigInteger getIdleSupply() {
        return idleSupply;
    }

    public void setIdleSupply(BigInteger newIdleSupply) {
        BigInteger previous = this.idleSupply;
        journal.record(() -> this.idleSupply = previous);
        this.idleSupply = newIdleSupply;
    }

    // ---- Flags ----

    public PauseStatuses getPauseStatuses() {
        return pauseStatuses;
    }

    public void setPauseStatuses(PauseStatuses newStatuses) {
        PauseStatuses previous = this.pauseStatuses;
        journal.record(() -> this.pauseStatuses = previous);
        this.pauseStatuses = newStatuses;
    }

    public boolean isCollateral() {
        return collateral;
    }

    public void setCollateral(boolean isCollateral) {
        boolean previous = this.collateral;
        journal.record(() -> this.collateral = previous);
        this.collateral = isCollateral;
    }

    public boolean isP2PDisabled() {
        return pauseStatuses.isP2PDisabled();
    }

    public boolean isDeprecated() {
        return pauseStatuses.isDeprecated();
    }

    @Override
    public String toString() {
        return "Market{" + asset + ", indexes=" + indexes + ", deltas=" + deltas + ", idle=" + idleSupply + "}";
    }
}
