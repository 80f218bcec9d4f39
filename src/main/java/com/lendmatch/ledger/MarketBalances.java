package com.lendmatch.ledger;

import com.lendmatch.domain.enums.Side;
import com.lendmatch.ranking.ArenaHeap;
import com.lendmatch.ranking.RankingStructure;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Scaled balances of every user in one market.
 *
 * <p>Pool and P2P balances live directly in four ranking structures (the ranking value
 * is the balance), so membership follows the non-zero rule by construction. Collateral
 * is pool-side only and is never ranked.
 */
public class MarketBalances {

    private final String asset;
    private final int maxSortedUsers;
    private final MutationJournal journal;

    private final RankingStructure poolSuppliers = new ArenaHeap();
    private final RankingStructure p2pSuppliers = new ArenaHeap();
    private final RankingStructure poolBorrowers = new ArenaHeap();
    private final RankingStructure p2pBorrowers = new ArenaHeap();
    private final Map<String, BigInteger> collateral = new HashMap<>();

    MarketBalances(String asset, int maxSortedUsers, MutationJournal journal) {
        this.asset = asset;
        this.maxSortedUsers = maxSortedUsers;
        this.journal = journal;
    }

    public String getAsset() {
        return asset;
    }

    // ---- Rankings ----

    public RankingStructure pool(Side side) {
        return side == Side.SUPPLY ? poolSuppliers : poolBorrowers;
    }

    public RankingStructure p2p(Side side) {
        return side == Side.SUPPLY ? p2pSuppliers : p2pBorrowers;
    }

    // ---- Scaled balances ----

    public BigInteger scaledPoolBalance(Side side, String user) {
        return pool(side).getValueOf(user);
    }

    public BigInteger scaledP2PBalance(Side side, String user) {
        return p2p(side).getValueOf(user);
    }

    public BigInteger scaledPoolSupplyBalance(String user) {
        return poolSuppliers.getValueOf(user);
    }

    public BigInteger scaledP2PSupplyBalance(String user) {
        return p2pSuppliers.getValueOf(user);
    }

    public BigInteger scaledPoolBorrowBalance(String user) {
        return poolBorrowers.getValueOf(user);
    }

    public BigInteger scaledP2PBorrowBalance(String user) {
        return p2pBorrowers.getValueOf(user);
    }

    public BigInteger scaledCollateralBalance(String user) {
        return collateral.getOrDefault(user, BigInteger.ZERO);
    }

    public Map<String, BigInteger> getCollateral() {
        return Collections.unmodifiableMap(collateral);
    }

    /**
     * Writes a user's pool and P2P balances for one side, keeping the rankings in sync.
     */
    void setBalances(Side side, String user, BigInteger onPool, BigInteger inP2P) {
        write(pool(side), user, onPool);
        write(p2p(side), user, inP2P);
    }

    void setCollateral(String user, BigInteger scaledBalance) {
        BigInteger previous = collateral.get(user);
        journal.record(() -> {
            if (previous == null) {
                collateral.remove(user);
            } else {
                collateral.put(user, previous);
            }
        });
        if (scaledBalance.signum() == 0) {
            collateral.remove(user);
        } else {
            collateral.put(user, scaledBalance);
        }
    }

    private void write(RankingStructure ranking, String user, BigInteger newValue) {
        BigInteger oldValue = ranking.getValueOf(user);
        if (oldValue.compareTo(newValue) == 0) {
            return;
        }
        ranking.update(user, oldValue, newValue, maxSortedUsers);
        journal.record(() -> ranking.update(user, newValue, oldValue, maxSortedUsers));
    }
}
