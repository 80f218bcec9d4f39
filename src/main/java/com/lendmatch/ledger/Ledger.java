package com.lendmatch.ledger;

import com.lendmatch.config.MatchingConfig;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.exception.MarketNotCreatedException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of all lending state: markets, per-market user balances, and the per-user
 * sets of markets used as collateral and markets borrowed.
 *
 * <p>This is the only owner of that state; services reach it through this bean.
 *
 * <p><b>Atomicity:</b> every externally invoked operation runs through
 * {@link #execute(String, Supplier)}. Operations are serialized by a fair lock, every
 * mutation is journaled, and domain events are buffered. A thrown exception reverts the
 * journal and drops the events, so callers observe either the full effect of an
 * operation or none of it. Nested calls on the same thread join the outer operation.
 */
@Component
public class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final EventPublisherHelper eventPublisherHelper;
    private final int maxSortedUsers;

    private final MutationJournal journal = new MutationJournal();
    private final ReentrantLock lock = new ReentrantLock(true);

    private final Map<String, Market> markets = new LinkedHashMap<>();
    private final Map<String, MarketBalances> marketBalances = new HashMap<>();
    private final Map<String, Set<String>> userCollaterals = new HashMap<>();
    private final Map<String, Set<String>> userBorrows = new HashMap<>();

    public Ledger(EventPublisherHelper eventPublisherHelper, MatchingConfig matchingConfig) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.maxSortedUsers = matchingConfig.getMaxSortedUsers();
        if (maxSortedUsers <= 0) {
            throw new IllegalArgumentException("lendmatch.matching.max-sorted-users must be positive");
        }
    }

    // ========================
    // TRANSACTIONS
    // ========================

    /**
     * Runs {@code work} as one all-or-nothing operation.
     *
     * @param operation name used in logs
     * @return whatever {@code work} returns
     */
    public <T> T execute(String operation, Supplier<T> work) {
        lock.lock();
        try {
            if (journal.isOpen()) {
                return work.get();
            }
            journal.begin();
            eventPublisherHelper.beginBuffering();
            T result;
            try {
                result = work.get();
            } catch (RuntimeException | Error e) {
                int reverted = journal.rollback();
                eventPublisherHelper.discard();
                log.warn("{} rolled back, {} mutations reverted: {}", operation, reverted, e.getMessage());
                throw e;
            }
            journal.commit();
            eventPublisherHelper.flush();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a compensating action for a side effect outside the ledger, such as a
     * pool call, made by the running operation. Compensations run newest-first with the
     * ledger's own undo steps if the operation rolls back; a failing compensation is
     * logged and the remaining ones still run.
     */
    public void onRollback(String description, Runnable compensation) {
        journal.record(() -> {
            try {
                compensation.run();
                log.info("Compensated {}", description);
            } catch (RuntimeException e) {
                log.error("Compensation FAILED for {}: {}", description, e.getMessage(), e);
            }
        });
    }

    /** Runs a read-only query against a consistent view of the ledger. */
    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // MARKETS
    // ========================

    /**
     * Registers a market. Callers must check {@link #isCreated(String)} first; creation
     * is journaled like any other mutation.
     */
    public Market createMarket(String asset, BigInteger reserveFactor, BigInteger p2pIndexCursor, Indexes indexes) {
        if (markets.containsKey(asset)) {
            throw new IllegalStateException("Market already created: " + asset);
        }
        Market market = new Market(asset, reserveFactor, p2pIndexCursor, indexes, journal);
        markets.put(asset, market);
        marketBalances.put(asset, new MarketBalances(asset, maxSortedUsers, journal));
        journal.record(() -> {
            markets.remove(asset);
            marketBalances.remove(asset);
        });
        return market;
    }

    public boolean isCreated(String asset) {
        return asset != null && markets.containsKey(asset);
    }

    /**
     * @throws MarketNotCreatedException if the asset has no market
     */
    public Market getMarket(String asset) {
        Market market = markets.get(asset);
        if (market == null) {
            throw new MarketNotCreatedException(asset);
        }
        return market;
    }

    public MarketBalances getBalances(String asset) {
        MarketBalances balances = marketBalances.get(asset);
        if (balances == null) {
            throw new MarketNotCreatedException(asset);
        }
        return balances;
    }

    public List<Market> getMarkets() {
        return new ArrayList<>(markets.values());
    }

    public int getMarketCount() {
        return markets.size();
    }

    public int getMaxSortedUsers() {
        return maxSortedUsers;
    }

    // ========================
    // USER BALANCES
    // ========================

    /** Writes a supplier's scaled balances and refreshes the supplier rankings. */
    public void updateSupplier(String asset, String user, BigInteger onPool, BigInteger inP2P) {
        getBalances(asset).setBalances(Side.SUPPLY, user, onPool, inP2P);
    }

    /**
     * Writes a borrower's scaled balances and keeps the user's borrowed-markets set in
     * step with whether any debt remains.
     */
    public void updateBorrower(String asset, String user, BigInteger onPool, BigInteger inP2P) {
        getBalances(asset).setBalances(Side.BORROW, user, onPool, inP2P);
        boolean hasDebt = onPool.signum() != 0 || inP2P.signum() != 0;
        toggleMembership(userBorrows, user, asset, hasDebt);
    }

    /**
     * Writes a user's scaled collateral and toggles collateral-set membership at zero.
     */
    public void updateCollateral(String asset, String user, BigInteger scaledCollateral) {
        getBalances(asset).setCollateral(user, scaledCollateral);
        toggleMembership(userCollaterals, user, asset, scaledCollateral.signum() != 0);
    }

    public Set<String> getUserCollaterals(String user) {
        return Collections.unmodifiableSet(userCollaterals.getOrDefault(user, Set.of()));
    }

    public Set<String> getUserBorrows(String user) {
        return Collections.unmodifiableSet(userBorrows.getOrDefault(user, Set.of()));
    }

    private void toggleMembership(Map<String, Set<String>> index, String user, String asset, boolean member) {
        Set<String> assets = index.computeIfAbsent(user, u -> new LinkedHashSet<>());
        boolean wasMember = assets.contains(asset);
        if (wasMember == member) {
            return;
        }
        if (member) {
            assets.add(asset);
        } else {
            assets.remove(asset);
        }
        journal.record(() -> {
            Set<String> current = index.computeIfAbsent(user, u -> new HashSet<>());
            if (wasMember) {
                current.add(asset);
            } else {
                current.remove(asset);
            }
        });
    }
}
