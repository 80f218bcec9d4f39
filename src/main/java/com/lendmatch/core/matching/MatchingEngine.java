package com.lendmatch.core.matching;

import com.lendmatch.core.matching.MatchingStep.StepResult;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import com.lendmatch.ledger.MarketBalances;
import com.lendmatch.ranking.RankingStructure;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Moves users of one market side between the pool and P2P buckets, biggest balances
 * first, until the requested amount is covered, the candidates run out, or the
 * iteration budget is spent.
 *
 * <p>Each iteration rewrites exactly one user's balances, so {@code maxLoops} bounds
 * the number of ranking updates a flow can trigger. Amounts are in asset units and
 * valued at the market's current indexes.
 */
@Component
public class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final Ledger ledger;
    private final EventPublisherHelper eventPublisherHelper;

    public MatchingEngine(Ledger ledger, EventPublisherHelper eventPublisherHelper) {
        this.ledger = ledger;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Promotes pool users of {@code side} into P2P. Does nothing while P2P is disabled
     * on the market.
     */
    public MatchingResult promote(String asset, Side side, BigInteger amount, int maxLoops) {
        Market market = ledger.getMarket(asset);
        if (market.isP2PDisabled()) {
            return MatchingResult.NONE;
        }
        return match(market, side, amount, maxLoops, MatchingStep.PROMOTE);
    }

    /**
     * Demotes P2P users of {@code side} back to the pool. Works even while P2P is
     * disabled, so existing matches can always be unwound.
     */
    public MatchingResult demote(String asset, Side side, BigInteger amount, int maxLoops) {
        return match(ledger.getMarket(asset), side, amount, maxLoops, MatchingStep.DEMOTE);
    }

    private MatchingResult match(Market market, Side side, BigInteger amount, int maxLoops, MatchingStep step) {
        if (amount.signum() == 0 || maxLoops <= 0) {
            return MatchingResult.NONE;
        }
        String asset = market.getAsset();
        MarketBalances balances = ledger.getBalances(asset);
        MarketSideIndexes indexes = market.getIndexes().get(side);
        RankingStructure candidates = step.candidates(balances, side);

        BigInteger remaining = amount;
        int loops = 0;
        while (loops < maxLoops && remaining.signum() > 0) {
            String user = candidates.getHead();
            if (user == null) {
                break;
            }
            StepResult result = step.apply(
                    side,
                    balances.scaledPoolBalance(side, user),
                    balances.scaledP2PBalance(side, user),
                    indexes,
                    remaining);

            if (side == Side.SUPPLY) {
                ledger.updateSupplier(asset, user, result.getOnPool(), result.getInP2P());
            } else {
                ledger.updateBorrower(asset, user, result.getOnPool(), result.getInP2P());
            }
            eventPublisherHelper.publishPositionUpdated(this, side, user, asset, result.getOnPool(), result.getInP2P());

            remaining = result.getRemaining();
            loops++;
        }

        BigInteger matched = amount.subtract(remaining);
        log.debug("{} {} {}: matched {} of {} in {} loops", asset, step, side, matched, amount, loops);
        return new MatchingResult(matched, loops);
    }
}
