package com.lendmatch.core.matching;

import com.lendmatch.core.math.ScaledMath;
import com.lendmatch.core.math.ScaledMath.Withdrawal;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.ledger.MarketBalances;
import com.lendmatch.ranking.RankingStructure;
import java.math.BigInteger;
import lombok.Value;

/**
 * What one matching iteration does to the head user's balances. Promotion moves value
 * from the pool bucket into P2P, demotion does the reverse.
 */
public enum MatchingStep {

    PROMOTE {
        @Override
        RankingStructure candidates(MarketBalances balances, Side side) {
            return balances.pool(side);
        }

        @Override
        StepResult apply(
                Side side, BigInteger onPool, BigInteger inP2P, MarketSideIndexes indexes, BigInteger remaining) {
            Withdrawal fromPool = ScaledMath.take(onPool, indexes.getPoolIndex(), remaining, side);
            BigInteger moved = fromPool.getTaken();
            BigInteger newInP2P = inP2P.add(ScaledMath.credit(moved, indexes.getP2pIndex()));
            return new StepResult(fromPool.getRemainingScaled(), newInP2P, remaining.subtract(moved));
        }
    },

    DEMOTE {
        @Override
        RankingStructure candidates(MarketBalances balances, Side side) {
            return balances.p2p(side);
        }

        @Override
        StepResult apply(
                Side side, BigInteger onPool, BigInteger inP2P, MarketSideIndexes indexes, BigInteger remaining) {
            Withdrawal fromP2P = ScaledMath.take(inP2P, indexes.getP2pIndex(), remaining, side);
            BigInteger moved = fromP2P.getTaken();
            BigInteger newOnPool = onPool.add(ScaledMath.credit(moved, indexes.getPoolIndex()));
            return new StepResult(newOnPool, fromP2P.getRemainingScaled(), remaining.subtract(moved));
        }
    };

    /** Ranking the step takes its candidates from. */
    abstract RankingStructure candidates(MarketBalances balances, Side side);

    abstract StepResult apply(
            Side side, BigInteger onPool, BigInteger inP2P, MarketSideIndexes indexes, BigInteger remaining);

    @Value
    static class StepResult {
        BigInteger onPool;
        BigInteger inP2P;
        BigInteger remaining;
    }
}
