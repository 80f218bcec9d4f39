package com.lendmatch.unit.accounting;

import static com.lendmatch.support.LendingStack.big;
import static org.assertj.core.api.Assertions.assertThat;

import com.lendmatch.config.MatchingConfig;
import com.lendmatch.core.accounting.InterestRatesModel;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideDelta;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.domain.model.ReserveIndexes;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * P2P index growth from pool index growth. Pool supply grows 10% and pool borrow 30%
 * in most cases, which puts the mid-point P2P growth at 20%.
 */
class InterestRatesModelTest {

    private static final BigInteger RAY = WadRayMath.RAY;

    private final InterestRatesModel interestRatesModel = new InterestRatesModel();
    private Ledger ledger;

    @BeforeEach
    void setUp() {
        ledger = new Ledger(new EventPublisherHelper(event -> {}), new MatchingConfig());
    }

    private static BigInteger ray(long tenths) {
        return RAY.multiply(big(tenths)).divide(BigInteger.TEN);
    }

    private Market market(String asset, long reserveFactor) {
        return ledger.createMarket(
                asset,
                big(reserveFactor),
                big(5_000),
                new Indexes(MarketSideIndexes.initial(RAY), MarketSideIndexes.initial(RAY)));
    }

    @Test
    @DisplayName("Without reserve factor both P2P indexes grow at the mid-point")
    void midPoint_noReserveFactor() {
        Market market = market("0xdai", 0);

        Indexes indexes = interestRatesModel.computeIndexes(market, new ReserveIndexes(ray(11), ray(13)));

        assertThat(indexes.getSupply().getPoolIndex()).isEqualTo(ray(11));
        assertThat(indexes.getBorrow().getPoolIndex()).isEqualTo(ray(13));
        assertThat(indexes.getSupply().getP2pIndex()).isEqualTo(ray(12));
        assertThat(indexes.getBorrow().getP2pIndex()).isEqualTo(ray(12));
    }

    @Test
    @DisplayName("Full reserve factor pins P2P growth to the pool rates")
    void fullReserveFactor_followsPool() {
        Market market = market("0xdai", 10_000);

        Indexes indexes = interestRatesModel.computeIndexes(market, new ReserveIndexes(ray(11), ray(13)));

        assertThat(indexes.getSupply().getP2pIndex()).isEqualTo(ray(11));
        assertThat(indexes.getBorrow().getP2pIndex()).isEqualTo(ray(13));
    }

    @Test
    @DisplayName("Unchanged pool indexes leave the market indexes unchanged")
    void noGrowth_unchanged() {
        Market market = market("0xdai", 1_000);

        Indexes indexes = interestRatesModel.computeIndexes(market, new ReserveIndexes(RAY, RAY));

        assertThat(indexes).isEqualTo(market.getIndexes());
    }

    @Test
    @DisplayName("Inverted pool spread makes both P2P sides follow the borrow growth")
    void invertedSpread() {
        Market market = market("0xdai", 0);

        Indexes indexes = interestRatesModel.computeIndexes(market, new ReserveIndexes(ray(13), ray(11)));

        assertThat(indexes.getSupply().getP2pIndex()).isEqualTo(ray(11));
        assertThat(indexes.getBorrow().getP2pIndex()).isEqualTo(ray(11));
    }

    @Test
    @DisplayName("Supply delta share earns pool growth instead of P2P growth")
    void supplyDelta_blendsPoolGrowth() {
        Market market = market("0xdai", 0);
        market.setDelta(Side.SUPPLY, new MarketSideDelta(big(50), big(100)));

        Indexes indexes = interestRatesModel.computeIndexes(market, new ReserveIndexes(ray(11), ray(13)));

        // half at 1.2 (P2P), half at 1.1 (pool)
        assertThat(indexes.getSupply().getP2pIndex()).isEqualTo(RAY.multiply(big(115)).divide(big(100)));
        assertThat(indexes.getBorrow().getP2pIndex()).isEqualTo(ray(12));
    }

    @Test
    @DisplayName("Idle supply share earns no growth")
    void idleSupply_earnsNothing() {
        Market market = market("0xdai", 0);
        market.setDelta(Side.SUPPLY, new MarketSideDelta(BigInteger.ZERO, big(100)));
        market.setIdleSupply(big(25));

        Indexes indexes = interestRatesModel.computeIndexes(market, new ReserveIndexes(ray(11), ray(13)));

        // three quarters at 1.2, one quarter flat
        assertThat(indexes.getSupply().getP2pIndex()).isEqualTo(RAY.multiply(big(115)).divide(big(100)));
    }
}
