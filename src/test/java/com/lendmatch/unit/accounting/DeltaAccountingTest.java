package com.lendmatch.unit.accounting;

import static com.lendmatch.support.LendingStack.big;
import static org.assertj.core.api.Assertions.assertThat;

import com.lendmatch.config.MatchingConfig;
import com.lendmatch.core.accounting.AmountSplit;
import com.lendmatch.core.accounting.DeltaAccounting;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideDelta;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.domain.model.ReserveConfiguration;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.event.MarketEvent;
import com.lendmatch.event.MarketEventType;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DeltaAccountingTest {

    private static final BigInteger RAY = WadRayMath.RAY;

    private final List<Object> events = new ArrayList<>();

    private DeltaAccounting deltaAccounting;
    private Market market;

    @BeforeEach
    void setUp() {
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events::add);
        Ledger ledger = new Ledger(eventPublisherHelper, new MatchingConfig());
        market = ledger.createMarket(
                "0xdai",
                BigInteger.ZERO,
                big(5_000),
                new Indexes(MarketSideIndexes.initial(RAY), MarketSideIndexes.initial(RAY)));
        deltaAccounting = new DeltaAccounting(eventPublisherHelper);
    }

    private void setTotals(long supplyTotal, long borrowTotal) {
        market.setDelta(Side.SUPPLY, market.getDelta(Side.SUPPLY).withScaledP2PTotal(big(supplyTotal)));
        market.setDelta(Side.BORROW, market.getDelta(Side.BORROW).withScaledP2PTotal(big(borrowTotal)));
    }

    private List<MarketEventType> eventTypes() {
        List<MarketEventType> types = new ArrayList<>();
        events.stream().map(MarketEvent.class::cast).forEach(event -> types.add(event.getEventType()));
        return types;
    }

    // ==============================
    // DELTAS
    // ==============================

    @Nested
    @DisplayName("Deltas")
    class Deltas {

        @Test
        @DisplayName("Amount smaller than the delta is fully absorbed")
        void decreaseDelta_partial() {
            market.setDelta(Side.BORROW, new MarketSideDelta(big(100), big(100)));

            AmountSplit split = deltaAccounting.decreaseDelta(market, Side.BORROW, big(40), RAY);

            assertThat(split.getApplied()).isEqualTo(big(40));
            assertThat(split.getRemainder()).isEqualTo(BigInteger.ZERO);
            assertThat(market.getDelta(Side.BORROW).getScaledDelta()).isEqualTo(big(60));
            assertThat(eventTypes()).containsExactly(MarketEventType.BORROW_DELTA_UPDATED);
        }

        @Test
        @DisplayName("Amount larger than the delta consumes all of it")
        void decreaseDelta_exhausts() {
            market.setDelta(Side.SUPPLY, new MarketSideDelta(big(100), big(100)));

            AmountSplit split = deltaAccounting.decreaseDelta(market, Side.SUPPLY, big(150), RAY);

            assertThat(split.getApplied()).isEqualTo(big(100));
            assertThat(split.getRemainder()).isEqualTo(big(50));
            assertThat(market.getDelta(Side.SUPPLY).getScaledDelta()).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("No delta leaves the amount untouched and emits nothing")
        void decreaseDelta_noDelta() {
            AmountSplit split = deltaAccounting.decreaseDelta(market, Side.BORROW, big(40), RAY);

            assertThat(split.getApplied()).isEqualTo(BigInteger.ZERO);
            assertThat(split.getRemainder()).isEqualTo(big(40));
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("New delta is scaled by the pool index")
        void increaseDelta_scaled() {
            deltaAccounting.increaseDelta(market, Side.SUPPLY, big(10), RAY.multiply(BigInteger.TWO));

            assertThat(market.getDelta(Side.SUPPLY).getScaledDelta()).isEqualTo(big(5));
            assertThat(eventTypes()).containsExactly(MarketEventType.SUPPLY_DELTA_UPDATED);
        }
    }

    // ==============================
    // P2P TOTALS
    // ==============================

    @Nested
    @DisplayName("P2P totals")
    class P2PTotals {

        @Test
        @DisplayName("Increase credits the counterparty with the promoted amount and the acting side with the full amount")
        void increaseP2P() {
            BigInteger credit = deltaAccounting.increaseP2P(market, big(30), big(50), Side.SUPPLY);

            assertThat(credit).isEqualTo(big(50));
            assertThat(market.getDelta(Side.SUPPLY).getScaledP2PTotal()).isEqualTo(big(50));
            assertThat(market.getDelta(Side.BORROW).getScaledP2PTotal()).isEqualTo(big(30));
            assertThat(eventTypes()).containsExactly(MarketEventType.P2P_TOTALS_UPDATED);
        }

        @Test
        @DisplayName("Decrease never goes below zero")
        void decreaseP2P_floorsAtZero() {
            setTotals(20, 10);

            deltaAccounting.decreaseP2P(market, big(50), big(5), Side.BORROW);

            assertThat(market.getDelta(Side.BORROW).getScaledP2PTotal()).isEqualTo(big(5));
            assertThat(market.getDelta(Side.SUPPLY).getScaledP2PTotal()).isEqualTo(BigInteger.ZERO);
        }
    }

    // ==============================
    // FEE
    // ==============================

    @Nested
    @DisplayName("P2P fee")
    class Fee {

        @Test
        @DisplayName("Accrued fee is matched borrow minus matched supply")
        void accruedFee() {
            setTotals(100, 110);

            assertThat(deltaAccounting.accruedFee(market)).isEqualTo(big(10));
        }

        @Test
        @DisplayName("Idle supply and supply delta are not matched supply")
        void accruedFee_excludesIdleAndDelta() {
            setTotals(100, 100);
            market.setIdleSupply(big(10));
            market.setDelta(Side.SUPPLY, market.getDelta(Side.SUPPLY).withScaledDelta(big(5)));

            assertThat(deltaAccounting.accruedFee(market)).isEqualTo(big(15));
        }

        @Test
        @DisplayName("Repayment smaller than the fee is absorbed entirely")
        void repayFee_partial() {
            setTotals(100, 110);

            BigInteger left = deltaAccounting.repayFee(market, big(4));

            assertThat(left).isEqualTo(BigInteger.ZERO);
            assertThat(market.getDelta(Side.BORROW).getScaledP2PTotal()).isEqualTo(big(106));
        }

        @Test
        @DisplayName("Repayment larger than the fee settles it and returns the rest")
        void repayFee_settles() {
            setTotals(100, 110);

            BigInteger left = deltaAccounting.repayFee(market, big(25));

            assertThat(left).isEqualTo(big(15));
            assertThat(deltaAccounting.accruedFee(market)).isEqualTo(BigInteger.ZERO);
        }
    }

    // ==============================
    // IDLE SUPPLY
    // ==============================

    @Nested
    @DisplayName("Idle supply")
    class Idle {

        @Test
        @DisplayName("Borrowing matches idle supply first")
        void decreaseIdle() {
            market.setIdleSupply(big(30));

            AmountSplit split = deltaAccounting.decreaseIdle(market, big(50));

            assertThat(split.getApplied()).isEqualTo(big(30));
            assertThat(split.getRemainder()).isEqualTo(big(20));
            assertThat(market.getIdleSupply()).isEqualTo(BigInteger.ZERO);
            assertThat(eventTypes()).containsExactly(MarketEventType.IDLE_SUPPLY_UPDATED);
        }

        @Test
        @DisplayName("Amount above the supply cap room is parked as idle")
        void increaseIdle_aboveCap() {
            ReserveConfiguration reserve =
                    ReserveConfiguration.builder().supplyCap(big(100)).build();

            AmountSplit split = deltaAccounting.increaseIdle(market, big(50), reserve, big(80));

            assertThat(split.getApplied()).isEqualTo(big(30));
            assertThat(split.getRemainder()).isEqualTo(big(20));
            assertThat(market.getIdleSupply()).isEqualTo(big(30));
        }

        @Test
        @DisplayName("Without a supply cap nothing becomes idle")
        void increaseIdle_noCap() {
            AmountSplit split =
                    deltaAccounting.increaseIdle(market, big(50), ReserveConfiguration.builder().build(), big(1_000));

            assertThat(split.getApplied()).isEqualTo(BigInteger.ZERO);
            assertThat(split.getRemainder()).isEqualTo(big(50));
            assertThat(market.getIdleSupply()).isEqualTo(BigInteger.ZERO);
        }
    }
}
