package com.lendmatch.unit.matching;

import static com.lendmatch.support.LendingStack.big;
import static org.assertj.core.api.Assertions.assertThat;

import com.lendmatch.config.MatchingConfig;
import com.lendmatch.core.matching.MatchingEngine;
import com.lendmatch.core.matching.MatchingResult;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.MarketSideIndexes;
import com.lendmatch.domain.model.PauseStatuses;
import com.lendmatch.event.EventPublisherHelper;
import com.lendmatch.event.PositionEvent;
import com.lendmatch.event.PositionEventType;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.MarketBalances;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MatchingEngineTest {

    private static final String DAI = "0xdai";

    private final List<Object> events = new ArrayList<>();

    private Ledger ledger;
    private MatchingEngine matchingEngine;

    @BeforeEach
    void setUp() {
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events::add);
        ledger = new Ledger(eventPublisherHelper, new MatchingConfig());
        ledger.createMarket(
                DAI,
                BigInteger.ZERO,
                big(5_000),
                new Indexes(
                        MarketSideIndexes.initial(WadRayMath.RAY), MarketSideIndexes.initial(WadRayMath.RAY)));
        matchingEngine = new MatchingEngine(ledger, eventPublisherHelper);

        ledger.updateBorrower(DAI, "bob", big(50), BigInteger.ZERO);
        ledger.updateBorrower(DAI, "carol", big(30), BigInteger.ZERO);
        ledger.updateBorrower(DAI, "dave", big(20), BigInteger.ZERO);
    }

    private MarketBalances balances() {
        return ledger.getBalances(DAI);
    }

    // ==============================
    // PROMOTION
    // ==============================

    @Nested
    @DisplayName("Promotion")
    class Promotion {

        @Test
        @DisplayName("Largest pool users are promoted first")
        void promote_largestFirst() {
            MatchingResult result = matchingEngine.promote(DAI, Side.BORROW, big(70), 10);

            assertThat(result.getMatched()).isEqualTo(big(70));
            assertThat(result.getLoopsUsed()).isEqualTo(2);
            assertThat(balances().scaledPoolBorrowBalance("bob")).isEqualTo(BigInteger.ZERO);
            assertThat(balances().scaledP2PBorrowBalance("bob")).isEqualTo(big(50));
            assertThat(balances().scaledPoolBorrowBalance("carol")).isEqualTo(big(10));
            assertThat(balances().scaledP2PBorrowBalance("carol")).isEqualTo(big(20));
            assertThat(balances().scaledPoolBorrowBalance("dave")).isEqualTo(big(20));
        }

        @Test
        @DisplayName("Loop budget bounds the number of users moved")
        void promote_boundedByMaxLoops() {
            MatchingResult result = matchingEngine.promote(DAI, Side.BORROW, big(100), 1);

            assertThat(result.getMatched()).isEqualTo(big(50));
            assertThat(result.getLoopsUsed()).isEqualTo(1);
            assertThat(balances().p2p(Side.BORROW).size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Runs out of candidates before the amount is covered")
        void promote_candidatesExhausted() {
            MatchingResult result = matchingEngine.promote(DAI, Side.BORROW, big(500), 10);

            assertThat(result.getMatched()).isEqualTo(big(100));
            assertThat(result.getLoopsUsed()).isEqualTo(3);
            assertThat(balances().pool(Side.BORROW).size()).isZero();
        }

        @Test
        @DisplayName("P2P disabled makes promotion a no-op")
        void promote_p2pDisabled() {
            ledger.getMarket(DAI).setPauseStatuses(PauseStatuses.NONE.withP2PDisabled(true));

            MatchingResult result = matchingEngine.promote(DAI, Side.BORROW, big(70), 10);

            assertThat(result).isEqualTo(MatchingResult.NONE);
            assertThat(balances().scaledPoolBorrowBalance("bob")).isEqualTo(big(50));
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("Zero loop budget matches nothing")
        void promote_zeroLoops() {
            assertThat(matchingEngine.promote(DAI, Side.BORROW, big(70), 0)).isEqualTo(MatchingResult.NONE);
        }

        @Test
        @DisplayName("Every moved user gets a POSITION_UPDATED event")
        void promote_emitsPositionUpdated() {
            matchingEngine.promote(DAI, Side.BORROW, big(70), 10);

            assertThat(events)
                    .hasSize(2)
                    .allSatisfy(event -> assertThat(((PositionEvent) event).getEventType())
                            .isEqualTo(PositionEventType.POSITION_UPDATED));
            assertThat(((PositionEvent) events.get(0)).getOnBehalf()).isEqualTo("bob");
            assertThat(((PositionEvent) events.get(1)).getOnBehalf()).isEqualTo("carol");
        }
    }

    // ==============================
    // DEMOTION
    // ==============================

    @Nested
    @DisplayName("Demotion")
    class Demotion {

        @Test
        @DisplayName("Demotion moves P2P balances back to the pool, even with P2P disabled")
        void demote_worksWhenP2PDisabled() {
            matchingEngine.promote(DAI, Side.BORROW, big(100), 10);
            ledger.getMarket(DAI).setPauseStatuses(PauseStatuses.NONE.withP2PDisabled(true));

            MatchingResult result = matchingEngine.demote(DAI, Side.BORROW, big(60), 10);

            assertThat(result.getMatched()).isEqualTo(big(60));
            assertThat(balances().scaledP2PBorrowBalance("bob")).isEqualTo(BigInteger.ZERO);
            assertThat(balances().scaledPoolBorrowBalance("bob")).isEqualTo(big(50));
            assertThat(balances().scaledP2PBorrowBalance("carol")).isEqualTo(big(20));
            assertThat(balances().scaledPoolBorrowBalance("carol")).isEqualTo(big(10));
        }
    }
}
