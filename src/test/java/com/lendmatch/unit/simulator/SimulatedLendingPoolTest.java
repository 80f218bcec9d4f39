package com.lendmatch.unit.simulator;

import static com.lendmatch.support.LendingStack.big;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.exception.PoolException;
import com.lendmatch.simulator.SimulatedLendingPool;
import com.lendmatch.support.LendingStack;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimulatedLendingPoolTest {

    private static final String DAI = "0xdai";

    private SimulatedLendingPool pool;

    @BeforeEach
    void setUp() {
        pool = new SimulatedLendingPool();
        pool.listReserve(DAI, LendingStack.defaultReserve(), LendingStack.indexes(WadRayMath.RAY, WadRayMath.RAY));
    }

    @Test
    @DisplayName("Supply above the supply cap is rejected")
    void supply_capExceeded() {
        pool.setConfiguration(DAI, LendingStack.defaultReserve().toBuilder().supplyCap(big(100)).build());
        pool.supply(DAI, big(100));

        assertThatThrownBy(() -> pool.supply(DAI, big(1))).isInstanceOf(PoolException.class);
        assertThat(pool.getTotalSupply(DAI)).isEqualTo(big(100));
    }

    @Test
    @DisplayName("Borrow needs available liquidity and an enabled reserve")
    void borrow_liquidityAndSwitch() {
        pool.addExternalSupply(DAI, big(50));

        assertThatThrownBy(() -> pool.borrow(DAI, big(51))).isInstanceOf(PoolException.class);
        pool.borrow(DAI, big(50));
        assertThat(pool.getTotalBorrow(DAI)).isEqualTo(big(50));

        pool.setConfiguration(DAI, LendingStack.defaultReserve().toBuilder().borrowingEnabled(false).build());
        pool.repay(DAI, big(50));
        assertThatThrownBy(() -> pool.borrow(DAI, big(1)))
                .isInstanceOf(PoolException.class)
                .hasMessageContaining("Borrowing disabled");
    }

    @Test
    @DisplayName("Totals follow the reserve indexes")
    void totals_followIndexes() {
        pool.supply(DAI, big(100));

        BigInteger grown = WadRayMath.RAY.multiply(big(12)).divide(BigInteger.TEN);
        pool.setReserveIndexes(DAI, LendingStack.indexes(grown, WadRayMath.RAY));

        assertThat(pool.getTotalSupply(DAI)).isEqualTo(big(120));
        pool.withdraw(DAI, big(120));
        assertThat(pool.getTotalSupply(DAI)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("Unlisted reserves raise PoolException")
    void unlisted() {
        assertThat(pool.isListed("0xusdc")).isFalse();
        assertThatThrownBy(() -> pool.getConfiguration("0xusdc")).isInstanceOf(PoolException.class);
    }
}
