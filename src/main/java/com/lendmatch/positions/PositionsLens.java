package com.lendmatch.positions;

import com.lendmatch.core.accounting.DeltaAccounting;
import com.lendmatch.core.math.ScaledMath;
import com.lendmatch.core.math.WadRayMath;
import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.Indexes;
import com.lendmatch.domain.model.LiquidityData;
import com.lendmatch.domain.model.MarketSnapshot;
import com.lendmatch.domain.model.UserPosition;
import com.lendmatch.ledger.Ledger;
import com.lendmatch.ledger.Market;
import com.lendmatch.ledger.MarketBalances;
import com.lendmatch.risk.LiquidityCalculator;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Read-only queries over the ledger. Balances are valued at the markets' stored
 * indexes: supply and collateral round down, debt rounds up.
 */
@Component
public class PositionsLens {

    private final Ledger ledger;
    private final LiquidityCalculator liquidityCalculator;
    private final DeltaAccounting deltaAccounting;

    public PositionsLens(Ledger ledger, LiquidityCalculator liquidityCalculator, DeltaAccounting deltaAccounting) {
        this.ledger = ledger;
        this.liquidityCalculator = liquidityCalculator;
        this.deltaAccounting = deltaAccounting;
    }

    // ---- Balances ----

    public BigInteger supplyBalance(String asset, String user) {
        return ledger.read(() -> balance(asset, user, Side.SUPPLY));
    }

    public BigInteger borrowBalance(String asset, String user) {
        return ledger.read(() -> balance(asset, user, Side.BORROW));
    }

    public BigInteger collateralBalance(String asset, String user) {
        return ledger.read(() -> ScaledMath.value(
                ledger.getBalances(asset).scaledCollateralBalance(user),
                ledger.getMarket(asset).getIndexes().getSupply().getPoolIndex(),
                Side.SUPPLY));
    }

    public UserPosition position(String asset, String user) {
        return ledger.read(() -> {
            MarketBalances balances = ledger.getBalances(asset);
            return UserPosition.builder()
                    .asset(asset)
                    .user(user)
                    .scaledPoolSupply(balances.scaledPoolSupplyBalance(user))
                    .scaledP2PSupply(balances.scaledP2PSupplyBalance(user))
                    .scaledPoolBorrow(balances.scaledPoolBorrowBalance(user))
                    .scaledP2PBorrow(balances.scaledP2PBorrowBalance(user))
                    .scaledCollateral(balances.scaledCollateralBalance(user))
                    .supplyBalance(supplyBalance(asset, user))
                    .borrowBalance(borrowBalance(asset, user))
                    .collateralBalance(collateralBalance(asset, user))
                    .build();
        });
    }

    // ---- Risk ----

    public LiquidityData liquidityData(String user) {
        return ledger.read(() -> liquidityCalculator.liquidityData(user));
    }

    public BigInteger healthFactor(String user) {
        return ledger.read(() -> liquidityCalculator.healthFactor(user));
    }

    // ---- Markets ----

    public MarketSnapshot market(String asset) {
        return ledger.read(() -> snapshot(ledger.getMarket(asset)));
    }

    public List<MarketSnapshot> markets() {
        return ledger.read(() -> ledger.getMarkets().stream().map(this::snapshot).collect(Collectors.toList()));
    }

    private MarketSnapshot snapshot(Market market) {
        MarketBalances balances = ledger.getBalances(market.getAsset());
        Indexes indexes = market.getIndexes();
        return MarketSnapshot.builder()
                .asset(market.getAsset())
                .reserveFactor(market.getReserveFactor())
                .p2pIndexCursor(market.getP2pIndexCursor())
                .indexes(indexes)
                .deltas(market.getDeltas())
                .idleSupply(market.getIdleSupply())
                .collateral(market.isCollateral())
                .pauseStatuses(market.getPauseStatuses())
                .totalP2PSupply(WadRayMath.rayMul(
                        market.getDelta(Side.SUPPLY).getScaledP2PTotal(), indexes.getSupply().getP2pIndex()))
                .totalP2PBorrow(WadRayMath.rayMul(
                        market.getDelta(Side.BORROW).getScaledP2PTotal(), indexes.getBorrow().getP2pIndex()))
                .accruedFee(deltaAccounting.accruedFee(market))
                .poolSuppliers(balances.pool(Side.SUPPLY).size())
                .p2pSuppliers(balances.p2p(Side.SUPPLY).size())
                .poolBorrowers(balances.pool(Side.BORROW).size())
                .p2pBorrowers(balances.p2p(Side.BORROW).size())
                .build();
    }

    private BigInteger balance(String asset, String user, Side side) {
        MarketBalances balances = ledger.getBalances(asset);
        Indexes indexes = ledger.getMarket(asset).getIndexes();
        return ScaledMath.value(balances.scaledPoolBalance(side, user), indexes.get(side).getPoolIndex(), side)
                .add(ScaledMath.value(balances.scaledP2PBalance(side, user), indexes.get(side).getP2pIndex(), side));
    }
}
