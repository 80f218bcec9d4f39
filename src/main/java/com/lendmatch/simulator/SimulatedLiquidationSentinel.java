package com.lendmatch.simulator;

import com.lendmatch.pool.LiquidationSentinel;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Sentinel with a manual switch. Allows liquidations until told otherwise.
 */
@Service
@ConditionalOnProperty(prefix = "lendmatch.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedLiquidationSentinel implements LiquidationSentinel {

    private final AtomicBoolean liquidationAllowed = new AtomicBoolean(true);

    public void setLiquidationAllowed(boolean allowed) {
        liquidationAllowed.set(allowed);
    }

    @Override
    public boolean isLiquidationAllowed() {
        return liquidationAllowed.get();
    }
}
