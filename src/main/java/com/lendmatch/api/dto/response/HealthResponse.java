package com.lendmatch.api.dto.response;

import com.lendmatch.domain.model.LiquidityData;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A user's liquidity data in the oracle's base currency and health factor (WAD).
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthResponse {

    private String user;
    private BigInteger borrowable;
    private BigInteger maxDebt;
    private BigInteger debt;
    private BigInteger healthFactor;

    public static HealthResponse from(String user, LiquidityData data) {
        return HealthResponse.builder()
                .user(user)
                .borrowable(data.getBorrowable())
                .maxDebt(data.getMaxDebt())
                .debt(data.getDebt())
                .healthFactor(data.healthFactor())
                .build();
    }
}
