package com.lendmatch.api.dto.response;

import com.lendmatch.domain.enums.Side;
import com.lendmatch.domain.model.FlowBreakdown;
import com.lendmatch.positions.FlowResult;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the supply, borrow, repay and withdraw endpoints.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlowResponse {

    private String asset;
    private String onBehalf;
    private Side side;
    private BigInteger amount;
    private BigInteger scaledOnPool;
    private BigInteger scaledInP2P;
    private FlowBreakdown breakdown;

    public static FlowResponse from(FlowResult result) {
        return FlowResponse.builder()
                .asset(result.getAsset())
                .onBehalf(result.getOnBehalf())
                .side(result.getSide())
                .amount(result.getAmount())
                .scaledOnPool(result.getScaledOnPool())
                .scaledInP2P(result.getScaledInP2P())
                .breakdown(result.getBreakdown())
                .build();
    }
}
