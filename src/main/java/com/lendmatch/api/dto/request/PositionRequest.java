package com.lendmatch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO shared by the supply, borrow, repay and withdraw endpoints and their
 * collateral variants.
 *
 * <p>{@code receiver} is only read by borrow and withdraw flows. {@code maxLoops}
 * falls back to the configured default of the flow when omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Asset is required")
    private String asset;

    @NotNull(message = "Amount is required")
    private BigInteger amount;

    @NotBlank(message = "onBehalf is required")
    private String onBehalf;

    private String receiver;

    private Integer maxLoops;
}
