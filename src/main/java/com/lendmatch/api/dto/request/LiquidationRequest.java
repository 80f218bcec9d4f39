package com.lendmatch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Borrowed asset is required")
    private String borrowAsset;

    @NotBlank(message = "Collateral asset is required")
    private String collateralAsset;

    @NotBlank(message = "Borrower is required")
    private String borrower;

    @NotNull(message = "Max debt to cover is required")
    private BigInteger maxDebtToCover;
}
