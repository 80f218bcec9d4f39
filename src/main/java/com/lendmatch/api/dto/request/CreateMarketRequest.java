package com.lendmatch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for listing an asset. Percentages are basis points (10000 = 100%).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateMarketRequest {

    @NotBlank(message = "Asset is required")
    private String asset;

    @NotNull(message = "Reserve factor is required")
    private BigInteger reserveFactor;

    @NotNull(message = "P2P index cursor is required")
    private BigInteger p2pIndexCursor;
}
