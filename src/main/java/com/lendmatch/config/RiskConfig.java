package com.lendmatch.config;

import com.lendmatch.risk.RiskParameters;
import java.math.BigInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskParameters} bean from application configuration.
 *
 * <p>Defaults: liquidatable below a health factor of 1.0, bad debt below 0.95, 50%
 * close factor, 100% close factor for bad debt and deprecated markets, no e-mode.
 *
 * <p>Properties prefix: {@code lendmatch.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskParameters riskParameters(
            @Value("${lendmatch.risk.default-liquidation-threshold:1000000000000000000}")
                    BigInteger defaultLiquidationThreshold,
            @Value("${lendmatch.risk.min-liquidation-threshold:950000000000000000}")
                    BigInteger minLiquidationThreshold,
            @Value("${lendmatch.risk.default-close-factor:5000}") BigInteger defaultCloseFactor,
            @Value("${lendmatch.risk.max-close-factor:10000}") BigInteger maxCloseFactor,
            @Value("${lendmatch.risk.e-mode-category-id:0}") int eModeCategoryId) {
        return RiskParameters.builder()
                .defaultLiquidationThreshold(defaultLiquidationThreshold)
                .minLiquidationThreshold(minLiquidationThreshold)
                .defaultCloseFactor(defaultCloseFactor)
                .maxCloseFactor(maxCloseFactor)
                .eModeCategoryId(eModeCategoryId)
                .build();
    }
}
