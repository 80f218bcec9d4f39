package com.lendmatch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the matching engine.
 *
 * <p>{@code maxSortedUsers} bounds the sorted region of every ranking structure.
 * The default iteration budgets are used when an API caller does not pass
 * {@code maxLoops}, and the repay budget is also the one liquidations run with.
 * Properties are read from the {@code lendmatch.matching} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "lendmatch.matching")
@Getter
@Setter
public class MatchingConfig {

    private int maxSortedUsers = 1000;

    private DefaultIterations defaultIterations = new DefaultIterations();

    @Getter
    @Setter
    public static class DefaultIterations {

        private int supply = 4;

        private int borrow = 4;

        private int repay = 10;

        private int withdraw = 10;
    }
}
