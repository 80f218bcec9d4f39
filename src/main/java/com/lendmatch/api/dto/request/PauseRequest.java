package com.lendmatch.api.dto.request;

import com.lendmatch.domain.enums.MarketAction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pauses or unpauses one action of a market, or all of them when {@code action} is null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PauseRequest {

    private MarketAction action;

    private boolean paused;
}
