package com.marketpulse.api.dto.request;

import com.marketpulse.domain.enums.StrategyType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.Data;

@Data
public class StrategyRequest {

    @NotNull(message = "strategyType is required")
    private StrategyType strategyType;

    @Valid
    @NotEmpty(message = "legs must not be empty")
    private List<LegRequest> legs;

    /** Stock backing a covered call. */
    @PositiveOrZero(message = "sharesHeld must not be negative")
    private int sharesHeld;

    @Valid
    @NotNull(message = "market is required")
    private MarketContextRequest market;
}
