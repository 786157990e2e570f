package com.marketpulse.api.dto.request;

import com.marketpulse.domain.enums.PositionDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class SingleLegRequest {

    @Valid
    @NotNull(message = "contract is required")
    private ContractRequest contract;

    @NotNull(message = "direction is required")
    private PositionDirection direction;

    @Min(value = 1, message = "contracts must be at least 1")
    private int contracts = 1;

    /** Per-share price paid or collected; the quote mid when absent. */
    @PositiveOrZero(message = "premium must not be negative")
    private Double premium;

    @Valid
    @NotNull(message = "market is required")
    private MarketContextRequest market;
}
