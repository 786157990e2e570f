package com.marketpulse.api.dto.request;

import com.marketpulse.domain.enums.PositionDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class LegRequest {

    @Valid
    @NotNull(message = "contract is required")
    private ContractRequest contract;

    @NotNull(message = "direction is required")
    private PositionDirection direction;

    /** Contracts; for a covered call defaults to sharesHeld / 100, otherwise to 1. */
    @Min(value = 1, message = "quantity must be at least 1")
    private Integer quantity;

    @PositiveOrZero(message = "premium must not be negative")
    private Double premium;
}
