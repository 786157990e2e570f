package com.marketpulse.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import lombok.Data;

/** Underlying-level inputs shared by all legs of a single-leg or strategy request. */
@Data
public class MarketContextRequest {

    @NotNull(message = "spot is required")
    @PositiveOrZero(message = "spot must not be negative")
    private Double spot;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    @PositiveOrZero(message = "dividendYield must not be negative")
    private double dividendYield;

    /** Overrides observed and solved volatility when set. */
    @PositiveOrZero(message = "volatility must not be negative")
    private Double volatility;

    @NotNull(message = "asof is required")
    private LocalDate asof;
}
