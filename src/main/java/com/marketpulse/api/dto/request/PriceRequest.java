package com.marketpulse.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import lombok.Data;

@Data
public class PriceRequest {

    @Valid
    @NotNull(message = "contract is required")
    private ContractRequest contract;

    @NotNull(message = "spot is required")
    @PositiveOrZero(message = "spot must not be negative")
    private Double spot;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    @PositiveOrZero(message = "dividendYield must not be negative")
    private double dividendYield;

    @NotNull(message = "volatility is required")
    @PositiveOrZero(message = "volatility must not be negative")
    private Double volatility;

    @NotNull(message = "asof is required")
    private LocalDate asof;
}
