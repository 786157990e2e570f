package com.marketpulse.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;
import lombok.Data;

@Data
public class ImpliedVolRequest {

    @Valid
    @NotNull(message = "contract is required")
    private ContractRequest contract;

    @NotNull(message = "marketPrice is required")
    @PositiveOrZero(message = "marketPrice must not be negative")
    private Double marketPrice;

    @NotNull(message = "spot is required")
    @PositiveOrZero(message = "spot must not be negative")
    private Double spot;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    @PositiveOrZero(message = "dividendYield must not be negative")
    private double dividendYield;

    @NotNull(message = "asof is required")
    private LocalDate asof;
}
