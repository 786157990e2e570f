package com.marketpulse.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.Data;

@Data
public class SymbolChainRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "riskFreeRate is required")
    private Double riskFreeRate;

    @PositiveOrZero(message = "dividendYield must not be negative")
    private double dividendYield;

    @Valid
    private List<ContractRequest> contracts;
}
