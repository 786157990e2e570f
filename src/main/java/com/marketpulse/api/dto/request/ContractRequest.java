package com.marketpulse.api.dto.request;

import com.marketpulse.domain.enums.OptionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import lombok.Data;

@Data
public class ContractRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "strike is required")
    @Positive(message = "strike must be positive")
    private Double strike;

    @NotNull(message = "expiration is required")
    private LocalDate expiration;

    @NotNull(message = "optionType is required")
    private OptionType optionType;

    @Valid
    private QuoteRequest quote;
}
